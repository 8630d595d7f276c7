package com.example.aspects.model;

import java.util.Objects;

/**
 * Base class for everything an actor can own. An item belongs to at most one
 * actor; unowned items live in the shared library.
 */
public abstract class Item {
    private final String id;
    private final String name;
    private String description;
    private String ownerId;
    private double weight;
    private int quantity = 1;

    protected Item(String id, String name) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name != null ? name : id;
    }

    public abstract ItemKind getKind();

    public String getId() { return id; }
    public String getName() { return name; }

    public String getDescription() { return description != null ? description : ""; }
    public void setDescription(String description) { this.description = description; }

    /** Owning actor id, or null for library items. */
    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }

    public double getWeight() { return weight; }
    public void setWeight(double weight) { this.weight = Math.max(0, weight); }

    public int getQuantity() { return quantity; }
    public void setQuantity(int quantity) { this.quantity = Math.max(0, quantity); }

    @Override
    public String toString() {
        return getKind() + "[" + id + " " + name + "]";
    }
}
