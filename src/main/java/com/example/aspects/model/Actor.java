package com.example.aspects.model;

import com.example.aspects.effect.ActiveEffect;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A character, NPC or familiar. Holds only stored state: ability base values,
 * resource pools, progression, owned items and active effects. Final ability
 * values and derived numbers come from the stat engine.
 */
public class Actor {
    public static final int DEFAULT_ABILITY_BASE = 5;

    private final String id;
    private final String name;
    private final ActorType type;
    private String ownerId;
    private Disposition disposition = Disposition.NEUTRAL;
    private boolean hidden;
    private Point position = new Point(0, 0);

    private final Map<Ability, Integer> baseAbilities = new EnumMap<>(Ability.class);
    private final Map<ResourceType, ResourcePool> resources = new EnumMap<>(ResourceType.class);
    private final Map<ProgressionType, Progression> progressions = new EnumMap<>(ProgressionType.class);
    private int armorBase;
    private int veilBase;
    private int freePoints;

    private final List<Item> items = new ArrayList<>();
    private final List<ActiveEffect> effects = new ArrayList<>();

    public Actor(String id, String name, ActorType type) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name != null ? name : id;
        this.type = type != null ? type : ActorType.CHARACTER;
        for (Ability a : Ability.values()) baseAbilities.put(a, DEFAULT_ABILITY_BASE);
        for (ResourceType r : ResourceType.values()) resources.put(r, new ResourcePool(0, 0));
        for (ProgressionType p : ProgressionType.values()) progressions.put(p, new Progression(p, 0, null));
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public ActorType getType() { return type; }

    /** Participant that controls this actor; null means only the authority may write it. */
    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }

    public boolean isOwnedBy(String participantId) {
        return ownerId != null && ownerId.equals(participantId);
    }

    public Disposition getDisposition() { return disposition; }
    public void setDisposition(Disposition disposition) { this.disposition = disposition != null ? disposition : Disposition.NEUTRAL; }

    public boolean isHidden() { return hidden; }
    public void setHidden(boolean hidden) { this.hidden = hidden; }

    public Point getPosition() { return position; }
    public void setPosition(Point position) { this.position = position != null ? position : new Point(0, 0); }

    public int getBaseAbility(Ability ability) { return baseAbilities.getOrDefault(ability, 0); }
    public void setBaseAbility(Ability ability, int value) { baseAbilities.put(ability, value); }

    public ResourcePool getResource(ResourceType type) { return resources.get(type); }

    public Progression getProgression(ProgressionType type) { return progressions.get(type); }

    public int getArmorBase() { return armorBase; }
    public void setArmorBase(int armorBase) { this.armorBase = armorBase; }

    public int getVeilBase() { return veilBase; }
    public void setVeilBase(int veilBase) { this.veilBase = veilBase; }

    public int getFreePoints() { return freePoints; }
    public void setFreePoints(int freePoints) { this.freePoints = Math.max(0, freePoints); }

    public List<Item> getItems() { return items; }

    public void addItem(Item item) {
        item.setOwnerId(id);
        items.add(item);
    }

    public boolean removeItem(Item item) {
        boolean removed = items.remove(item);
        if (removed) item.setOwnerId(null);
        return removed;
    }

    public Optional<Item> findItem(String itemId) {
        for (Item i : items) if (i.getId().equals(itemId)) return Optional.of(i);
        return Optional.empty();
    }

    public List<GearItem> getEquippedGear() {
        List<GearItem> out = new ArrayList<>();
        for (Item i : items) {
            if (i instanceof GearItem && ((GearItem) i).isEquipped()) out.add((GearItem) i);
        }
        return out;
    }

    /** Live effect list; owned by the effect ledger. */
    public List<ActiveEffect> getEffects() { return effects; }

    @Override
    public String toString() {
        return "Actor[" + id + " " + name + "]";
    }
}
