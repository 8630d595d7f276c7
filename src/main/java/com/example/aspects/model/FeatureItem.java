package com.example.aspects.model;

/** Flavor-only item; carries a description and nothing else. */
public class FeatureItem extends Item {

    public FeatureItem(String id, String name) {
        super(id, name);
    }

    @Override
    public ItemKind getKind() { return ItemKind.FEATURE; }
}
