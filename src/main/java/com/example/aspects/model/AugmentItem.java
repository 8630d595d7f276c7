package com.example.aspects.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A slottable sub-item. Its stat bonuses are folded into the host gear's
 * equipment effect; its item bonuses adjust the host's armor and veil bonus.
 */
public class AugmentItem extends Item {
    private final List<StatBonus> statBonuses = new ArrayList<>();
    private final List<ItemBonus> itemBonuses = new ArrayList<>();

    public AugmentItem(String id, String name) {
        super(id, name);
    }

    @Override
    public ItemKind getKind() { return ItemKind.AUGMENT; }

    public List<StatBonus> getStatBonuses() { return statBonuses; }
    public List<ItemBonus> getItemBonuses() { return itemBonuses; }
}
