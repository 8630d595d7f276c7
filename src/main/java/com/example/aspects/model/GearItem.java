package com.example.aspects.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Wearable equipment, weapons, and consumable repair kits.
 */
public class GearItem extends Item {
    private EquipmentSlot slot;
    private Rarity rarity = Rarity.COMMON;
    private boolean twoHanded;
    private String material = "";
    private boolean equipped;
    private int progress;
    private final Durability durability = new Durability(0, 0);
    private final List<StatBonus> statBonuses = new ArrayList<>();
    private int armorBonus;
    private int veilBonus;
    private int augmentSlots;
    private final List<String> augmentIds = new ArrayList<>();
    private final List<String> grantedSkillIds = new ArrayList<>();
    private boolean repairKit;
    private int repairAmount = 25;

    public GearItem(String id, String name) {
        super(id, name);
    }

    @Override
    public ItemKind getKind() { return ItemKind.GEAR; }

    public EquipmentSlot getSlot() { return slot; }
    public void setSlot(EquipmentSlot slot) { this.slot = slot; }

    public Rarity getRarity() { return rarity; }
    public void setRarity(Rarity rarity) { this.rarity = rarity != null ? rarity : Rarity.COMMON; }

    public boolean isTwoHanded() { return twoHanded; }
    public void setTwoHanded(boolean twoHanded) { this.twoHanded = twoHanded; }

    public String getMaterial() { return material; }
    public void setMaterial(String material) { this.material = material != null ? material : ""; }

    public boolean isEquipped() { return equipped; }
    public void setEquipped(boolean equipped) { this.equipped = equipped; }

    /** Crafting progress rating; the durability maximum follows it. */
    public int getProgress() { return progress; }
    public void setProgress(int progress) { this.progress = Math.max(0, progress); }

    public Durability getDurability() { return durability; }

    public List<StatBonus> getStatBonuses() { return statBonuses; }
    public void addStatBonus(Ability ability, int value) { statBonuses.add(new StatBonus(ability, value)); }

    public int getArmorBonus() { return armorBonus; }
    public void setArmorBonus(int armorBonus) { this.armorBonus = armorBonus; }

    public int getVeilBonus() { return veilBonus; }
    public void setVeilBonus(int veilBonus) { this.veilBonus = veilBonus; }

    public int getAugmentSlots() { return augmentSlots; }
    public void setAugmentSlots(int augmentSlots) { this.augmentSlots = Math.max(0, augmentSlots); }

    public List<String> getAugmentIds() { return Collections.unmodifiableList(augmentIds); }
    public void addAugmentId(String augmentId) { augmentIds.add(augmentId); }
    public boolean removeAugmentId(String augmentId) { return augmentIds.remove(augmentId); }

    public List<String> getGrantedSkillIds() { return grantedSkillIds; }

    public boolean isRepairKit() { return repairKit; }
    public void setRepairKit(boolean repairKit) { this.repairKit = repairKit; }

    public int getRepairAmount() { return repairAmount; }
    public void setRepairAmount(int repairAmount) { this.repairAmount = Math.max(0, repairAmount); }

    public boolean isBroken() { return durability.isBroken(); }
}
