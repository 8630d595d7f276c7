package com.example.aspects.equipment;

import com.example.aspects.chat.Notifier;
import com.example.aspects.effect.EffectLedger;
import com.example.aspects.effect.EffectSpec;
import com.example.aspects.model.Actor;
import com.example.aspects.model.AugmentItem;
import com.example.aspects.model.DamageType;
import com.example.aspects.model.EquipmentSlot;
import com.example.aspects.model.GearItem;
import com.example.aspects.model.Item;
import com.example.aspects.model.ItemBonus;
import com.example.aspects.model.Modifier;
import com.example.aspects.model.Stat;
import com.example.aspects.model.StatBonus;
import com.example.aspects.persistence.EntityStore;
import com.example.aspects.persistence.RulesConfig;
import com.example.aspects.stats.StatEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the derived consequences of gear in step with its state: slot rules,
 * the one generated equipment effect per equipped item, and durability.
 * <p>
 * An equipped item contributes an effect only while it is not broken. Every
 * operation that can change that (equip, unequip, damage, repair, progress)
 * re-syncs the effect and refreshes the owner's resource maxima.
 */
public class EquipmentSystem {

    private static final Logger logger = LoggerFactory.getLogger(EquipmentSystem.class);

    public static final int WEAPON_LIMIT_MULTIPLIER = 3;
    public static final String EFFECT_SUFFIX = " (Equipment)";

    private final EntityStore store;
    private final EffectLedger ledger;
    private final StatEngine engine;
    private final RulesConfig rules;
    private final Notifier notifier;

    public EquipmentSystem(EntityStore store, EffectLedger ledger, StatEngine engine, Notifier notifier) {
        this.store = store;
        this.ledger = ledger;
        this.engine = engine;
        this.rules = engine.getRules();
        this.notifier = notifier;
    }

    // --- equip / unequip -------------------------------------------------

    public boolean equip(String itemId) {
        Optional<GearItem> found = store.findItem(itemId, GearItem.class);
        if (found.isEmpty()) {
            logger.warn("[EquipmentSystem] equip: no gear item {}", itemId);
            return false;
        }
        GearItem item = found.get();
        Actor owner = ownerOf(item);
        if (owner == null) {
            logger.warn("[EquipmentSystem] equip: {} has no owner", itemId);
            return false;
        }
        if (item.isEquipped()) return true;

        SlotCheck check = canEquip(owner, item);
        if (!check.allowed()) {
            notifier.warn(owner.getOwnerId(), check.reason());
            return false;
        }
        item.setEquipped(true);
        syncEffects(owner, item);
        logger.info("[EquipmentSystem] {} equipped {} in {}", owner.getName(), item.getName(), item.getSlot().key);
        return true;
    }

    public boolean unequip(String itemId) {
        Optional<GearItem> found = store.findItem(itemId, GearItem.class);
        if (found.isEmpty()) return false;
        GearItem item = found.get();
        if (!item.isEquipped()) return true;
        item.setEquipped(false);
        Actor owner = ownerOf(item);
        if (owner != null) {
            syncEffects(owner, item);
            logger.info("[EquipmentSystem] {} unequipped {}", owner.getName(), item.getName());
        }
        return true;
    }

    /**
     * Validates the item's slot against capacity and the two-handed rule:
     * a two-hander needs the hands empty, and nothing else fits beside one.
     */
    public SlotCheck canEquip(Actor owner, GearItem item) {
        EquipmentSlot slot = item.getSlot();
        if (slot == null) return SlotCheck.denied(item.getName() + " has no valid equipment slot.");
        int capacity = rules.slotCapacity(slot);

        List<GearItem> occupying = new ArrayList<>();
        for (GearItem g : owner.getEquippedGear()) {
            if (g.getSlot() == slot && g != item) occupying.add(g);
        }

        if (slot.isHands()) {
            if (item.isTwoHanded()) {
                if (!occupying.isEmpty()) return SlotCheck.denied("Both hands must be free to equip " + item.getName() + ".");
                return SlotCheck.ok();
            }
            for (GearItem g : occupying) {
                if (g.isTwoHanded()) return SlotCheck.denied(g.getName() + " is using both hands.");
            }
        }
        if (occupying.size() >= capacity) {
            return SlotCheck.denied("No free " + slot.displayName + " slot (" + occupying.size() + "/" + capacity + ").");
        }
        return SlotCheck.ok();
    }

    // --- effect synchronisation -----------------------------------------

    /**
     * Rebuilds the single equipment effect for {@code item}: removed first,
     * then recreated only if the item is equipped and not broken.
     */
    public void syncEffects(Actor owner, GearItem item) {
        ledger.removeEffectsByOrigin(owner, item.getId());
        if (item.isEquipped() && !item.isBroken()) {
            List<Modifier> changes = buildChanges(owner, item);
            if (!changes.isEmpty()) {
                ledger.applyEffect(owner, EffectSpec.equipment(item.getName() + EFFECT_SUFFIX, item.getId(), changes));
            }
        }
        engine.refresh(owner);
    }

    List<Modifier> buildChanges(Actor owner, GearItem item) {
        Map<Stat, Double> totals = new EnumMap<>(Stat.class);
        for (StatBonus b : item.getStatBonuses()) {
            if (b.ability() != null && b.value() != 0) totals.merge(Stat.of(b.ability()), (double) b.value(), Double::sum);
        }
        for (AugmentItem aug : augmentsOf(owner, item)) {
            for (StatBonus b : aug.getStatBonuses()) {
                if (b.ability() != null && b.value() != 0) totals.merge(Stat.of(b.ability()), (double) b.value(), Double::sum);
            }
        }
        int armor = effectiveBonus(owner, item, ItemBonus.Field.ARMOR_BONUS, item.getArmorBonus());
        int veil = effectiveBonus(owner, item, ItemBonus.Field.VEIL_BONUS, item.getVeilBonus());
        if (armor > 0) totals.merge(Stat.ARMOR, (double) armor, Double::sum);
        if (veil > 0) totals.merge(Stat.VEIL, (double) veil, Double::sum);

        List<Modifier> changes = new ArrayList<>();
        for (Map.Entry<Stat, Double> e : totals.entrySet()) changes.add(Modifier.add(e.getKey(), e.getValue()));
        return changes;
    }

    /** Armor or veil bonus after slotted augments' flat and percentage item bonuses. */
    public int effectiveBonus(Actor owner, GearItem item, ItemBonus.Field field, int base) {
        double flat = 0;
        double percent = 0;
        for (AugmentItem aug : augmentsOf(owner, item)) {
            for (ItemBonus ib : aug.getItemBonuses()) {
                if (ib.field() != field) continue;
                if (ib.mode() == ItemBonus.Mode.PERCENT) percent += ib.value();
                else flat += ib.value();
            }
        }
        return (int) Math.round(base + flat + base * percent / 100.0);
    }

    private List<AugmentItem> augmentsOf(Actor owner, GearItem item) {
        List<AugmentItem> out = new ArrayList<>();
        for (String augId : item.getAugmentIds()) {
            Optional<Item> found = owner.findItem(augId);
            if (found.isEmpty()) found = store.findItem(augId);
            if (found.isPresent() && found.get() instanceof AugmentItem) {
                out.add((AugmentItem) found.get());
            } else {
                logger.warn("[EquipmentSystem] {} references missing augment {}", item.getName(), augId);
            }
        }
        return out;
    }

    // --- augments ---------------------------------------------------------

    public boolean slotAugment(String gearId, String augmentId) {
        Optional<GearItem> gear = store.findItem(gearId, GearItem.class);
        Optional<AugmentItem> aug = store.findItem(augmentId, AugmentItem.class);
        if (gear.isEmpty() || aug.isEmpty()) return false;
        GearItem item = gear.get();
        Actor owner = ownerOf(item);
        if (owner == null || !owner.getId().equals(aug.get().getOwnerId())) {
            logger.warn("[EquipmentSystem] Augment {} and {} must belong to the same actor", augmentId, gearId);
            return false;
        }
        if (item.getAugmentIds().contains(augmentId)) return true;
        if (item.getAugmentIds().size() >= item.getAugmentSlots()) {
            notifier.warn(owner.getOwnerId(), item.getName() + " has no free augment slot.");
            return false;
        }
        for (Item other : owner.getItems()) {
            if (other instanceof GearItem && other != item && ((GearItem) other).getAugmentIds().contains(augmentId)) {
                notifier.warn(owner.getOwnerId(), aug.get().getName() + " is already slotted in " + other.getName() + ".");
                return false;
            }
        }
        item.addAugmentId(augmentId);
        if (item.isEquipped()) syncEffects(owner, item);
        return true;
    }

    public boolean unslotAugment(String gearId, String augmentId) {
        Optional<GearItem> gear = store.findItem(gearId, GearItem.class);
        if (gear.isEmpty() || !gear.get().removeAugmentId(augmentId)) return false;
        Actor owner = ownerOf(gear.get());
        if (owner != null && gear.get().isEquipped()) syncEffects(owner, gear.get());
        return true;
    }

    // --- lifecycle --------------------------------------------------------

    /** New gear starts at full durability for its progress and gets augment slots from its rarity. */
    public void initializeNewGear(GearItem item) {
        item.getDurability().setMax(item.getProgress());
        item.getDurability().setValue(item.getProgress());
        item.setAugmentSlots(rules.augmentSlotsFor(item.getRarity()));
    }

    /** Progress drives the durability maximum; the current value is clamped to it. */
    public void setProgress(GearItem item, int progress) {
        boolean wasBroken = item.isBroken();
        item.setProgress(progress);
        item.getDurability().setMax(item.getProgress());
        Actor owner = ownerOf(item);
        if (owner != null && item.isEquipped() && wasBroken != item.isBroken()) syncEffects(owner, item);
    }

    /**
     * Deletes an item. Equipment effects it produced are removed and, for an
     * augment, every host referencing it is cleared.
     */
    public boolean deleteItem(String itemId) {
        Optional<Item> found = store.findItem(itemId);
        if (found.isEmpty()) return false;
        Item item = found.get();
        Actor owner = ownerOf(item);
        if (owner != null) {
            ledger.removeEffectsByOrigin(owner, itemId);
            if (item instanceof AugmentItem) {
                for (Item other : owner.getItems()) {
                    if (other instanceof GearItem && ((GearItem) other).removeAugmentId(itemId) && ((GearItem) other).isEquipped()) {
                        syncEffects(owner, (GearItem) other);
                    }
                }
            }
            engine.refresh(owner);
        }
        return store.deleteItem(itemId);
    }

    // --- durability -------------------------------------------------------

    /**
     * Uses one unit of a repair kit on {@code itemId}. The kit is deleted when
     * its quantity reaches zero.
     */
    public boolean repair(String itemId, String kitId) {
        Optional<GearItem> target = store.findItem(itemId, GearItem.class);
        Optional<GearItem> kit = store.findItem(kitId, GearItem.class);
        if (target.isEmpty() || kit.isEmpty()) return false;
        GearItem item = target.get();
        GearItem repairKit = kit.get();
        Actor owner = ownerOf(item);
        String participant = owner != null ? owner.getOwnerId() : null;
        if (!repairKit.isRepairKit() || repairKit.getQuantity() <= 0) {
            notifier.warn(participant, repairKit.getName() + " is not a usable repair kit.");
            return false;
        }
        if (item.getDurability().getMax() <= 0) {
            notifier.warn(participant, item.getName() + " has no durability to repair.");
            return false;
        }
        boolean wasBroken = item.isBroken();
        int before = item.getDurability().getValue();
        item.getDurability().setValue(before + repairKit.getRepairAmount());

        repairKit.setQuantity(repairKit.getQuantity() - 1);
        if (repairKit.getQuantity() <= 0) store.deleteItem(kitId);

        logger.info("[EquipmentSystem] Repaired {} {} -> {}", item.getName(), before, item.getDurability().getValue());
        if (owner != null && wasBroken && !item.isBroken() && item.isEquipped()) syncEffects(owner, item);
        return true;
    }

    /**
     * Splits {@code amount} equally over the actor's equipped, damaged items
     * whose material is allowed (empty list allows all). Broken items come
     * back online as soon as they are positive again. Returns durability restored.
     */
    public int repairAllEquipped(Actor actor, int amount, List<String> materials) {
        List<GearItem> damaged = new ArrayList<>();
        for (GearItem g : actor.getEquippedGear()) {
            if (g.getSlot() == null || !g.getDurability().isDamaged()) continue;
            if (materials != null && !materials.isEmpty() && !containsIgnoreCase(materials, g.getMaterial())) continue;
            damaged.add(g);
        }
        if (damaged.isEmpty() || amount <= 0) return 0;

        double perPiece = (double) amount / damaged.size();
        int restored = 0;
        for (GearItem g : damaged) {
            boolean wasBroken = g.isBroken();
            int before = g.getDurability().getValue();
            g.getDurability().setValue((int) Math.round(before + perPiece));
            restored += g.getDurability().getValue() - before;
            if (wasBroken && !g.isBroken()) syncEffects(actor, g);
        }
        logger.info("[EquipmentSystem] Repaired {} durability across {} item(s) on {}", restored, damaged.size(), actor.getName());
        return restored;
    }

    /**
     * Spreads durability damage equally over equipped non-weapon gear that
     * provides armor (physical) or veil (magical). Items reaching zero break.
     * Returns how many items were damaged.
     */
    public int degradeDurability(Actor actor, int totalDamage, DamageType damageType) {
        if (totalDamage <= 0) return 0;
        List<GearItem> eligible = new ArrayList<>();
        for (GearItem g : actor.getEquippedGear()) {
            if (g.getSlot() == null || g.getSlot().isHands()) continue;
            if (g.getDurability().getMax() <= 0 || g.getDurability().getValue() <= 0) continue;
            int bonus = damageType == DamageType.MAGICAL ? g.getVeilBonus() : g.getArmorBonus();
            if (bonus > 0) eligible.add(g);
        }
        if (eligible.isEmpty()) return 0;

        double perPiece = (double) totalDamage / eligible.size();
        for (GearItem g : eligible) {
            g.getDurability().setValue((int) Math.round(g.getDurability().getValue() - perPiece));
            if (g.isBroken()) {
                logger.info("[EquipmentSystem] {}'s {} broke", actor.getName(), g.getName());
                notifier.notice(actor.getOwnerId(), g.getName() + " has broken.");
                syncEffects(actor, g);
            }
        }
        return eligible.size();
    }

    /** A weapon withstands raw damage up to three times its progress. */
    public static int damageLimit(GearItem weapon) {
        return WEAPON_LIMIT_MULTIPLIER * weapon.getProgress();
    }

    /**
     * Subtracts raw damage above the weapon's limit from its durability.
     * Returns the excess applied.
     */
    public int degradeWeaponOnAttack(Actor actor, GearItem weapon, int rawDamage) {
        if (weapon.getSlot() != EquipmentSlot.HANDS || weapon.getDurability().getMax() <= 0) return 0;
        int excess = rawDamage - damageLimit(weapon);
        if (excess <= 0) return 0;
        int before = weapon.getDurability().getValue();
        weapon.getDurability().setValue(before - excess);
        logger.info("[EquipmentSystem] {} overstrained by {} ({} -> {})", weapon.getName(), excess,
            before, weapon.getDurability().getValue());
        if (weapon.isBroken() && weapon.isEquipped()) {
            notifier.notice(actor.getOwnerId(), weapon.getName() + " has broken.");
            syncEffects(actor, weapon);
        }
        return excess;
    }

    // --- views ------------------------------------------------------------

    public Map<EquipmentSlot, SlotUsage> slotSummary(Actor actor) {
        Map<EquipmentSlot, SlotUsage> out = new EnumMap<>(EquipmentSlot.class);
        for (EquipmentSlot slot : EquipmentSlot.values()) {
            List<String> ids = new ArrayList<>();
            for (GearItem g : actor.getEquippedGear()) if (g.getSlot() == slot) ids.add(g.getId());
            out.put(slot, new SlotUsage(slot, rules.slotCapacity(slot), ids));
        }
        return out;
    }

    private Actor ownerOf(Item item) {
        return item.getOwnerId() != null ? store.findActor(item.getOwnerId()).orElse(null) : null;
    }

    private static boolean containsIgnoreCase(List<String> values, String candidate) {
        for (String v : values) if (v != null && v.equalsIgnoreCase(candidate)) return true;
        return false;
    }
}
