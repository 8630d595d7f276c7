package com.example.aspects.stats;

import com.example.aspects.effect.ActiveEffect;
import com.example.aspects.model.Ability;
import com.example.aspects.model.Actor;
import com.example.aspects.model.Defense;
import com.example.aspects.model.Item;
import com.example.aspects.model.Modifier;
import com.example.aspects.model.ProgressionType;
import com.example.aspects.model.Rank;
import com.example.aspects.model.ResourceType;
import com.example.aspects.model.Stat;
import com.example.aspects.persistence.RulesConfig;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Derives final abilities, modifiers, resource maxima, defenses and ranges
 * from an actor's stored base values and active effects.
 * <p>
 * Pipeline per ability:
 * <ol>
 *   <li>base, plus title contributions</li>
 *   <li>times the product of blessing multipliers, plus blessing adds = calculated</li>
 *   <li>equipment capped at 30% of calculated, then the sum of all capped
 *       equipment capped at 20% of the sum of all calculated values</li>
 *   <li>final = calculated + capped equipment + other contributions</li>
 *   <li>modifier from the sigmoid curve</li>
 * </ol>
 * Pure: never mutates the actor and never throws for malformed contributions.
 */
public class StatEngine {

    public static final double PER_STAT_EQUIPMENT_CAP = 0.30;
    public static final double GLOBAL_EQUIPMENT_CAP = 0.20;
    public static final double TOUGHNESS_SCALE = 0.5;
    public static final double VITALITY_BOOST_SCALE = 1.25;
    public static final double DEFENSE_SCALE = 1.1;
    public static final double SECONDARY_WEIGHT = 0.3;

    private final RulesConfig rules;

    public StatEngine(RulesConfig rules) {
        this.rules = rules != null ? rules : RulesConfig.defaults();
    }

    public RulesConfig getRules() { return rules; }

    /**
     * The unrounded modifier curve: {@code 6000 / (1 + e^(-0.001 (v - 500))) - 2265}.
     */
    public static double curve(double value) {
        return 6000.0 / (1.0 + Math.exp(-0.001 * (value - 500.0))) - 2265.0;
    }

    /** Modifier for an ability's final value. */
    public static int modifier(Ability ability, int finalValue, boolean vitalityBoosted) {
        double raw = curve(finalValue);
        if (ability == Ability.TOUGHNESS) return (int) Math.round(raw * TOUGHNESS_SCALE);
        if (ability == Ability.VITALITY && vitalityBoosted) return (int) Math.round(raw * VITALITY_BOOST_SCALE);
        return (int) Math.round(raw);
    }

    public Rank rankFor(Actor actor, ProgressionType type) {
        return rules.rankForLevel(actor.getProgression(type).getLevel());
    }

    public DerivedStats deriveStats(Actor actor) {
        return deriveStats(actor, actor.getEffects(), actor.getItems());
    }

    public DerivedStats deriveStats(Actor actor, Collection<ActiveEffect> effects, Collection<Item> carried) {
        Map<ProgressionType, Rank> ranks = new EnumMap<>(ProgressionType.class);
        for (ProgressionType t : ProgressionType.values()) ranks.put(t, rankFor(actor, t));
        boolean vitalityBoosted = ranks.get(ProgressionType.RACE) == rules.getVitalityBoostRank();

        Contributions c = collect(effects);

        // Stage 1: calculated values and raw equipment per ability
        Map<Ability, Integer> calculated = new EnumMap<>(Ability.class);
        Map<Ability, Integer> equipmentRaw = new EnumMap<>(Ability.class);
        Map<Ability, Integer> capped = new EnumMap<>(Ability.class);
        int totalCalculated = 0;
        int totalRaw = 0;
        int totalCapped = 0;
        for (Ability a : Ability.values()) {
            int base = actor.getBaseAbility(a);
            double afterTitles = base + c.titles.get(a);
            int calc = (int) Math.round(afterTitles * c.blessingMult.get(a)) + (int) Math.round(c.blessingAdd.get(a));
            int raw = (int) Math.round(c.equipment.get(a));
            int cap = (int) Math.floor(calc * PER_STAT_EQUIPMENT_CAP);
            int cappedValue = Math.min(raw, cap);
            calculated.put(a, calc);
            equipmentRaw.put(a, raw);
            capped.put(a, cappedValue);
            totalCalculated += calc;
            totalRaw += raw;
            totalCapped += cappedValue;
        }

        // Stage 2: global cap scales every ability down proportionally
        int globalCap = (int) Math.floor(totalCalculated * GLOBAL_EQUIPMENT_CAP);
        if (totalCapped > globalCap && totalCapped > 0) {
            double ratio = (double) globalCap / totalCapped;
            totalCapped = 0;
            for (Ability a : Ability.values()) {
                int scaled = (int) Math.floor(capped.get(a) * ratio);
                capped.put(a, scaled);
                totalCapped += scaled;
            }
        }

        // Stage 3: finals and modifiers
        Map<Ability, AbilityBreakdown> breakdowns = new EnumMap<>(Ability.class);
        for (Ability a : Ability.values()) {
            int base = actor.getBaseAbility(a);
            double titles = c.titles.get(a);
            int calc = calculated.get(a);
            int finalValue = (int) Math.round(calc + capped.get(a) + c.other.get(a));
            breakdowns.put(a, new AbilityBreakdown(a, base, titles, base + titles,
                c.blessingMult.get(a), c.blessingAdd.get(a), calc, equipmentRaw.get(a),
                (int) Math.floor(calc * PER_STAT_EQUIPMENT_CAP), capped.get(a), c.other.get(a),
                finalValue, modifier(a, finalValue, vitalityBoosted)));
        }

        Map<ResourceType, Integer> maxima = new EnumMap<>(ResourceType.class);
        maxima.put(ResourceType.HEALTH, breakdowns.get(Ability.VITALITY).mod());
        maxima.put(ResourceType.MANA, breakdowns.get(Ability.WILLPOWER).mod());
        maxima.put(ResourceType.STAMINA, breakdowns.get(Ability.ENDURANCE).mod());

        int str = breakdowns.get(Ability.STRENGTH).mod();
        int dex = breakdowns.get(Ability.DEXTERITY).mod();
        int intel = breakdowns.get(Ability.INTELLIGENCE).mod();
        int wis = breakdowns.get(Ability.WISDOM).mod();
        int will = breakdowns.get(Ability.WILLPOWER).mod();
        int per = breakdowns.get(Ability.PERCEPTION).mod();
        int end = breakdowns.get(Ability.ENDURANCE).mod();

        Map<Defense, Integer> defenses = new EnumMap<>(Defense.class);
        defenses.put(Defense.MELEE, (int) Math.round((dex + SECONDARY_WEIGHT * str) * DEFENSE_SCALE) + c.bonus(Stat.MELEE_DEFENSE));
        defenses.put(Defense.RANGED, (int) Math.round((SECONDARY_WEIGHT * dex + per) * DEFENSE_SCALE) + c.bonus(Stat.RANGED_DEFENSE));
        defenses.put(Defense.MIND, (int) Math.round((intel + SECONDARY_WEIGHT * wis) * DEFENSE_SCALE) + c.bonus(Stat.MIND_DEFENSE));
        defenses.put(Defense.SOUL, (int) Math.round((wis + SECONDARY_WEIGHT * will) * DEFENSE_SCALE) + c.bonus(Stat.SOUL_DEFENSE));

        int armor = actor.getArmorBase() + c.bonus(Stat.ARMOR);
        int veil = actor.getVeilBase() + c.bonus(Stat.VEIL);

        int castingRange = (int) Math.round(40 + per / 10.0);
        int walkRange = (int) Math.round(35 + end / 10.0);
        int carryCapacity = (int) Math.round(50 + str + 0.5 * end);
        double weight = 0;
        if (carried != null) {
            for (Item i : carried) weight += i.getWeight() * i.getQuantity();
        }
        double carryWeight = Math.round(weight * 10) / 10.0;

        DerivedStats.Summary summary = new DerivedStats.Summary(totalCalculated, globalCap, totalRaw, totalCapped);
        return new DerivedStats(breakdowns, maxima, defenses, armor, veil, castingRange, walkRange,
            carryCapacity, carryWeight, ranks, summary);
    }

    /**
     * Copies derived resource maxima onto the actor's pools, re-clamping the
     * current values.
     */
    public void applyResourceMaxima(Actor actor, DerivedStats stats) {
        for (ResourceType r : ResourceType.values()) {
            actor.getResource(r).setMax(stats.resourceMax(r));
        }
    }

    /** Derives the actor's stats and copies the resource maxima onto its pools. */
    public DerivedStats refresh(Actor actor) {
        DerivedStats stats = deriveStats(actor);
        applyResourceMaxima(actor, stats);
        return stats;
    }

    private static Contributions collect(Collection<ActiveEffect> effects) {
        Contributions c = new Contributions();
        if (effects == null) return c;
        for (ActiveEffect e : effects) {
            if (e == null || e.isDisabled()) continue;
            for (Modifier m : e.getChanges()) {
                if (m == null || m.stat() == null) continue;
                double v = m.value();
                if (Double.isNaN(v) || Double.isInfinite(v)) continue;
                Stat stat = m.stat();
                if (!stat.isAbility()) {
                    c.defenseBonus.merge(stat, v, Double::sum);
                    continue;
                }
                Ability a = stat.getAbility();
                switch (e.getCategory()) {
                    case EQUIPMENT:
                        c.equipment.merge(a, v, Double::sum);
                        break;
                    case TITLE:
                        c.titles.merge(a, v, Double::sum);
                        break;
                    case BLESSING:
                        if (m.op() == Modifier.Op.MULTIPLY) {
                            c.blessingMult.merge(a, v, (x, y) -> x * y);
                        } else {
                            c.blessingAdd.merge(a, v, Double::sum);
                        }
                        break;
                    default:
                        c.other.merge(a, v, Double::sum);
                        break;
                }
            }
        }
        return c;
    }

    /** Per-category sums gathered from active effects. */
    private static final class Contributions {
        final Map<Ability, Double> titles = zeroes(0.0);
        final Map<Ability, Double> blessingMult = zeroes(1.0);
        final Map<Ability, Double> blessingAdd = zeroes(0.0);
        final Map<Ability, Double> equipment = zeroes(0.0);
        final Map<Ability, Double> other = zeroes(0.0);
        final Map<Stat, Double> defenseBonus = new EnumMap<>(Stat.class);

        int bonus(Stat stat) {
            return (int) Math.round(defenseBonus.getOrDefault(stat, 0.0));
        }

        private static Map<Ability, Double> zeroes(double initial) {
            Map<Ability, Double> m = new EnumMap<>(Ability.class);
            for (Ability a : Ability.values()) m.put(a, initial);
            return m;
        }
    }
}
