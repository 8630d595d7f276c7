package com.example.aspects.persistence;

import com.example.aspects.area.AreaShape;
import com.example.aspects.area.AreaSpec;
import com.example.aspects.area.TargetingMode;
import com.example.aspects.model.Ability;
import com.example.aspects.model.AugmentItem;
import com.example.aspects.model.DamageType;
import com.example.aspects.model.Defense;
import com.example.aspects.model.EquipmentSlot;
import com.example.aspects.model.FeatureItem;
import com.example.aspects.model.GearItem;
import com.example.aspects.model.Item;
import com.example.aspects.model.ItemBonus;
import com.example.aspects.model.ProgressionType;
import com.example.aspects.model.Rank;
import com.example.aspects.model.Rarity;
import com.example.aspects.model.ResourceType;
import com.example.aspects.model.Stat;
import com.example.aspects.model.StatBonus;
import com.example.aspects.model.TemplateItem;
import com.example.aspects.skill.AttackConfig;
import com.example.aspects.skill.BuffConfig;
import com.example.aspects.skill.ChainEntry;
import com.example.aspects.skill.ChainTrigger;
import com.example.aspects.skill.EffectEntry;
import com.example.aspects.skill.RepairConfig;
import com.example.aspects.skill.RestorationConfig;
import com.example.aspects.skill.RollConfig;
import com.example.aspects.skill.SkillItem;
import com.example.aspects.skill.SkillMath;
import com.example.aspects.skill.TargetMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads shared library content (skills, gear, augments, templates, features)
 * from a classpath YAML resource into an {@link EntityStore}.
 * <p>
 * Entries without an id or name are skipped with a warning; unknown enum
 * keys fall back to their defaults.
 */
public class ContentLoader {

    private static final Logger logger = LoggerFactory.getLogger(ContentLoader.class);

    public static final String DEFAULT_RESOURCE = "/data/content.yaml";

    private final RulesConfig rules;

    public ContentLoader(RulesConfig rules) {
        this.rules = rules != null ? rules : RulesConfig.defaults();
    }

    /** Loads every section into the store's library. Returns the number of items loaded. */
    @SuppressWarnings("unchecked")
    public int load(EntityStore store, String resource) {
        try (InputStream in = ContentLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                logger.warn("[ContentLoader] {} not found on classpath", resource);
                return 0;
            }
            Object parsed = new Yaml().load(in);
            if (!(parsed instanceof Map)) {
                logger.warn("[ContentLoader] {} is not a mapping", resource);
                return 0;
            }
            Map<String, Object> root = (Map<String, Object>) parsed;
            int count = 0;
            count += loadSection(store, root, "skills", this::skill);
            count += loadSection(store, root, "gear", this::gear);
            count += loadSection(store, root, "augments", this::augment);
            count += loadSection(store, root, "templates", this::template);
            count += loadSection(store, root, "features", this::feature);
            logger.info("[ContentLoader] Loaded {} items from {}", count, resource);
            return count;
        } catch (Exception e) {
            logger.warn("[ContentLoader] Failed to load {}: {}", resource, e.getMessage());
            return 0;
        }
    }

    @FunctionalInterface
    private interface EntryParser {
        Item parse(String id, String name, Map<String, Object> data);
    }

    @SuppressWarnings("unchecked")
    private int loadSection(EntityStore store, Map<String, Object> root, String section, EntryParser parser) {
        int count = 0;
        for (Object o : YamlValues.getList(root, section)) {
            if (!(o instanceof Map)) continue;
            Map<String, Object> data = (Map<String, Object>) o;
            String id = YamlValues.getString(data, "id", null);
            String name = YamlValues.getString(data, "name", null);
            if (id == null || name == null) {
                logger.warn("[ContentLoader] Skipping {} entry without id or name: {}", section, data);
                continue;
            }
            Item item = parser.parse(id, name, data);
            item.setDescription(YamlValues.getString(data, "description", ""));
            item.setWeight(YamlValues.getDouble(data, "weight", 0));
            item.setQuantity(YamlValues.getInt(data, "quantity", 1));
            store.saveLibraryItem(item);
            count++;
        }
        return count;
    }

    SkillItem skill(String id, String name, Map<String, Object> data) {
        SkillItem skill = new SkillItem(id, name);
        Map<String, Object> roll = YamlValues.getMap(data, "roll");
        if (!roll.isEmpty()) {
            skill.setRoll(new RollConfig(
                SkillMath.fromKey(YamlValues.getString(roll, "type", null)),
                YamlValues.getString(roll, "dice", null),
                YamlValues.getDouble(roll, "diceBonus", 1),
                Ability.fromKey(YamlValues.getString(roll, "ability", null)),
                ResourceType.fromKey(YamlValues.getString(roll, "resource", null)),
                YamlValues.getInt(roll, "cost", 0)));
        }

        Map<String, Object> tags = YamlValues.getMap(data, "tags");
        if (tags.containsKey("attack")) {
            Map<String, Object> a = YamlValues.getMap(tags, "attack");
            skill.setAttack(new AttackConfig(Defense.fromKey(YamlValues.getString(a, "defense", null)),
                DamageType.fromKey(YamlValues.getString(a, "damageType", null))));
        }
        if (tags.containsKey("restoration")) {
            Map<String, Object> r = YamlValues.getMap(tags, "restoration");
            skill.setRestoration(new RestorationConfig(ResourceType.fromKey(YamlValues.getString(r, "resource", null)),
                TargetMode.fromKey(YamlValues.getString(r, "target", null))));
        }
        if (tags.containsKey("buff")) skill.setBuff(buffConfig(YamlValues.getMap(tags, "buff")));
        if (tags.containsKey("debuff")) skill.setDebuff(buffConfig(YamlValues.getMap(tags, "debuff")));
        if (tags.containsKey("repair")) {
            List<String> materials = new ArrayList<>();
            for (Object m : YamlValues.getList(YamlValues.getMap(tags, "repair"), "materials")) materials.add(String.valueOf(m));
            skill.setRepair(new RepairConfig(materials));
        }

        Map<String, Object> area = YamlValues.getMap(data, "area");
        if (!area.isEmpty()) {
            AreaShape shape = AreaShape.fromKey(YamlValues.getString(area, "shape", null));
            if (shape == null) {
                logger.warn("[ContentLoader] Skill {} has unknown area shape, ignoring area", id);
            } else {
                skill.setArea(new AreaSpec(shape, YamlValues.getDouble(area, "size", 0),
                    YamlValues.getDouble(area, "width", 0), YamlValues.getDouble(area, "angle", 0),
                    TargetingMode.fromKey(YamlValues.getString(area, "targeting", null)),
                    YamlValues.getInt(area, "duration", 0)));
            }
        }

        for (Object c : YamlValues.getList(data, "chains")) {
            if (!(c instanceof Map)) continue;
            @SuppressWarnings("unchecked")
            Map<String, Object> chain = (Map<String, Object>) c;
            String skillId = YamlValues.getString(chain, "skill", null);
            if (skillId == null) continue;
            skill.getChains().add(new ChainEntry(skillId, ChainTrigger.fromKey(YamlValues.getString(chain, "trigger", null))));
        }
        skill.setRequiredWeaponId(YamlValues.getString(data, "requiredWeapon", null));
        return skill;
    }

    private BuffConfig buffConfig(Map<String, Object> b) {
        List<EffectEntry> entries = new ArrayList<>();
        for (Object o : YamlValues.getList(b, "entries")) {
            if (!(o instanceof Map)) continue;
            @SuppressWarnings("unchecked")
            Map<String, Object> e = (Map<String, Object>) o;
            Stat stat = Stat.fromPath(YamlValues.getString(e, "stat", null));
            if (stat == null) {
                logger.warn("[ContentLoader] Unknown buff stat {}", e.get("stat"));
                continue;
            }
            entries.add(new EffectEntry(stat, YamlValues.getDouble(e, "multiplier", 1)));
        }
        return new BuffConfig(entries, YamlValues.getBoolean(b, "stackable", false),
            YamlValues.getInt(b, "duration", 0), YamlValues.getBoolean(b, "dealsDamage", false),
            DamageType.fromKey(YamlValues.getString(b, "damageType", null)));
    }

    GearItem gear(String id, String name, Map<String, Object> data) {
        GearItem gear = new GearItem(id, name);
        gear.setSlot(EquipmentSlot.fromKey(YamlValues.getString(data, "slot", null)));
        gear.setRarity(Rarity.fromKey(YamlValues.getString(data, "rarity", null)));
        gear.setTwoHanded(YamlValues.getBoolean(data, "twoHanded", false));
        gear.setMaterial(YamlValues.getString(data, "material", ""));
        gear.setProgress(YamlValues.getInt(data, "progress", 0));
        gear.getDurability().setMax(gear.getProgress());
        gear.getDurability().setValue(gear.getProgress());
        gear.setArmorBonus(YamlValues.getInt(data, "armor", 0));
        gear.setVeilBonus(YamlValues.getInt(data, "veil", 0));
        gear.setAugmentSlots(YamlValues.getInt(data, "augmentSlots", rules.augmentSlotsFor(gear.getRarity())));
        gear.setRepairKit(YamlValues.getBoolean(data, "repairKit", false));
        gear.setRepairAmount(YamlValues.getInt(data, "repairAmount", gear.getRepairAmount()));
        for (Map.Entry<String, Object> e : YamlValues.getMap(data, "bonuses").entrySet()) {
            Ability a = Ability.fromKey(e.getKey());
            if (a == null) {
                logger.warn("[ContentLoader] Gear {} has unknown bonus ability {}", id, e.getKey());
                continue;
            }
            gear.addStatBonus(a, YamlValues.toInt(e.getValue(), 0));
        }
        for (Object s : YamlValues.getList(data, "grantedSkills")) gear.getGrantedSkillIds().add(String.valueOf(s));
        return gear;
    }

    AugmentItem augment(String id, String name, Map<String, Object> data) {
        AugmentItem augment = new AugmentItem(id, name);
        for (Map.Entry<String, Object> e : YamlValues.getMap(data, "bonuses").entrySet()) {
            Ability a = Ability.fromKey(e.getKey());
            if (a != null) augment.getStatBonuses().add(new StatBonus(a, YamlValues.toInt(e.getValue(), 0)));
        }
        for (Object o : YamlValues.getList(data, "itemBonuses")) {
            if (!(o instanceof Map)) continue;
            @SuppressWarnings("unchecked")
            Map<String, Object> b = (Map<String, Object>) o;
            ItemBonus.Field field = "veil".equalsIgnoreCase(YamlValues.getString(b, "field", "armor"))
                ? ItemBonus.Field.VEIL_BONUS : ItemBonus.Field.ARMOR_BONUS;
            ItemBonus.Mode mode = "percent".equalsIgnoreCase(YamlValues.getString(b, "mode", "flat"))
                ? ItemBonus.Mode.PERCENT : ItemBonus.Mode.FLAT;
            augment.getItemBonuses().add(new ItemBonus(field, mode, YamlValues.getDouble(b, "value", 0)));
        }
        return augment;
    }

    TemplateItem template(String id, String name, Map<String, Object> data) {
        ProgressionType type = ProgressionType.fromKey(YamlValues.getString(data, "type", null));
        if (type == null) {
            logger.warn("[ContentLoader] Template {} has no progression type, assuming class", id);
            type = ProgressionType.CLASS;
        }
        TemplateItem template = new TemplateItem(id, name, type);
        for (Map.Entry<String, Object> e : YamlValues.getMap(data, "gains").entrySet()) {
            Ability a = Ability.fromKey(e.getKey());
            if (a != null) template.setGain(a, YamlValues.toInt(e.getValue(), 0));
        }
        template.setFreePointsPerLevel(YamlValues.getInt(data, "freePoints", 0));
        template.setTier(YamlValues.getInt(data, "tier", 0));
        for (Map.Entry<String, Object> r : YamlValues.getMap(data, "ranks").entrySet()) {
            Rank rank = Rank.fromKey(r.getKey());
            if (rank == null || !(r.getValue() instanceof Map)) continue;
            @SuppressWarnings("unchecked")
            Map<String, Object> byRank = (Map<String, Object>) r.getValue();
            for (Map.Entry<String, Object> e : YamlValues.getMap(byRank, "gains").entrySet()) {
                Ability a = Ability.fromKey(e.getKey());
                if (a != null) template.setRankGain(rank, a, YamlValues.toInt(e.getValue(), 0));
            }
            if (byRank.containsKey("freePoints")) template.setRankFreePoints(rank, YamlValues.getInt(byRank, "freePoints", 0));
        }
        return template;
    }

    FeatureItem feature(String id, String name, Map<String, Object> data) {
        return new FeatureItem(id, name);
    }
}
