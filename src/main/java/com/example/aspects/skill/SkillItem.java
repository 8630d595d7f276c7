package com.example.aspects.skill;

import com.example.aspects.area.AreaSpec;
import com.example.aspects.model.Item;
import com.example.aspects.model.ItemKind;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A skill an actor can activate. A skill with no roll configuration is
 * passive and only describes itself.
 */
public class SkillItem extends Item {
    private final Set<SkillTag> tags = EnumSet.noneOf(SkillTag.class);
    private RollConfig roll;
    private AttackConfig attack;
    private RestorationConfig restoration;
    private BuffConfig buff;
    private BuffConfig debuff;
    private RepairConfig repair;
    private AreaSpec area;
    private final List<ChainEntry> chains = new ArrayList<>();
    private String requiredWeaponId;

    public SkillItem(String id, String name) {
        super(id, name);
    }

    @Override
    public ItemKind getKind() { return ItemKind.SKILL; }

    public boolean isPassive() { return roll == null; }

    public Set<SkillTag> getTags() { return tags; }
    public boolean hasTag(SkillTag tag) { return tags.contains(tag); }

    public RollConfig getRoll() { return roll; }
    public void setRoll(RollConfig roll) { this.roll = roll; }

    public AttackConfig getAttack() { return attack != null ? attack : new AttackConfig(null, null); }
    public void setAttack(AttackConfig attack) { this.attack = attack; tags.add(SkillTag.ATTACK); }

    public RestorationConfig getRestoration() { return restoration != null ? restoration : new RestorationConfig(null, null); }
    public void setRestoration(RestorationConfig restoration) { this.restoration = restoration; tags.add(SkillTag.RESTORATION); }

    public BuffConfig getBuff() { return buff != null ? buff : BuffConfig.buff(null, false, 0); }
    public void setBuff(BuffConfig buff) { this.buff = buff; tags.add(SkillTag.BUFF); }

    public BuffConfig getDebuff() { return debuff != null ? debuff : BuffConfig.buff(null, false, 0); }
    public void setDebuff(BuffConfig debuff) { this.debuff = debuff; tags.add(SkillTag.DEBUFF); }

    public RepairConfig getRepair() { return repair != null ? repair : new RepairConfig(null); }
    public void setRepair(RepairConfig repair) { this.repair = repair; tags.add(SkillTag.REPAIR); }

    /** Area descriptor, or null for single-target skills. */
    public AreaSpec getArea() { return area; }
    public void setArea(AreaSpec area) { this.area = area; }

    public List<ChainEntry> getChains() { return chains; }

    /** Weapon item id that must be equipped to use this skill, or null. */
    public String getRequiredWeaponId() { return requiredWeaponId; }
    public void setRequiredWeaponId(String requiredWeaponId) { this.requiredWeaponId = requiredWeaponId; }
}
