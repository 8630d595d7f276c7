package com.example.aspects.skill;

import com.example.aspects.authority.Intent;
import com.example.aspects.effect.DamageOverTime;
import com.example.aspects.effect.EffectCategory;
import com.example.aspects.effect.EffectSpec;
import com.example.aspects.effect.StackPolicy;
import com.example.aspects.model.Ability;
import com.example.aspects.model.Actor;
import com.example.aspects.model.Modifier;

import java.util.List;

/**
 * Negative buff. A damaging debuff deals the rounded roll minus the target's
 * toughness modifier, with armor and veil ignored. With a duration it becomes
 * damage over time, taken once per round at the caster's turn; without one it
 * hits health immediately.
 */
public class DebuffTagHandler implements TagHandler {

    @Override
    public void handle(TagContext ctx, Actor target, TargetReport report) {
        SkillItem skill = ctx.getSkill();
        BuffConfig cfg = skill.getDebuff();
        List<Modifier> changes = BuffTagHandler.changes(cfg, ctx.getDamageRoll().total(), -1);

        DamageOverTime dot = null;
        if (cfg.dealsDamage()) {
            int toughness = ctx.statsOf(target).mod(Ability.TOUGHNESS);
            int amount = Math.max(0, ctx.roundedDamage() - toughness);
            String kind = cfg.damageType().name().toLowerCase();
            if (cfg.durationRounds() > 0) {
                if (amount > 0) {
                    dot = new DamageOverTime(amount, cfg.damageType(), ctx.getCaster().getId());
                    report.addLine(target.getName() + " will suffer " + amount + " " + kind
                        + " damage each round from " + skill.getName() + ".");
                }
            } else {
                report.addDamage(amount);
                report.addLine(target.getName() + " suffers " + amount + " " + kind + " damage from " + skill.getName() + ".");
                ctx.getRouter().submit(new Intent.ApplyDamage(target.getId(), amount, cfg.damageType(), 0, skill.getName()));
            }
        }

        if (changes.isEmpty() && dot == null) return;
        EffectSpec spec = new EffectSpec(skill.getName(), skill.getId(), EffectCategory.TEMPORARY, changes,
            cfg.durationRounds(), cfg.stackable() ? StackPolicy.STACK : StackPolicy.KEEP_HIGHER, dot);
        if (!changes.isEmpty()) report.addLine(skill.getName() + " on " + target.getName() + ": " + BuffTagHandler.describe(changes));
        ctx.getRouter().submit(new Intent.ApplyEffect(target.getId(), spec));
    }
}
