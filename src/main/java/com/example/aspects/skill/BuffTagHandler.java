package com.example.aspects.skill;

import com.example.aspects.authority.Intent;
import com.example.aspects.effect.EffectCategory;
import com.example.aspects.effect.EffectSpec;
import com.example.aspects.effect.StackPolicy;
import com.example.aspects.model.Actor;
import com.example.aspects.model.Modifier;

import java.util.ArrayList;
import java.util.List;

/**
 * Each entry becomes a change of round(damage roll x multiplier). The effect
 * is keyed by skill id and name, so recasting stacks or keeps the higher.
 */
public class BuffTagHandler implements TagHandler {

    @Override
    public void handle(TagContext ctx, Actor target, TargetReport report) {
        SkillItem skill = ctx.getSkill();
        BuffConfig cfg = skill.getBuff();
        List<Modifier> changes = changes(cfg, ctx.getDamageRoll().total(), 1);
        if (changes.isEmpty()) return;
        EffectSpec spec = new EffectSpec(skill.getName(), skill.getId(), EffectCategory.TEMPORARY, changes,
            cfg.durationRounds(), cfg.stackable() ? StackPolicy.STACK : StackPolicy.KEEP_HIGHER, null);
        report.addLine(skill.getName() + " on " + target.getName() + ": " + describe(changes));
        ctx.getRouter().submit(new Intent.ApplyEffect(target.getId(), spec));
    }

    static List<Modifier> changes(BuffConfig cfg, double roll, int sign) {
        List<Modifier> out = new ArrayList<>();
        for (EffectEntry e : cfg.entries()) {
            if (e.stat() == null) continue;
            long value = Math.round(roll * e.multiplier());
            out.add(Modifier.add(e.stat(), sign * value));
        }
        return out;
    }

    static String describe(List<Modifier> changes) {
        StringBuilder sb = new StringBuilder();
        for (Modifier m : changes) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(m.stat().getPath()).append(m.value() >= 0 ? " +" : " ").append((long) m.value());
        }
        return sb.toString();
    }
}
