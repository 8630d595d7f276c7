package com.example.aspects.skill;

import com.example.aspects.authority.Intent;
import com.example.aspects.model.Actor;
import com.example.aspects.model.ResourcePool;

/**
 * Adds the rounded damage roll to a resource, capped at its maximum. The
 * report carries the amount the read model says will actually land.
 */
public class RestorationTagHandler implements TagHandler {

    @Override
    public boolean appliesOnceToCaster(SkillItem skill) {
        return skill.getRestoration().target() == TargetMode.SELF;
    }

    @Override
    public void handle(TagContext ctx, Actor target, TargetReport report) {
        SkillItem skill = ctx.getSkill();
        RestorationConfig cfg = skill.getRestoration();
        Actor recipient = cfg.target() == TargetMode.SELF ? ctx.getCaster() : target;
        int amount = Math.max(0, ctx.roundedDamage());

        ResourcePool pool = recipient.getResource(cfg.resource());
        int expected = Math.max(0, Math.min(amount, pool.getMax() - pool.getCurrent()));
        report.setRestored(expected);
        report.addLine(recipient.getName() + " restores " + expected + " " + cfg.resource().displayName
            + (expected < amount ? " (rolled " + amount + ")" : "") + ".");

        ctx.getRouter().submit(new Intent.RestoreResource(recipient.getId(), cfg.resource(), amount, skill.getName()));
    }
}
