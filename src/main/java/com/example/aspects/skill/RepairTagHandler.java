package com.example.aspects.skill;

import com.example.aspects.authority.Intent;
import com.example.aspects.model.Actor;

/** Spreads the rounded roll as durability over the target's damaged gear. */
public class RepairTagHandler implements TagHandler {

    @Override
    public void handle(TagContext ctx, Actor target, TargetReport report) {
        SkillItem skill = ctx.getSkill();
        int amount = Math.max(0, ctx.roundedDamage());
        report.addLine(skill.getName() + " repairs up to " + amount + " durability on " + target.getName() + ".");
        ctx.getRouter().submit(new Intent.RepairEquipment(target.getId(), amount, skill.getRepair().materials(), skill.getName()));
    }
}
