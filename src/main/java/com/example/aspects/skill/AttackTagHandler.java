package com.example.aspects.skill;

import com.example.aspects.authority.Intent;
import com.example.aspects.chat.ChatMessage;
import com.example.aspects.model.Ability;
import com.example.aspects.model.Actor;
import com.example.aspects.roll.RollResult;
import com.example.aspects.stats.DerivedStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Rolls the shared to-hit result against the target's configured defense.
 * On a hit, damage is reduced by armor or veil and by the target's toughness
 * modifier. The result goes to the authority as a card carrying an
 * "apply damage" intent; health is never touched here.
 */
public class AttackTagHandler implements TagHandler {

    private static final Logger logger = LoggerFactory.getLogger(AttackTagHandler.class);

    @Override
    public void handle(TagContext ctx, Actor target, TargetReport report) {
        SkillItem skill = ctx.getSkill();
        AttackConfig cfg = skill.getAttack();
        DerivedStats ts = ctx.statsOf(target);
        int defense = ts.defense(cfg.defense());
        RollResult hitRoll = ctx.getHitRoll();
        boolean hit = hitRoll == null || hitRoll.total() >= defense;
        report.setHit(hit);

        String speaker = ctx.getCaster().getName();
        if (!hit) {
            String text = speaker + " misses " + target.getName() + " (" + Math.round(hitRoll.total())
                + " vs " + cfg.defense().name().toLowerCase() + " " + defense + ").";
            report.addLine(text);
            ctx.getNotifier().post(ChatMessage.of(speaker, skill.getName(), text));
            return;
        }

        double raw = ctx.getDamageRoll().total();
        int mitigation = ts.mitigation(cfg.damageType());
        int toughness = ts.mod(Ability.TOUGHNESS);
        int finalDamage = (int) Math.max(0, Math.round(raw - mitigation - toughness));
        int durabilityDamage = (int) Math.min(Math.max(0, Math.round(raw)), Math.max(0, mitigation));
        report.addDamage(finalDamage);

        String text = speaker + " hits " + target.getName()
            + (hitRoll != null ? " (" + Math.round(hitRoll.total()) + " vs " + defense + ")" : "")
            + " for " + finalDamage + " " + cfg.damageType().name().toLowerCase() + " damage"
            + " (" + Math.round(raw) + " - " + mitigation + " mitigation - " + toughness + " toughness).";
        report.addLine(text);
        logger.debug("[AttackTagHandler] {}", text);

        Intent apply = new Intent.ApplyDamage(target.getId(), finalDamage, cfg.damageType(), durabilityDamage, skill.getName());
        ctx.getNotifier().postToAuthority(ChatMessage.of(speaker, skill.getName(), text), List.of(apply));
    }
}
