package com.example.aspects.skill;

import com.example.aspects.authority.AuthorityRouter;
import com.example.aspects.chat.Notifier;
import com.example.aspects.model.Actor;
import com.example.aspects.roll.RollResult;
import com.example.aspects.stats.DerivedStats;
import com.example.aspects.stats.StatEngine;

/**
 * Everything a tag handler sees: the caster, the skill, and the single shared
 * hit and damage rolls of this activation.
 */
public class TagContext {
    private final Actor caster;
    private final SkillItem skill;
    private final RollResult hitRoll;
    private final RollResult damageRoll;
    private final StatEngine engine;
    private final AuthorityRouter router;
    private final Notifier notifier;

    public TagContext(Actor caster, SkillItem skill, RollResult hitRoll, RollResult damageRoll,
                      StatEngine engine, AuthorityRouter router, Notifier notifier) {
        this.caster = caster;
        this.skill = skill;
        this.hitRoll = hitRoll;
        this.damageRoll = damageRoll;
        this.engine = engine;
        this.router = router;
        this.notifier = notifier;
    }

    public Actor getCaster() { return caster; }
    public SkillItem getSkill() { return skill; }

    /** Null for skills without a to-hit roll. */
    public RollResult getHitRoll() { return hitRoll; }
    public RollResult getDamageRoll() { return damageRoll; }
    public AuthorityRouter getRouter() { return router; }
    public Notifier getNotifier() { return notifier; }

    public DerivedStats statsOf(Actor actor) {
        return engine.deriveStats(actor);
    }

    public int roundedDamage() {
        return (int) Math.round(damageRoll.total());
    }
}
