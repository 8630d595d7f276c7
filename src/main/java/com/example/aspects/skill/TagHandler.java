package com.example.aspects.skill;

import com.example.aspects.model.Actor;

/**
 * Applies one skill tag to one target. Handlers never mutate shared state
 * directly; they submit intents through the context's router.
 */
@FunctionalInterface
public interface TagHandler {

    void handle(TagContext ctx, Actor target, TargetReport report);

    /**
     * When true the handler runs once against the caster instead of once per
     * target, e.g. a self-restoration on an area skill.
     */
    default boolean appliesOnceToCaster(SkillItem skill) {
        return false;
    }
}
