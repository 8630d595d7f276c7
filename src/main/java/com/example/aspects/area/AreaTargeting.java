package com.example.aspects.area;

import com.example.aspects.model.Actor;
import com.example.aspects.model.Disposition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Chooses which actors a placed template affects.
 */
public class AreaTargeting {

    /**
     * Directed shapes are range-checked before placement starts: their
     * length may not exceed the caster's casting range.
     */
    public boolean directedShapeInRange(AreaSpec spec, int castingRange) {
        return !spec.shape().isDirected() || spec.size() <= castingRange + AreaGeometry.EPSILON;
    }

    /**
     * Every visible candidate whose center lies in the template and whose
     * disposition passes the mode. The caster is never caught in its own cone
     * or ray.
     */
    public List<Actor> selectTargets(Actor caster, AreaTemplate template, Collection<Actor> candidates) {
        List<Actor> out = new ArrayList<>();
        TargetingMode mode = template.spec().mode();
        for (Actor a : candidates) {
            if (a.isHidden()) continue;
            if (a.getId().equals(caster.getId()) && template.shape().isDirected()) continue;
            if (!AreaGeometry.contains(template, a.getPosition())) continue;
            if (!matchesMode(caster.getDisposition(), a.getDisposition(), mode)) continue;
            out.add(a);
        }
        return out;
    }

    /** Neutral casters match nothing when filtering for enemies or allies. */
    static boolean matchesMode(Disposition caster, Disposition target, TargetingMode mode) {
        switch (mode) {
            case ENEMIES:
                return caster.opposes(target);
            case ALLIES:
                return caster != Disposition.NEUTRAL && caster == target;
            case ALL:
            default:
                return true;
        }
    }
}
