package com.example.aspects.skill;

import com.example.aspects.model.Stat;

/** One buffed or debuffed attribute: change = round(damage roll x multiplier). */
public record EffectEntry(Stat stat, double multiplier) {
}
