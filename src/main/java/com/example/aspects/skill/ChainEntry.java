package com.example.aspects.skill;

/** Follow-up skill fired after the parent resolves. */
public record ChainEntry(String skillId, ChainTrigger trigger) {

    public ChainEntry {
        if (trigger == null) trigger = ChainTrigger.ALWAYS;
    }
}
