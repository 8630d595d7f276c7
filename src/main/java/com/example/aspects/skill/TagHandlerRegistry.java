package com.example.aspects.skill;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Maps each {@link SkillTag} to its handler.
 */
public class TagHandlerRegistry {

    private final Map<SkillTag, TagHandler> handlers = new EnumMap<>(SkillTag.class);

    public static TagHandlerRegistry withDefaults() {
        TagHandlerRegistry r = new TagHandlerRegistry();
        r.register(SkillTag.ATTACK, new AttackTagHandler());
        r.register(SkillTag.RESTORATION, new RestorationTagHandler());
        r.register(SkillTag.BUFF, new BuffTagHandler());
        r.register(SkillTag.DEBUFF, new DebuffTagHandler());
        r.register(SkillTag.REPAIR, new RepairTagHandler());
        return r;
    }

    public void register(SkillTag tag, TagHandler handler) {
        if (tag == null || handler == null) return;
        handlers.put(tag, handler);
    }

    public TagHandler get(SkillTag tag) {
        return handlers.get(tag);
    }

    public Map<SkillTag, TagHandler> getAll() { return Collections.unmodifiableMap(handlers); }
}
