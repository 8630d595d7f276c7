package com.example.aspects.area;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Area templates that persist on the scene between rounds.
 */
public class TemplateStore {

    private static final Logger logger = LoggerFactory.getLogger(TemplateStore.class);

    private final Map<String, AreaTemplate> templates = new LinkedHashMap<>();

    public void create(AreaTemplate template) {
        templates.put(template.id(), template);
        logger.debug("[TemplateStore] Created {} {} for {} round(s)", template.shape(), template.id(), template.spec().durationRounds());
    }

    public boolean delete(String templateId) {
        return templates.remove(templateId) != null;
    }

    public Optional<AreaTemplate> find(String templateId) {
        return Optional.ofNullable(templates.get(templateId));
    }

    public Collection<AreaTemplate> all() {
        return Collections.unmodifiableCollection(new ArrayList<>(templates.values()));
    }

    /** Deletes every timed template whose duration has run out. Returns the removed ones. */
    public List<AreaTemplate> sweepExpired(int currentRound) {
        List<AreaTemplate> expired = new ArrayList<>();
        templates.values().removeIf(t -> {
            if (t.isExpired(currentRound)) {
                expired.add(t);
                return true;
            }
            return false;
        });
        if (!expired.isEmpty()) logger.info("[TemplateStore] Swept {} expired template(s) at round {}", expired.size(), currentRound);
        return expired;
    }
}
