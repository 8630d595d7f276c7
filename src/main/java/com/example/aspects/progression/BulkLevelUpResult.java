package com.example.aspects.progression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-actor outcome of levelling a group at once.
 */
public class BulkLevelUpResult {
    private final List<String> succeeded = new ArrayList<>();
    private final Map<String, String> failed = new LinkedHashMap<>();

    void addSuccess(String actorName) {
        succeeded.add(actorName);
    }

    void addFailure(String actorName, String reason) {
        failed.put(actorName, reason);
    }

    public List<String> getSucceeded() { return Collections.unmodifiableList(succeeded); }

    /** Actor name to failure reason, in processing order. */
    public Map<String, String> getFailed() { return Collections.unmodifiableMap(failed); }

    public String summary() {
        StringBuilder sb = new StringBuilder("Bulk level-up: ")
            .append(succeeded.size()).append(" succeeded, ")
            .append(failed.size()).append(" failed.");
        for (Map.Entry<String, String> f : failed.entrySet()) {
            sb.append("\n- ").append(f.getKey()).append(": ").append(f.getValue());
        }
        return sb.toString();
    }
}
