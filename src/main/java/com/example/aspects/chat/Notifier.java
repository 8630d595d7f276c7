package com.example.aspects.chat;

import com.example.aspects.authority.Intent;

import java.util.List;

/**
 * Outbound side of the presentation layer: transient notices for one
 * participant, public chat cards, and cards whispered to the authority with
 * controls the authority can press.
 */
public interface Notifier {

    /** Informational notice shown only to {@code participantId}. */
    void notice(String participantId, String message);

    /** Warning shown only to {@code participantId}. Aborted actions report through here. */
    void warn(String participantId, String message);

    /** Public chat card visible to the whole session. */
    void post(ChatMessage message);

    /**
     * Card visible only to the authority, with intents it may execute, e.g.
     * an "apply damage" button.
     */
    void postToAuthority(ChatMessage message, List<Intent> controls);
}
