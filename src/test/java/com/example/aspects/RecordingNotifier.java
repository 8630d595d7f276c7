package com.example.aspects;

import com.example.aspects.authority.Intent;
import com.example.aspects.chat.ChatMessage;
import com.example.aspects.chat.Notifier;

import java.util.ArrayList;
import java.util.List;

/**
 * Notifier that keeps everything it is given, for assertions.
 */
class RecordingNotifier implements Notifier {
    final List<String> notices = new ArrayList<>();
    final List<String> warnings = new ArrayList<>();
    final List<ChatMessage> posts = new ArrayList<>();
    final List<ChatMessage> authorityCards = new ArrayList<>();
    final List<Intent> authorityControls = new ArrayList<>();

    @Override
    public void notice(String participantId, String message) {
        notices.add(message);
    }

    @Override
    public void warn(String participantId, String message) {
        warnings.add(message);
    }

    @Override
    public void post(ChatMessage message) {
        posts.add(message);
    }

    @Override
    public void postToAuthority(ChatMessage message, List<Intent> controls) {
        authorityCards.add(message);
        authorityControls.addAll(controls);
    }

    boolean postedContaining(String text) {
        for (ChatMessage m : posts) if (m.content().contains(text)) return true;
        return false;
    }
}
