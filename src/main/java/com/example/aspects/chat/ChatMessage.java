package com.example.aspects.chat;

/**
 * A chat card: who speaks, a flavor line (usually the skill name) and the body.
 */
public record ChatMessage(String speaker, String flavor, String content) {

    public static ChatMessage of(String speaker, String flavor, String content) {
        return new ChatMessage(speaker, flavor, content != null ? content : "");
    }
}
