package com.example.aspects.chat;

import com.example.aspects.authority.Intent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Notifier that writes everything to the log. Used when no presentation layer
 * is attached.
 */
public class LoggingNotifier implements Notifier {

    private static final Logger logger = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void notice(String participantId, String message) {
        logger.info("[Notice -> {}] {}", participantId, message);
    }

    @Override
    public void warn(String participantId, String message) {
        logger.warn("[Warning -> {}] {}", participantId, message);
    }

    @Override
    public void post(ChatMessage message) {
        logger.info("[Chat] {} | {}: {}", message.speaker(), message.flavor(), message.content());
    }

    @Override
    public void postToAuthority(ChatMessage message, List<Intent> controls) {
        logger.info("[GM] {} | {}: {} (controls: {})", message.speaker(), message.flavor(), message.content(), controls);
    }
}
