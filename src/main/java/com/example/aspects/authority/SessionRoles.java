package com.example.aspects.authority;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Identifies the single authority participant of a session. Exactly one
 * authority exists at a time; handing the role over is an explicit call, not
 * an election.
 */
public class SessionRoles {

    private static final Logger logger = LoggerFactory.getLogger(SessionRoles.class);

    private volatile String authorityId;

    public SessionRoles(String authorityId) {
        this.authorityId = Objects.requireNonNull(authorityId, "authorityId");
    }

    public String getAuthorityId() { return authorityId; }

    public boolean isAuthority(String participantId) {
        return authorityId.equals(participantId);
    }

    public void transferAuthority(String newAuthorityId) {
        Objects.requireNonNull(newAuthorityId, "newAuthorityId");
        logger.info("[SessionRoles] Authority moved from {} to {}", authorityId, newAuthorityId);
        this.authorityId = newAuthorityId;
    }
}
