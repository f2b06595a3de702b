package com.questrail.herald.domain.train;

import java.util.Objects;
import java.util.Optional;

/**
 * Ephemeral per-session context passed into train commands. Remembers the
 * last station queried so later commands may omit it. Lost on restart.
 */
public final class SessionContext {

    private final String contextId;
    private final String recipientId;
    private volatile String lastQueriedStation;

    public SessionContext(String contextId, String recipientId) {
        this.contextId = Objects.requireNonNull(contextId, "contextId");
        this.recipientId = recipientId;
    }

    public static SessionContext of(String contextId) {
        return new SessionContext(contextId, null);
    }

    public String contextId() {
        return contextId;
    }

    public Optional<String> recipientId() {
        return Optional.ofNullable(recipientId);
    }

    public Optional<String> lastQueriedStation() {
        return Optional.ofNullable(lastQueriedStation);
    }

    public void rememberStation(String crs) {
        this.lastQueriedStation = Objects.requireNonNull(crs, "crs");
    }
}
