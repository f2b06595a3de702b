package com.questrail.herald.dispatch;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps a domain name to the recipient its alerts go to when the alert itself
 * names none.
 */
public final class AlertRouting {
    private final Map<String, String> recipients;

    private AlertRouting(Map<String, String> recipients) {
        this.recipients = Collections.unmodifiableMap(new HashMap<>(recipients));
    }

    public Optional<String> recipientFor(String domain) {
        return Optional.ofNullable(recipients.get(domain));
    }

    public Map<String, String> asMap() {
        return recipients;
    }

    public static AlertRouting of(Map<String, String> recipients) {
        return new AlertRouting(Objects.requireNonNull(recipients, "recipients"));
    }

    public static AlertRouting empty() {
        return new AlertRouting(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, String> recipients = new HashMap<>();

        public Builder route(String domain, String recipientId) {
            recipients.put(Objects.requireNonNull(domain, "domain"),
                    Objects.requireNonNull(recipientId, "recipientId"));
            return this;
        }

        public AlertRouting build() {
            return new AlertRouting(recipients);
        }
    }
}
