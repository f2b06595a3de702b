package com.questrail.herald.api;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Alert
 * -----------------------------------------------------------------------------
 * One unit of outbound notification produced by a domain driver.
 *
 * The payload is already rendered by the driver; the dispatcher never looks
 * inside it. When {@code recipientId} is {@code null} the dispatcher resolves
 * the recipient from the domain routing table.
 *
 * @param domain      owning domain name (e.g. {@code "budget"})
 * @param severity    delivery hint for sinks
 * @param payload     rendered text
 * @param recipientId explicit recipient, or {@code null} to route by domain
 * @param createdAt   when the driver produced the alert
 */
public record Alert(String domain,
                    AlertSeverity severity,
                    String payload,
                    String recipientId,
                    Instant createdAt)
{
    public Alert {
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    public static Alert of(String domain, AlertSeverity severity, String payload, Instant createdAt) {
        return new Alert(domain, severity, payload, null, createdAt);
    }

    public Alert withRecipient(String recipient) {
        return new Alert(domain, severity, payload, recipient, createdAt);
    }

    public Optional<String> recipient() {
        return Optional.ofNullable(recipientId);
    }
}
