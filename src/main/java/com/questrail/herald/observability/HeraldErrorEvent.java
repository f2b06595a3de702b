package com.questrail.herald.observability;

import java.time.Instant;

/**
 * An error handled inside a domain task.
 *
 * @param domain domain the failure is confined to, or {@code "dispatcher"} /
 *               {@code "runtime"} for kernel-level failures
 */
public record HeraldErrorEvent(
    Instant timestamp,
    String domain,
    Kind kind,
    String message,
    Throwable cause
) {
    /**
     * Failure taxonomy; decides how loudly the SLF4J sink logs.
     */
    public enum Kind {
        /** Data provider unavailable; retried on the next tick. */
        TRANSIENT_PROVIDER,
        /** State write failed; the dependent alerts were withheld. */
        PERSISTENCE,
        /** Persisted state unreadable; the domain restarted from defaults. */
        STATE_CORRUPTION,
        /** Anything else caught by a task loop. */
        UNEXPECTED
    }
}
