package com.questrail.herald.store;

import java.time.Instant;

/**
 * Versioned on-disk wrapper around a domain state.
 *
 * @param schemaVersion envelope layout version, see {@link #CURRENT_SCHEMA}
 * @param domain        owning domain; a mismatch on load is treated as corruption
 * @param revision      incremented on every committed write
 * @param savedAt       wall-clock time of the write
 * @param state         the domain state itself
 */
public record StateEnvelope<S>(int schemaVersion,
                               String domain,
                               long revision,
                               Instant savedAt,
                               S state)
{
    public static final int CURRENT_SCHEMA = 1;
}
