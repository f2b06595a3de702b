package com.questrail.herald.dispatch;

import com.questrail.herald.api.Alert;

/**
 * One-way, fire-and-forget hand-off from a domain task to delivery.
 *
 * <p>Implementations must return promptly and must not throw back into the
 * producing task.</p>
 */
@FunctionalInterface
public interface AlertChannel
{
    void dispatch(Alert alert);
}
