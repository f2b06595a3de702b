package com.questrail.herald.observability;

import com.questrail.herald.api.Alert;

import java.time.Instant;

/**
 * An alert could not be delivered to one sink within its retry budget.
 *
 * @param cause last exception thrown by the sink, or {@code null} when the
 *              sink reported failure as a value
 */
public record DeliveryFailureEvent(
    Instant timestamp,
    String sink,
    Alert alert,
    int attempts,
    String reason,
    Throwable cause
) {
}
