package com.questrail.herald.api;

/**
 * Outcome of a single {@link DeliverySink#send(String, String)} attempt.
 *
 * @param delivered whether the sink accepted the payload
 * @param detail    failure reason, empty on success
 */
public record DeliveryResult(boolean delivered, String detail) {

    private static final DeliveryResult OK = new DeliveryResult(true, "");

    public DeliveryResult {
        detail = detail == null ? "" : detail;
    }

    public static DeliveryResult ok() {
        return OK;
    }

    public static DeliveryResult failed(String reason) {
        return new DeliveryResult(false, reason);
    }
}
