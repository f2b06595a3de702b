package com.questrail.herald.api;

/**
 * DeliverySink
 * -----------------------------------------------------------------------------
 * Outbound transport for rendered alerts (a chat API, a log, a test recorder).
 *
 * Implementations report failure either by returning
 * {@link DeliveryResult#failed(String)} or by throwing; the dispatcher treats
 * both the same way and retries with backoff. Implementations must not retry
 * internally.
 */
public interface DeliverySink
{
    /**
     * Short name used in logs.
     */
    String name();

    /**
     * Sends one payload to one recipient.
     *
     * @param recipientId transport-specific recipient (group id, phone number)
     * @param payload     rendered alert text
     * @return outcome of the attempt
     */
    DeliveryResult send(String recipientId, String payload);
}
