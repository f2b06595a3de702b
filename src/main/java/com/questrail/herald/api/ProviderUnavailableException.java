package com.questrail.herald.api;

/**
 * A data provider could not produce a snapshot right now.
 */
public class ProviderUnavailableException extends Exception {

    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
