package com.questrail.herald.store;

/**
 * A persisted state record exists but cannot be read back.
 */
public class StateCorruptionException extends Exception {

    public StateCorruptionException(String message) {
        super(message);
    }

    public StateCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
