package com.questrail.herald.store;

/**
 * A state write failed after all attempts. The previous committed value is
 * still in force.
 */
public class PersistenceException extends RuntimeException {

    private final String domain;

    public PersistenceException(String domain, String message, Throwable cause) {
        super(message, cause);
        this.domain = domain;
    }

    public String domain() {
        return domain;
    }
}
