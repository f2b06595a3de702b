package com.questrail.herald.api;

/**
 * A watch request names no train, or names an unknown station shortcut.
 */
public class InvalidSubscriptionException extends CommandException {

    public InvalidSubscriptionException(String message) {
        super(message);
    }
}
