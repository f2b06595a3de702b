package com.questrail.herald.api;

/**
 * A user command could not be carried out as issued.
 *
 * <p>These are reported straight back to whoever issued the command and are
 * never retried.</p>
 */
public class CommandException extends Exception {

    public CommandException(String message) {
        super(message);
    }
}
