package com.questrail.herald.api;

/**
 * The command needs a station but none was given and the session has not
 * queried one yet.
 */
public class NoContextException extends CommandException {

    public NoContextException(String message) {
        super(message);
    }
}
