package com.questrail.herald.api;

import java.util.Objects;

/**
 * Immediate, unscheduled reply to a user command.
 *
 * @param text rendered reply
 */
public record CommandReply(String text) {

    public CommandReply {
        Objects.requireNonNull(text, "text");
    }

    public static CommandReply of(String text) {
        return new CommandReply(text);
    }
}
