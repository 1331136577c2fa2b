package com.tonyguerra.net.pgwire.core;

import com.tonyguerra.net.pgwire.core.components.ServerError;
import com.tonyguerra.net.pgwire.enums.CopyDirection;

/**
 * Outcome of one command exchange.
 *
 * @param commandTag tag of the last CommandComplete, null if none arrived
 * @param rowCount   count taken from the tag ("INSERT 0 3", "COPY 5"), -1 if it carries none
 * @param rowsSeen   DataRow messages received
 * @param copy       the COPY direction the command started, null if it was not a COPY
 * @param error      server error for a command that failed without raising, otherwise null
 */
public record CommandResult(String commandTag, long rowCount, long rowsSeen, CopyDirection copy, ServerError error) {

    public boolean isCopy() {
        return copy != null;
    }

    public boolean failed() {
        return error != null;
    }

    static long parseRowCount(String tag) {
        if (tag == null) {
            return -1;
        }

        final int space = tag.lastIndexOf(' ');
        if (space < 0) {
            return -1;
        }

        try {
            return Long.parseLong(tag.substring(space + 1));
        } catch (NumberFormatException ex) {
            return -1;
        }
    }
}
