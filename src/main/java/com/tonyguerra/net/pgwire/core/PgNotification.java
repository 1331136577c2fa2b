package com.tonyguerra.net.pgwire.core;

import com.tonyguerra.net.pgwire.core.components.BackendMessage;

/**
 * A NOTIFY delivered to this session.
 */
public record PgNotification(int processId, String channel, String payload) {

    static PgNotification parse(BackendMessage msg) {
        final var body = msg.body();
        final int pid = body.getInt();
        final String channel = BackendMessage.readCString(body);
        final String payload = BackendMessage.readCString(body);

        return new PgNotification(pid, channel, payload);
    }
}
