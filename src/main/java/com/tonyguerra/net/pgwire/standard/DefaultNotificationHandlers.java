package com.tonyguerra.net.pgwire.standard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tonyguerra.net.pgwire.core.PgNotification;
import com.tonyguerra.net.pgwire.handlers.NotificationHandler;

/**
 * Built-in notification handlers shipped with the library.
 *
 * A user handler registered for the same channel replaces the default one.
 */
public final class DefaultNotificationHandlers {
    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultNotificationHandlers.class);

    /**
     * Traces every notification.
     */
    @NotificationHandler(channel = NotificationHandler.ANY_CHANNEL)
    public static void trace(PgNotification notification) {
        LOGGER.debug("📢 NOTIFY {} from backend {}: {}", notification.channel(), notification.processId(),
                notification.payload());
    }
}
