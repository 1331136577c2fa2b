package com.tonyguerra.net.pgwire.handlers;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method that receives notifications for a LISTEN channel.
 *
 * Supported signatures: {@code ()}, {@code (PgNotification)} and
 * {@code (Connector, PgNotification)}. Use {@link #ANY_CHANNEL} to receive every channel.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface NotificationHandler {
    String ANY_CHANNEL = "*";

    String channel();
}
