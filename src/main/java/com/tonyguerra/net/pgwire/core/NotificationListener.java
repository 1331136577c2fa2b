package com.tonyguerra.net.pgwire.core;

@FunctionalInterface
public interface NotificationListener {
    void onNotification(PgNotification notification);
}
