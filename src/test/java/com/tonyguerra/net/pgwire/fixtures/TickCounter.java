package com.tonyguerra.net.pgwire.fixtures;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

import com.tonyguerra.net.pgwire.core.PgNotification;
import com.tonyguerra.net.pgwire.di.Singleton;
import com.tonyguerra.net.pgwire.handlers.NotificationHandler;

/**
 * One instance per connection; every delivery reports the instance and its running count.
 */
@Singleton
public final class TickCounter {
    public static final BlockingQueue<TickCounter> SEEN = new LinkedBlockingQueue<>();

    private int ticks;

    @NotificationHandler(channel = "ticks")
    public void onTick(PgNotification notification) {
        ticks++;
        SEEN.add(this);
    }

    public int ticks() {
        return ticks;
    }
}
