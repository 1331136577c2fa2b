package com.tonyguerra.net.pgwire.handlers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class HandlerRegistry {
    private final Map<String, HandlerDefinition> defaults;
    private final Map<String, HandlerDefinition> user;

    public HandlerRegistry() {
        defaults = new ConcurrentHashMap<>();
        user = new ConcurrentHashMap<>();
    }

    public void registerDefault(Map<String, HandlerDefinition> map) {
        defaults.putAll(map);
    }

    public void registerUser(Map<String, HandlerDefinition> map) {
        user.putAll(map);
    }

    /** User overrides default if channel clashes. */
    public HandlerDefinition resolve(String channel) {
        final var u = user.get(channel);
        if (u != null) {
            return u;
        }

        return defaults.get(channel);
    }

    /**
     * Handlers for a delivered notification: the channel's own handler, then the
     * {@value NotificationHandler#ANY_CHANNEL} handler.
     */
    public List<HandlerDefinition> resolveForDelivery(String channel) {
        final List<HandlerDefinition> out = new ArrayList<>(2);

        final var specific = resolve(channel);
        if (specific != null) {
            out.add(specific);
        }

        if (!NotificationHandler.ANY_CHANNEL.equals(channel)) {
            final var any = resolve(NotificationHandler.ANY_CHANNEL);
            if (any != null) {
                out.add(any);
            }
        }

        return out;
    }

    /** Merged view (user wins) */
    public Map<String, HandlerDefinition> mergedView() {
        final Map<String, HandlerDefinition> merged = new ConcurrentHashMap<>(defaults);
        merged.putAll(user);

        return Map.copyOf(merged);
    }
}
