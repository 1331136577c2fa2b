package com.tonyguerra.net.pgwire.handlers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

final class HandlerRegistryTest {
    static final class Dummy {
        public void a() {
        }

        public void b() {
        }
    }

    static HandlerDefinition def(String channel, String methodName) throws Exception {
        final var m = Dummy.class.getMethod(methodName);

        return new HandlerDefinition(channel, Dummy.class, m);
    }

    @Test
    void userShouldOverrideDefault() throws Exception {
        final var r = new HandlerRegistry();

        final var defDefault = def("jobs", "a");
        final var defUser = def("jobs", "b");

        r.registerDefault(Map.of("jobs", defDefault));
        r.registerUser(Map.of("jobs", defUser));

        assertSame(defUser, r.resolve("jobs"));
    }

    @Test
    void shouldReturnDefaultWhenNoUserHandler() throws Exception {
        final var r = new HandlerRegistry();

        final var defDefault = def("jobs", "a");
        r.registerDefault(Map.of("jobs", defDefault));

        assertSame(defDefault, r.resolve("jobs"));
        assertNull(r.resolve("missing"));
    }

    @Test
    void deliveryShouldAddWildcardAfterChannelHandler() throws Exception {
        final var r = new HandlerRegistry();

        final var specific = def("jobs", "a");
        final var any = def(NotificationHandler.ANY_CHANNEL, "b");
        r.registerDefault(Map.of(NotificationHandler.ANY_CHANNEL, any));
        r.registerUser(Map.of("jobs", specific));

        assertEquals(List.of(specific, any), r.resolveForDelivery("jobs"));
        assertEquals(List.of(any), r.resolveForDelivery("other"));
    }

    @Test
    void deliveryWithoutHandlersIsEmpty() {
        assertTrue(new HandlerRegistry().resolveForDelivery("jobs").isEmpty());
    }

    @Test
    void mergedViewShouldContainUserVersion() throws Exception {
        final var r = new HandlerRegistry();

        final var defDefault = def("jobs", "a");
        final var defUser = def("jobs", "b");
        final var defOther = def("audit", "a");

        r.registerDefault(Map.of("jobs", defDefault, "audit", defOther));
        r.registerUser(Map.of("jobs", defUser));

        final var merged = r.mergedView();
        assertSame(defUser, merged.get("jobs"));
        assertSame(defOther, merged.get("audit"));
    }
}
