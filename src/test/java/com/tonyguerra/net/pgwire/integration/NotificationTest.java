package com.tonyguerra.net.pgwire.integration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tonyguerra.net.pgwire.configurations.ConnectionSettings;
import com.tonyguerra.net.pgwire.copy.CopyInOperation;
import com.tonyguerra.net.pgwire.core.Connector;
import com.tonyguerra.net.pgwire.core.PgNotification;
import com.tonyguerra.net.pgwire.core.ProtocolState;
import com.tonyguerra.net.pgwire.fixtures.OrderHandlers;
import com.tonyguerra.net.pgwire.fixtures.TickCounter;
import com.tonyguerra.net.pgwire.testing.FakePostgresServer;

final class NotificationTest {
    private FakePostgresServer server;
    private Connector connector;
    private ExecutorService pool;

    @BeforeEach
    void setUp() throws Exception {
        server = new FakePostgresServer().createTable("items", 2);
        pool = Executors.newSingleThreadExecutor();
        connector = new Connector(ConnectionSettings.builder()
                .host("127.0.0.1")
                .port(server.port())
                .user("alice")
                .socketTimeoutMs(5_000)
                .notificationPollIntervalMs(20)
                .build());
        connector.open();
    }

    @AfterEach
    void tearDown() {
        connector.close();
        server.close();
        pool.shutdownNow();
    }

    @Test
    void idleNotificationShouldReachListener() throws Exception {
        final BlockingQueue<PgNotification> received = new LinkedBlockingQueue<>();
        connector.addNotificationListener(received::add);
        connector.execute("LISTEN jobs");

        server.pushNotification("jobs", "42");

        final var n = received.poll(3, TimeUnit.SECONDS);
        assertNotNull(n);
        assertEquals("jobs", n.channel());
        assertEquals("42", n.payload());
        assertEquals(connector.getProcessId(), n.processId());
        assertInstanceOf(ProtocolState.Ready.class, connector.currentState());
    }

    @Test
    void notificationDuringQueryShouldBeDeliveredAfterIt() throws Exception {
        final BlockingQueue<String> received = new LinkedBlockingQueue<>();
        connector.addNotificationListener(n -> received.add(n.payload()));

        assertEquals("NOTIFY", connector.execute("NOTIFY jobs, 'hello'").commandTag());

        assertEquals("hello", received.poll(3, TimeUnit.SECONDS));
    }

    @Test
    void notificationDuringCopyEndShouldBeDeferred() throws Exception {
        server.notifyOnCopyDone("jobs", "committed", 300);

        final BlockingQueue<String> observed = new LinkedBlockingQueue<>();
        connector.addNotificationListener(n -> observed.add(n.payload() + "|"
                + connector.currentState().name() + "|" + connector.isNotificationThreadBlocked()));

        final var copy = new CopyInOperation("COPY items FROM STDIN", connector);
        copy.start();
        copy.getWritableStream().write("1\tapple\n".getBytes(StandardCharsets.UTF_8));

        final var blockedDuringEnd = new AtomicBoolean(false);
        final var end = pool.submit(() -> copy.end());

        final long deadline = System.currentTimeMillis() + 2_000;
        while (!end.isDone() && System.currentTimeMillis() < deadline) {
            if (connector.isNotificationThreadBlocked()) {
                blockedDuringEnd.set(true);
            }
            Thread.sleep(5);
        }

        assertEquals("COPY 1", end.get(3, TimeUnit.SECONDS).orElseThrow().commandTag());
        assertTrue(blockedDuringEnd.get());

        assertEquals("committed|Ready|false", observed.poll(3, TimeUnit.SECONDS));
    }

    @Test
    void blockedNotificationThreadShouldNotRead() throws Exception {
        final BlockingQueue<String> received = new LinkedBlockingQueue<>();
        connector.addNotificationListener(n -> received.add(n.payload()));

        try (var block = connector.blockNotificationThread()) {
            assertTrue(connector.isNotificationThreadBlocked());
            server.pushNotification("jobs", "later");
            Thread.sleep(150);
            assertTrue(received.isEmpty());
        }

        assertFalse(connector.isNotificationThreadBlocked());
        assertEquals("later", received.poll(3, TimeUnit.SECONDS));
    }

    @Test
    void annotatedHandlersShouldBeInvoked() throws Exception {
        OrderHandlers.ORDERS.clear();
        OrderHandlers.AUDIT.clear();
        connector.registerNotificationHandlers("com.tonyguerra.net.pgwire.fixtures");

        server.pushNotification("orders", "o-17");
        server.pushNotification("audit", "a-1");

        assertEquals("o-17", OrderHandlers.ORDERS.poll(3, TimeUnit.SECONDS));
        assertEquals("a-1@same", OrderHandlers.AUDIT.poll(3, TimeUnit.SECONDS));
    }

    @Test
    void singletonHandlerOwnerShouldServeEveryDelivery() throws Exception {
        TickCounter.SEEN.clear();
        connector.registerNotificationHandlers("com.tonyguerra.net.pgwire.fixtures");

        server.pushNotification("ticks", "1");
        final var first = TickCounter.SEEN.poll(3, TimeUnit.SECONDS);
        server.pushNotification("ticks", "2");
        final var second = TickCounter.SEEN.poll(3, TimeUnit.SECONDS);

        assertNotNull(first);
        assertSame(first, second);
        assertEquals(2, second.ticks());
    }

    @Test
    void failingListenerShouldNotStopDelivery() throws Exception {
        final BlockingQueue<String> received = new LinkedBlockingQueue<>();
        connector.addNotificationListener(n -> {
            throw new IllegalStateException("listener bug");
        });
        connector.addNotificationListener(n -> received.add(n.payload()));

        server.pushNotification("jobs", "1");
        server.pushNotification("jobs", "2");

        assertEquals("1", received.poll(3, TimeUnit.SECONDS));
        assertEquals("2", received.poll(3, TimeUnit.SECONDS));
        assertTrue(connector.isUsable());
    }

    @Test
    void eventDispatcherShouldRunDelivery() throws Exception {
        final BlockingQueue<String> threads = new LinkedBlockingQueue<>();
        connector.setEventDispatcher(pool);
        connector.addNotificationListener(n -> threads.add(Thread.currentThread().getName()));

        server.pushNotification("jobs", "x");

        final var name = threads.poll(3, TimeUnit.SECONDS);
        assertNotNull(name);
        assertFalse(name.startsWith("pg-notification-"));
    }

    @Test
    void withoutListenerThreadNotificationsArriveAfterExchange() throws Exception {
        connector.close();
        connector = new Connector(ConnectionSettings.builder()
                .host("127.0.0.1")
                .port(server.port())
                .user("alice")
                .listenForNotifications(false)
                .build());
        connector.open();

        final BlockingQueue<String> received = new LinkedBlockingQueue<>();
        connector.addNotificationListener(n -> received.add(Thread.currentThread().getName() + ":" + n.payload()));

        connector.execute("NOTIFY jobs, 'inline'");

        assertEquals(Thread.currentThread().getName() + ":inline", received.poll());
    }
}
