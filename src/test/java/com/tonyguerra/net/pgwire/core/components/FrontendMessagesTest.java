package com.tonyguerra.net.pgwire.core.components;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

final class FrontendMessagesTest {

    private static byte[] written(ThrowingWrite write) throws Exception {
        final var out = new ByteArrayOutputStream();
        final var s = new PgStream(new ByteArrayInputStream(new byte[0]), out);
        write.accept(s);
        s.flush();
        return out.toByteArray();
    }

    @FunctionalInterface
    private interface ThrowingWrite {
        void accept(PgStream s) throws Exception;
    }

    @Test
    void startupShouldCarryVersionAndParameters() throws Exception {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("user", "alice");
        params.put("database", "shop");

        final var buf = ByteBuffer.wrap(written(s -> FrontendMessages.startup(s, params)));

        assertEquals(buf.capacity(), buf.getInt());
        assertEquals(FrontendMessages.PROTOCOL_VERSION_3, buf.getInt());
        assertEquals("user", BackendMessage.readCString(buf));
        assertEquals("alice", BackendMessage.readCString(buf));
        assertEquals("database", BackendMessage.readCString(buf));
        assertEquals("shop", BackendMessage.readCString(buf));
        assertEquals(0, buf.get());
        assertEquals(0, buf.remaining());
    }

    @Test
    void queryShouldBeNulTerminated() throws Exception {
        final var bytes = written(s -> FrontendMessages.query(s, "SELECT 1"));

        final var expected = ByteBuffer.allocate(14).put((byte) 'Q').putInt(13)
                .put("SELECT 1".getBytes(StandardCharsets.UTF_8)).put((byte) 0).array();
        assertArrayEquals(expected, bytes);
    }

    @Test
    void copyDoneAndTerminateHaveNoBody() throws Exception {
        assertArrayEquals(new byte[] { 'c', 0, 0, 0, 4 }, written(FrontendMessages::copyDone));
        assertArrayEquals(new byte[] { 'X', 0, 0, 0, 4 }, written(FrontendMessages::terminate));
    }

    @Test
    void copyFailShouldCarryReason() throws Exception {
        final var buf = ByteBuffer.wrap(written(s -> FrontendMessages.copyFail(s, "aborted by test")));

        assertEquals('f', buf.get());
        assertEquals(buf.capacity() - 1, buf.getInt());
        assertEquals("aborted by test", BackendMessage.readCString(buf));
    }

    @Test
    void md5DigestShouldHashPasswordThenSalt() throws Exception {
        final byte[] salt = { 0x11, 0x22, 0x33, 0x44 };

        final var md = MessageDigest.getInstance("MD5");
        final String inner = HexFormat.of().formatHex(md.digest("secretalice".getBytes(StandardCharsets.UTF_8)));
        md.update(inner.getBytes(StandardCharsets.US_ASCII));
        md.update(salt);
        final String expected = "md5" + HexFormat.of().formatHex(md.digest());

        final String digest = FrontendMessages.md5Digest("alice", "secret", salt);
        assertEquals(expected, digest);
        assertEquals(35, digest.length());
        assertTrue(digest.startsWith("md5"));
        assertNotEquals(digest, FrontendMessages.md5Digest("alice", "secret", new byte[] { 1, 2, 3, 4 }));
    }
}
