package com.tonyguerra.net.pgwire.core.components;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

final class PgStreamTest {

    private static PgStream reading(byte[] bytes) {
        return new PgStream(new ByteArrayInputStream(bytes), OutputStream.nullOutputStream());
    }

    private static byte[] frame(char type, byte[] payload) {
        return ByteBuffer.allocate(5 + payload.length).put((byte) type).putInt(payload.length + 4).put(payload).array();
    }

    @Test
    void shouldReadSingleMessage() throws Exception {
        final var s = reading(frame('Z', new byte[] { 'I' }));

        final var msg = s.readMessage();
        assertEquals('Z', msg.typeChar());
        assertArrayEquals(new byte[] { 'I' }, msg.payload());
    }

    @Test
    void shouldReadConsecutiveMessages() throws Exception {
        final var bytes = new ByteArrayOutputStream();
        bytes.writeBytes(frame('C', "COPY 2\0".getBytes(StandardCharsets.UTF_8)));
        bytes.writeBytes(frame('Z', new byte[] { 'I' }));
        final var s = reading(bytes.toByteArray());

        assertEquals("COPY 2", BackendMessage.readCString(s.readMessage().body()));
        assertEquals(BackendMessage.READY_FOR_QUERY, s.readMessage().type());
    }

    @Test
    void shouldReadEmptyPayload() throws Exception {
        final var s = reading(frame('c', new byte[0]));

        assertEquals(0, s.readMessage().payload().length);
    }

    @Test
    void shouldThrowEofWhenServerClosed() {
        final var s = reading(new byte[0]);

        assertThrows(EOFException.class, s::readMessage);
    }

    @Test
    void shouldThrowEofOnTruncatedPayload() {
        final var truncated = ByteBuffer.allocate(7).put((byte) 'd').putInt(10).put((byte) 1).put((byte) 2).array();
        final var s = reading(truncated);

        assertThrows(EOFException.class, s::readMessage);
    }

    @Test
    void shouldRejectInvalidLength() {
        final var s = reading(ByteBuffer.allocate(5).put((byte) 'D').putInt(2).array());

        final var ex = assertThrows(IOException.class, s::readMessage);
        assertTrue(ex.getMessage().contains("Invalid length"));
    }

    @Test
    void shouldReportPendingInput() throws Exception {
        assertTrue(reading(frame('Z', new byte[] { 'I' })).hasPendingInput());
        assertFalse(reading(new byte[0]).hasPendingInput());
    }

    @Test
    void shouldFrameTypedMessages() throws Exception {
        final var out = new ByteArrayOutputStream();
        final var s = new PgStream(new ByteArrayInputStream(new byte[0]), out);

        s.writeMessage((byte) 'd', "abcdef".getBytes(StandardCharsets.UTF_8), 1, 3);
        assertEquals(0, out.size());

        s.flush();
        assertArrayEquals(frame('d', "bcd".getBytes(StandardCharsets.UTF_8)), out.toByteArray());
    }

    @Test
    void shouldFrameUntypedMessage() throws Exception {
        final var out = new ByteArrayOutputStream();
        final var s = new PgStream(new ByteArrayInputStream(new byte[0]), out);

        s.writeUntyped(new byte[] { 9, 9 });
        s.flush();

        assertArrayEquals(new byte[] { 0, 0, 0, 6, 9, 9 }, out.toByteArray());
    }
}
