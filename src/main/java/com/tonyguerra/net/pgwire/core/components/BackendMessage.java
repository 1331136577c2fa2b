package com.tonyguerra.net.pgwire.core.components;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * One framed message received from the server: a type byte and its payload
 * (the length word is not kept).
 */
public final class BackendMessage {
    public static final byte AUTHENTICATION = 'R';
    public static final byte BACKEND_KEY_DATA = 'K';
    public static final byte COMMAND_COMPLETE = 'C';
    public static final byte COPY_DATA = 'd';
    public static final byte COPY_DONE = 'c';
    public static final byte COPY_IN_RESPONSE = 'G';
    public static final byte COPY_OUT_RESPONSE = 'H';
    public static final byte DATA_ROW = 'D';
    public static final byte EMPTY_QUERY_RESPONSE = 'I';
    public static final byte ERROR_RESPONSE = 'E';
    public static final byte NOTICE_RESPONSE = 'N';
    public static final byte NOTIFICATION_RESPONSE = 'A';
    public static final byte PARAMETER_STATUS = 'S';
    public static final byte READY_FOR_QUERY = 'Z';
    public static final byte ROW_DESCRIPTION = 'T';

    public static final int AUTH_OK = 0;
    public static final int AUTH_CLEARTEXT_PASSWORD = 3;
    public static final int AUTH_MD5_PASSWORD = 5;

    private final byte type;
    private final byte[] payload;

    public BackendMessage(byte type, byte[] payload) {
        this.type = type;
        this.payload = payload;
    }

    public byte type() {
        return type;
    }

    public char typeChar() {
        return (char) type;
    }

    public byte[] payload() {
        return payload;
    }

    /** A fresh big-endian view over the payload, positioned at its start. */
    public ByteBuffer body() {
        return ByteBuffer.wrap(payload).asReadOnlyBuffer();
    }

    public static String readCString(ByteBuffer buf) {
        final int start = buf.position();
        int end = start;
        while (end < buf.limit() && buf.get(end) != 0) {
            end++;
        }

        final byte[] bytes = new byte[end - start];
        buf.get(bytes);
        if (buf.hasRemaining()) {
            buf.get(); // terminator
        }

        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "BackendMessage['" + typeChar() + "', " + payload.length + " bytes]";
    }
}
