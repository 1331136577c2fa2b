package com.tonyguerra.net.pgwire.core.components;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;

/**
 * Writers for the frontend messages the engine sends. None of them flush.
 */
public final class FrontendMessages {
    public static final int PROTOCOL_VERSION_3 = 196608;

    public static final byte QUERY = 'Q';
    public static final byte PASSWORD = 'p';
    public static final byte COPY_DATA = 'd';
    public static final byte COPY_DONE = 'c';
    public static final byte COPY_FAIL = 'f';
    public static final byte TERMINATE = 'X';

    private static final byte[] EMPTY = new byte[0];

    private FrontendMessages() {
    }

    public static void startup(PgStream stream, Map<String, String> parameters) throws IOException {
        final var body = new ByteArrayOutputStream(128);
        writeInt(body, PROTOCOL_VERSION_3);
        for (final var e : parameters.entrySet()) {
            writeCString(body, e.getKey());
            writeCString(body, e.getValue());
        }
        body.write(0);

        stream.writeUntyped(body.toByteArray());
    }

    public static void query(PgStream stream, String sql) throws IOException {
        stream.writeMessage(QUERY, cString(sql));
    }

    public static void cleartextPassword(PgStream stream, String password) throws IOException {
        stream.writeMessage(PASSWORD, cString(password));
    }

    public static void md5Password(PgStream stream, String user, String password, byte[] salt) throws IOException {
        stream.writeMessage(PASSWORD, cString(md5Digest(user, password, salt)));
    }

    public static void copyData(PgStream stream, byte[] data, int off, int len) throws IOException {
        stream.writeMessage(COPY_DATA, data, off, len);
    }

    public static void copyDone(PgStream stream) throws IOException {
        stream.writeMessage(COPY_DONE, EMPTY);
    }

    public static void copyFail(PgStream stream, String message) throws IOException {
        stream.writeMessage(COPY_FAIL, cString(message));
    }

    public static void terminate(PgStream stream) throws IOException {
        stream.writeMessage(TERMINATE, EMPTY);
    }

    /**
     * "md5" + md5hex(md5hex(password + user) + salt), as the server expects it.
     */
    public static String md5Digest(String user, String password, byte[] salt) {
        try {
            final var digest = MessageDigest.getInstance("MD5");
            digest.update(password.getBytes(StandardCharsets.UTF_8));
            digest.update(user.getBytes(StandardCharsets.UTF_8));
            final String inner = toHex(digest.digest());

            digest.reset();
            digest.update(inner.getBytes(StandardCharsets.US_ASCII));
            digest.update(salt);

            return "md5" + toHex(digest.digest());
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("MD5 not available", ex);
        }
    }

    private static String toHex(byte[] bytes) {
        final var sb = new StringBuilder(bytes.length * 2);
        for (final byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    private static byte[] cString(String s) {
        final byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        final byte[] out = new byte[bytes.length + 1];
        System.arraycopy(bytes, 0, out, 0, bytes.length);
        return out;
    }

    private static void writeCString(ByteArrayOutputStream out, String s) {
        out.writeBytes(s.getBytes(StandardCharsets.UTF_8));
        out.write(0);
    }

    private static void writeInt(ByteArrayOutputStream out, int v) {
        out.write(v >>> 24);
        out.write(v >>> 16);
        out.write(v >>> 8);
        out.write(v);
    }
}
