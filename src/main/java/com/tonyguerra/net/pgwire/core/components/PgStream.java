package com.tonyguerra.net.pgwire.core.components;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;

/**
 * Length-prefixed message framing over the raw socket streams.
 * Not thread-safe: callers serialize access.
 */
public final class PgStream implements Closeable {
    // Anything larger is treated as a desynchronized stream
    private static final int MAX_MESSAGE_LENGTH = 0x3fffffff;

    private final DataInputStream in;
    private final OutputStream out;

    public PgStream(InputStream in, OutputStream out) {
        this.in = new DataInputStream(new BufferedInputStream(in, 8192));
        this.out = new BufferedOutputStream(out, 8192);
    }

    /**
     * Reads one complete message, blocking until it has fully arrived.
     *
     * @throws EOFException if the server closed the connection
     */
    public BackendMessage readMessage() throws IOException {
        final int type = in.read();
        if (type == -1) {
            throw new EOFException("Connection closed by the server");
        }

        final int length = in.readInt();
        if (length < 4 || length > MAX_MESSAGE_LENGTH) {
            throw new IOException("Invalid length " + length + " for message '" + (char) type + "'");
        }

        final byte[] payload = new byte[length - 4];
        in.readFully(payload);

        return new BackendMessage((byte) type, payload);
    }

    /**
     * @return true if at least one byte can be read without blocking
     */
    public boolean hasPendingInput() throws IOException {
        return in.available() > 0;
    }

    public void writeMessage(byte type, byte[] payload) throws IOException {
        writeMessage(type, payload, 0, payload.length);
    }

    public void writeMessage(byte type, byte[] payload, int off, int len) throws IOException {
        final var header = ByteBuffer.allocate(5);
        header.put(type);
        header.putInt(len + 4);
        out.write(header.array());
        out.write(payload, off, len);
    }

    /** The startup packet is the only message without a type byte. */
    public void writeUntyped(byte[] payload) throws IOException {
        final var header = ByteBuffer.allocate(4);
        header.putInt(payload.length + 4);
        out.write(header.array());
        out.write(payload);
    }

    public void flush() throws IOException {
        out.flush();
    }

    @Override
    public void close() throws IOException {
        try {
            in.close();
        } finally {
            out.close();
        }
    }
}
