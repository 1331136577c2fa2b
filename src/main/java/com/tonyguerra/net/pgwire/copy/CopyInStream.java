package com.tonyguerra.net.pgwire.copy;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

import com.tonyguerra.net.pgwire.core.Connector;

/**
 * Writable side of a COPY FROM STDIN: every write becomes one CopyData message.
 * Closing it never closes the connection.
 */
public final class CopyInStream extends OutputStream {
    private final Connector connector;
    private volatile boolean closed;

    public CopyInStream(Connector connector) {
        this.connector = Objects.requireNonNull(connector, "connector");
    }

    @Override
    public void write(int b) throws IOException {
        write(new byte[] { (byte) b }, 0, 1);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        ensureActive();
        if (len == 0) {
            return;
        }

        connector.sendCopyData(b, off, len);
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    private void ensureActive() throws IOException {
        if (closed) {
            throw new IOException("Copy stream is closed");
        }
        if (connector.getMediator().getCopyStream() != this) {
            throw new IOException("Copy stream is no longer attached to a running COPY");
        }
    }
}
