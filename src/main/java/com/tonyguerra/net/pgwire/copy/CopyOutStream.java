package com.tonyguerra.net.pgwire.copy;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

import com.tonyguerra.net.pgwire.core.Connector;

/**
 * Readable side of a COPY TO STDOUT, over the successive CopyData payloads.
 * Reaching end of stream means the server finished the copy and the connection is Ready.
 */
public final class CopyOutStream extends InputStream {
    private final Connector connector;

    private byte[] current;
    private int pos;
    private boolean eof;
    private volatile boolean closed;

    public CopyOutStream(Connector connector) {
        this.connector = Objects.requireNonNull(connector, "connector");
    }

    @Override
    public int read() throws IOException {
        if (!fill()) {
            return -1;
        }
        return current[pos++] & 0xff;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        if (len == 0) {
            return 0;
        }
        if (!fill()) {
            return -1;
        }

        final int n = Math.min(len, current.length - pos);
        System.arraycopy(current, pos, b, off, n);
        pos += n;
        return n;
    }

    @Override
    public int available() {
        return (current != null) ? current.length - pos : 0;
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isEndOfCopy() {
        return eof;
    }

    private boolean fill() throws IOException {
        while (current == null || pos >= current.length) {
            if (eof) {
                return false;
            }
            if (closed) {
                throw new IOException("Copy stream is closed");
            }
            if (connector.getMediator().getCopyStream() != this) {
                throw new IOException("Copy stream is no longer attached to a running COPY");
            }

            final byte[] next = connector.readCopyData();
            if (next == null) {
                eof = true;
                current = null;
                return false;
            }
            current = next;
            pos = 0;
        }

        return true;
    }
}
