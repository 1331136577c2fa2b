package com.tonyguerra.net.pgwire.core;

import java.io.Closeable;

/**
 * Per-connection hand-off point between the copy operations and the {@link Connector}.
 */
public final class Mediator {
    // Written by copy operations (start/end/cancel) and by the Connector while it serves their start().
    private volatile Closeable copyStream;

    // Written by the caller before a copy starts.
    private volatile int copyBufferSize;

    // Written by the Connector when a CommandComplete arrives.
    private volatile String lastCommandTag;

    public Mediator(int copyBufferSize) {
        setCopyBufferSize(copyBufferSize);
    }

    /**
     * The stream in control of the current copy: a caller source/sink, an engine
     * {@code CopyInStream}/{@code CopyOutStream}, or null.
     */
    public Closeable getCopyStream() {
        return copyStream;
    }

    public void setCopyStream(Closeable copyStream) {
        this.copyStream = copyStream;
    }

    public int getCopyBufferSize() {
        return copyBufferSize;
    }

    public void setCopyBufferSize(int copyBufferSize) {
        if (copyBufferSize <= 0)
            throw new IllegalArgumentException("copyBufferSize must be > 0");
        this.copyBufferSize = copyBufferSize;
    }

    public String getLastCommandTag() {
        return lastCommandTag;
    }

    void setLastCommandTag(String lastCommandTag) {
        this.lastCommandTag = lastCommandTag;
    }
}
