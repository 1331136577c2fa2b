package com.tonyguerra.net.pgwire.copy;

import java.io.Closeable;
import java.util.Objects;

/**
 * Who owns the stream a copy operation moves data through.
 */
public sealed interface CopyStreamHandle permits CopyStreamHandle.Borrowed, CopyStreamHandle.Owned {
    Closeable stream();

    /** Supplied by the caller; the engine never closes it. */
    record Borrowed(Closeable stream) implements CopyStreamHandle {
        public Borrowed {
            Objects.requireNonNull(stream, "stream");
        }
    }

    /** Created by the engine for one copy; released when the copy ends. */
    record Owned(Closeable stream) implements CopyStreamHandle {
        public Owned {
            Objects.requireNonNull(stream, "stream");
        }
    }
}
