package com.tonyguerra.net.pgwire.copy;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tonyguerra.net.pgwire.core.CommandResult;
import com.tonyguerra.net.pgwire.core.Connector;
import com.tonyguerra.net.pgwire.core.PgCommand;
import com.tonyguerra.net.pgwire.core.ProtocolState;
import com.tonyguerra.net.pgwire.core.SimpleCommand;
import com.tonyguerra.net.pgwire.enums.CopyDirection;
import com.tonyguerra.net.pgwire.errors.NotACopyQueryException;
import com.tonyguerra.net.pgwire.errors.PgException;
import com.tonyguerra.net.pgwire.errors.ProtocolStateException;

/**
 * A COPY FROM STDIN run on a connection.
 *
 * With a caller source, {@link #start()} sends everything read from it and finishes the copy.
 * Without one, {@link #start()} leaves the connection in {@code CopyIn} and
 * {@link #getWritableStream()} forwards writes to the server until {@link #end()} or
 * {@link #cancel(String)}.
 *
 * <pre>
 * CopyInOperation copy = new CopyInOperation("COPY items FROM STDIN", connector);
 * copy.start();
 * try {
 *     copy.getWritableStream().write(rows);
 *     copy.end();
 * } finally {
 *     copy.cancel("aborted");
 * }
 * </pre>
 */
public final class CopyInOperation {
    private static final Logger LOGGER = LoggerFactory.getLogger(CopyInOperation.class);

    private final Connector context;
    private final PgCommand command;

    // null until start() when the caller supplied no source, and again after end/cancel
    private CopyStreamHandle handle;

    public CopyInOperation(String copyInQuery, Connector connector) {
        this(new SimpleCommand(copyInQuery, connector), connector);
    }

    public CopyInOperation(PgCommand command, Connector connector) {
        this(command, connector, null);
    }

    /**
     * @param fromStream source passed to the server as copy data on {@link #start()}; may be null
     */
    public CopyInOperation(PgCommand command, Connector connector, InputStream fromStream) {
        this.context = Objects.requireNonNull(connector, "connector");
        this.command = Objects.requireNonNull(command, "command");
        this.handle = (fromStream != null) ? new CopyStreamHandle.Borrowed(fromStream) : null;
    }

    /**
     * @return true if the connection is currently reserved for this operation
     */
    public boolean isActive() {
        final var current = handle;
        return current != null
                && context.currentState() instanceof ProtocolState.CopyIn
                && context.getMediator().getCopyStream() == current.stream();
    }

    /**
     * The caller's source, or the engine stream while the copy is active; null otherwise.
     */
    public Closeable getCopyStream() {
        final var current = handle;
        return (current != null) ? current.stream() : null;
    }

    /**
     * The engine-owned sink created by {@link #start()}, or null if the caller supplied a source
     * or the copy is over.
     */
    public OutputStream getWritableStream() {
        return (handle instanceof CopyStreamHandle.Owned owned) ? (OutputStream) owned.stream() : null;
    }

    public boolean isBinary() {
        return isActive() && context.currentState().copyFormat().isBinary();
    }

    public boolean fieldIsBinary(int fieldNumber) {
        return isActive() && context.currentState().copyFormat().fieldIsBinary(fieldNumber);
    }

    /**
     * @return fields expected on each row while active, otherwise -1
     */
    public int getFieldCount() {
        return isActive() ? context.currentState().copyFormat().fieldCount() : -1;
    }

    public PgCommand getCommand() {
        return command;
    }

    /** Chunk size used when reading a caller source; set it before {@link #start()}. */
    public int getCopyBufferSize() {
        return context.getMediator().getCopyBufferSize();
    }

    public void setCopyBufferSize(int size) {
        context.getMediator().setCopyBufferSize(size);
    }

    /**
     * Executes the command. Legal only while the connection is {@code Ready}.
     *
     * @throws NotACopyQueryException if the command did not start a COPY FROM STDIN; the
     *                                connection is {@code Ready} again
     */
    public void start() throws PgException {
        final var current = context.currentState();
        if (!(current instanceof ProtocolState.Ready)) {
            throw new ProtocolStateException("Copy start", current.name());
        }

        final var mediator = context.getMediator();
        mediator.setCopyStream(getCopyStream());

        final CommandResult result;
        try {
            result = command.executeNonQuery();
        } catch (PgException ex) {
            detach();
            throw ex;
        }

        if (result.copy() == CopyDirection.OUT) {
            try {
                while (context.readCopyData() != null) {
                    // discard
                }
            } finally {
                detach();
            }
            throw new NotACopyQueryException("COPY IN", command.getCommandText());
        }

        if (!result.isCopy()) {
            detach();
            throw new NotACopyQueryException("COPY IN", command.getCommandText());
        }

        if (handle == null) {
            handle = new CopyStreamHandle.Owned(mediator.getCopyStream());
            LOGGER.debug("📥 COPY IN active: {}", command.getCommandText());
        } else {
            // Caller source already sent; the copy is over.
            detach();
            LOGGER.debug("📥 COPY IN from caller source done: {}", result.commandTag());
        }
    }

    /**
     * Completes the copy if it is active. Always detaches the operation from the connection.
     *
     * @return the server's result, empty if the operation was not active
     */
    public Optional<CommandResult> end() throws PgException {
        PgException primary = null;
        try {
            if (isActive()) {
                // Keep the notification thread off the socket while the server answers
                try (var block = context.blockNotificationThread()) {
                    return Optional.of(context.sendCopyDone());
                }
            }
            return Optional.empty();
        } catch (PgException ex) {
            primary = ex;
            throw ex;
        } finally {
            release(primary);
        }
    }

    /**
     * Withdraws an active copy; the server fails it with {@code message}. Does nothing on the
     * wire if the operation is not active.
     *
     * @return the failed result carrying the server's error, empty if the operation was not active
     */
    public Optional<CommandResult> cancel(String message) throws PgException {
        final String reason = Objects.requireNonNullElse(message, "COPY cancelled");

        PgException primary = null;
        try {
            if (isActive()) {
                try (var block = context.blockNotificationThread()) {
                    return Optional.of(context.sendCopyFail(reason));
                }
            }
            return Optional.empty();
        } catch (PgException ex) {
            primary = ex;
            throw ex;
        } finally {
            release(primary);
        }
    }

    private void detach() {
        final var mediator = context.getMediator();
        final var current = handle;
        final Closeable mine = (current != null) ? current.stream() : null;
        if (mine != null && mediator.getCopyStream() == mine) {
            mediator.setCopyStream(null);
        } else if (mine == null && mediator.getCopyStream() != null
                && !(context.currentState() instanceof ProtocolState.CopyIn)
                && !(context.currentState() instanceof ProtocolState.CopyOut)) {
            // engine stream installed for a copy this operation never took over
            mediator.setCopyStream(null);
        }
    }

    private void release(PgException primary) {
        detach();

        if (handle instanceof CopyStreamHandle.Owned owned) {
            handle = null;
            try {
                owned.stream().close();
            } catch (IOException ex) {
                if (primary != null) {
                    primary.addSuppressed(ex);
                } else {
                    LOGGER.warn("⚠️ Error releasing copy stream: {}", ex.getMessage());
                }
            }
        }
    }
}
