package com.tonyguerra.net.pgwire.copy;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;

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
 * A COPY TO STDOUT run on a connection. With a caller sink all data is written to it during
 * {@link #start()}; otherwise it is read from {@link #getReadableStream()}.
 */
public final class CopyOutOperation {
    private static final Logger LOGGER = LoggerFactory.getLogger(CopyOutOperation.class);

    private final Connector context;
    private final PgCommand command;
    private CopyStreamHandle handle;
    private CommandResult lastResult;

    public CopyOutOperation(String copyOutQuery, Connector connector) {
        this(new SimpleCommand(copyOutQuery, connector), connector);
    }

    public CopyOutOperation(PgCommand command, Connector connector) {
        this(command, connector, null);
    }

    public CopyOutOperation(PgCommand command, Connector connector, OutputStream toStream) {
        this.context = Objects.requireNonNull(connector, "connector");
        this.command = Objects.requireNonNull(command, "command");
        this.handle = (toStream != null) ? new CopyStreamHandle.Borrowed(toStream) : null;
    }

    public boolean isActive() {
        final var current = handle;
        return current != null
                && context.currentState() instanceof ProtocolState.CopyOut
                && context.getMediator().getCopyStream() == current.stream();
    }

    public Closeable getCopyStream() {
        final var current = handle;
        return (current != null) ? current.stream() : null;
    }

    public InputStream getReadableStream() {
        return (handle instanceof CopyStreamHandle.Owned owned) ? (InputStream) owned.stream() : null;
    }

    public boolean isBinary() {
        return isActive() && context.currentState().copyFormat().isBinary();
    }

    public boolean fieldIsBinary(int fieldNumber) {
        return isActive() && context.currentState().copyFormat().fieldIsBinary(fieldNumber);
    }

    public int getFieldCount() {
        return isActive() ? context.currentState().copyFormat().fieldCount() : -1;
    }

    public PgCommand getCommand() {
        return command;
    }

    /** Result of {@link #start()}; for a readable stream copy the tag arrives only at its end. */
    public CommandResult getLastResult() {
        return lastResult;
    }

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
        lastResult = result;

        if (result.copy() == CopyDirection.IN) {
            try (var block = context.blockNotificationThread()) {
                context.sendCopyFail("Not a COPY OUT query");
            } finally {
                mediator.setCopyStream(null);
            }
            throw new NotACopyQueryException("COPY OUT", command.getCommandText());
        }

        if (!result.isCopy()) {
            detach();
            throw new NotACopyQueryException("COPY OUT", command.getCommandText());
        }

        if (handle == null) {
            handle = new CopyStreamHandle.Owned(mediator.getCopyStream());
            LOGGER.debug("📤 COPY OUT active: {}", command.getCommandText());
        } else {
            detach();
            LOGGER.debug("📤 COPY OUT to caller sink done: {}", result.commandTag());
        }
    }

    /**
     * Discards whatever the server still has to send and detaches the operation.
     */
    public void end() throws PgException {
        PgException primary = null;
        try {
            if (isActive()) {
                try (var block = context.blockNotificationThread()) {
                    while (context.readCopyData() != null) {
                        // discard
                    }
                }
            }
        } catch (PgException ex) {
            primary = ex;
            throw ex;
        } finally {
            release(primary);
        }
    }

    private void detach() {
        final var current = handle;
        if (current != null && context.getMediator().getCopyStream() == current.stream()) {
            context.getMediator().setCopyStream(null);
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
