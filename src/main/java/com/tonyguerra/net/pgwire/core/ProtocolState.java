package com.tonyguerra.net.pgwire.core;

import java.util.Objects;

import com.tonyguerra.net.pgwire.enums.Phase;

/**
 * The protocol phase a connection is in. Exactly one is current per {@link Connector}.
 */
public sealed interface ProtocolState permits ProtocolState.Closed, ProtocolState.Connecting,
        ProtocolState.Ready, ProtocolState.Executing, ProtocolState.CopyIn, ProtocolState.CopyOut,
        ProtocolState.Broken {

    Phase phase();

    /** Format of the running COPY, or null outside the copy phases. */
    default CopyFormat copyFormat() {
        return null;
    }

    default String name() {
        return getClass().getSimpleName();
    }

    ProtocolState CLOSED = new Closed();
    ProtocolState CONNECTING = new Connecting();
    ProtocolState READY = new Ready();

    record Closed() implements ProtocolState {
        @Override
        public Phase phase() {
            return Phase.CLOSED;
        }
    }

    record Connecting() implements ProtocolState {
        @Override
        public Phase phase() {
            return Phase.CONNECTING;
        }
    }

    record Ready() implements ProtocolState {
        @Override
        public Phase phase() {
            return Phase.READY;
        }
    }

    record Executing(String commandText) implements ProtocolState {
        @Override
        public Phase phase() {
            return Phase.EXECUTING;
        }
    }

    record CopyIn(CopyFormat copyFormat) implements ProtocolState {
        public CopyIn {
            Objects.requireNonNull(copyFormat, "copyFormat");
        }

        @Override
        public Phase phase() {
            return Phase.COPY_IN;
        }
    }

    record CopyOut(CopyFormat copyFormat) implements ProtocolState {
        public CopyOut {
            Objects.requireNonNull(copyFormat, "copyFormat");
        }

        @Override
        public Phase phase() {
            return Phase.COPY_OUT;
        }
    }

    record Broken(String reason) implements ProtocolState {
        @Override
        public Phase phase() {
            return Phase.BROKEN;
        }
    }
}
