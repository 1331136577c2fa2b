package com.tonyguerra.net.pgwire.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Protocol phases of a connection and the transitions allowed between them.
 */
public enum Phase {
    CLOSED,
    CONNECTING,
    READY,
    EXECUTING,
    COPY_IN,
    COPY_OUT,
    BROKEN;

    /**
     * @return true if a connection in this phase may move to {@code next}
     */
    public boolean canMoveTo(Phase next) {
        return allowedNext().contains(next);
    }

    public Set<Phase> allowedNext() {
        switch (this) {
            case CLOSED:
                return EnumSet.of(CONNECTING);
            case CONNECTING:
                return EnumSet.of(READY, BROKEN, CLOSED);
            case READY:
                return EnumSet.of(EXECUTING, BROKEN, CLOSED);
            case EXECUTING:
                return EnumSet.of(READY, COPY_IN, COPY_OUT, BROKEN, CLOSED);
            case COPY_IN:
            case COPY_OUT:
                // EXECUTING: a COPY fed from a caller stream is over, the query goes on
                return EnumSet.of(EXECUTING, READY, BROKEN, CLOSED);
            case BROKEN:
                return EnumSet.of(CLOSED);
            default:
                return EnumSet.noneOf(Phase.class);
        }
    }
}
