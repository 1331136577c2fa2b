package com.tonyguerra.net.pgwire.errors;

/** Connection establishment (startup / authentication) failed. */
public final class ConnectionException extends PgException {
    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
