package com.tonyguerra.net.pgwire.errors;

public final class CopyException extends PgException {
    public CopyException(String message, Throwable cause) {
        super(message, cause);
    }
}
