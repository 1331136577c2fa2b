package com.tonyguerra.net.pgwire.errors;

import java.io.IOException;

public class PgException extends IOException {
    public PgException(String message) {
        super(message);
    }

    public PgException(String message, Throwable cause) {
        super(message, cause);
    }
}
