package com.tonyguerra.net.pgwire.errors;

import com.tonyguerra.net.pgwire.core.components.ServerError;

public final class ServerErrorException extends PgException {
    private final ServerError error;

    public ServerErrorException(ServerError error) {
        super(error.toString());
        this.error = error;
    }

    public ServerError getError() {
        return error;
    }

    public String getSqlState() {
        return error.sqlState();
    }
}
