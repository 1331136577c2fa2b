package com.tonyguerra.net.pgwire.errors;

public final class ConnectionBrokenException extends ProtocolStateException {
    public ConnectionBrokenException(String attempted, String reason) {
        super(attempted + " failed: connection not usable (" + reason + ")", "Broken", null);
    }

    public ConnectionBrokenException(String attempted, Throwable cause) {
        super(attempted + " failed: connection not usable (" + cause.getMessage() + ")", "Broken", cause);
    }
}
