package com.tonyguerra.net.pgwire.errors;

/**
 * Raised when an operation is attempted in a protocol phase that does not allow it.
 * The connection state is left untouched.
 */
public class ProtocolStateException extends PgException {
    private final String stateName;

    public ProtocolStateException(String attempted, String stateName) {
        super(attempted + " is not allowed in state " + stateName);
        this.stateName = stateName;
    }

    protected ProtocolStateException(String message, String stateName, Throwable cause) {
        super(message, cause);
        this.stateName = stateName;
    }

    public String getStateName() {
        return stateName;
    }
}
