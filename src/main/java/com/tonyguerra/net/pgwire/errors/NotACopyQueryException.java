package com.tonyguerra.net.pgwire.errors;

public final class NotACopyQueryException extends PgException {
    private final String commandText;

    public NotACopyQueryException(String kind, String commandText) {
        super("Not a " + kind + " query: " + commandText);
        this.commandText = commandText;
    }

    public String getCommandText() {
        return commandText;
    }
}
