package com.tonyguerra.net.pgwire.core;

import java.util.Objects;

import com.tonyguerra.net.pgwire.errors.PgException;

/**
 * Runs its text through the simple query protocol of the given connector.
 */
public final class SimpleCommand implements PgCommand {
    private final String commandText;
    private final Connector connector;

    public SimpleCommand(String commandText, Connector connector) {
        this.commandText = Objects.requireNonNull(commandText, "commandText");
        this.connector = Objects.requireNonNull(connector, "connector");
    }

    @Override
    public String getCommandText() {
        return commandText;
    }

    public Connector getConnector() {
        return connector;
    }

    @Override
    public CommandResult executeNonQuery() throws PgException {
        return connector.execute(this);
    }

    @Override
    public String toString() {
        return commandText;
    }
}
