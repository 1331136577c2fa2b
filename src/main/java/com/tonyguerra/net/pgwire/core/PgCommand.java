package com.tonyguerra.net.pgwire.core;

import com.tonyguerra.net.pgwire.errors.PgException;

/**
 * A statement that can be run on a connection without reading back rows.
 */
public interface PgCommand {
    String getCommandText();

    CommandResult executeNonQuery() throws PgException;
}
