package de.bsommerfeld.marketscope.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A unit of JDBC work executed by {@link ResearchDatabase} on a connection it
 * owns. Implementations must not close the connection.
 */
@FunctionalInterface
interface SqlWork<T> {

    T execute(Connection conn) throws SQLException;
}
