package io.github.flameyossnowy.network.sql.connections;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of JDBC connections. Callers close every connection they obtain.
 */
@FunctionalInterface
public interface SQLConnectionProvider {
    Connection getConnection() throws SQLException;
}
