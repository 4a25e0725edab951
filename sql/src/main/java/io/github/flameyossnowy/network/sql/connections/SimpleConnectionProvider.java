package io.github.flameyossnowy.network.sql.connections;

import org.jetbrains.annotations.Nullable;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;

/**
 * Opens a fresh {@link DriverManager} connection per request.
 */
public final class SimpleConnectionProvider implements SQLConnectionProvider {
    private final String url;
    private final Properties properties;

    public SimpleConnectionProvider(String url) {
        this(url, null);
    }

    public SimpleConnectionProvider(String url, @Nullable Properties properties) {
        this.url = Objects.requireNonNull(url, "JDBC url cannot be null");
        this.properties = properties == null ? new Properties() : properties;
    }

    @Override
    public Connection getConnection() throws SQLException {
        return DriverManager.getConnection(url, properties);
    }

    @Override
    public String toString() {
        return "SimpleConnectionProvider{" + url + "}";
    }
}
