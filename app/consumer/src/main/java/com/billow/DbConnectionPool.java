package com.billow;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A small object that contains a number of connections. A connection will be
 * opened if one is requested but there are no free ones. Otherwise, one of the
 * existing open connections will be used. The consumer uses a single
 * connection, but the pool also takes care of replacing it once it breaks.
 */
public class DbConnectionPool implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(DbConnectionPool.class);

    /**
     * A unit of work to run on a borrowed connection.
     *
     * @param <T>
     *            The type of the result.
     */
    @FunctionalInterface
    public static interface SqlFunction<T> {
        /**
         * Run the work on the given connection.
         *
         * @param connection
         *            The connection to use. Do not close it.
         * @return The result of the work.
         * @throws SQLException
         *             In case of database errors.
         */
        public abstract T apply(Connection connection) throws SQLException;
    }

    /** The URL used to connect to the database. */
    private final String jdbcUrl;
    /** Additional connection properties, e.g. user and password. */
    private final Properties properties;
    /** The maximum number of concurrently open connections. */
    private final int maxConnections;
    /** Available connections that are not currently given out. */
    private final List<Connection> connections = new ArrayList<>();
    /** The current number of open connections. */
    private int openConnections = 0;

    /**
     * Create a new connection pool that will create new connection by connecting to
     * the given JDBC URL.
     *
     * @param jdbcUrl
     *            The URL to connect to for opening new connections.
     * @param properties
     *            Connection properties passed to the driver.
     * @param maxConnections
     *            The maximum number of concurrent connections allowed by this
     *            connection pool.
     */
    public DbConnectionPool(String jdbcUrl, Properties properties, int maxConnections) {
        this.jdbcUrl = jdbcUrl;
        this.properties = properties;
        this.maxConnections = maxConnections;
    }

    public DbConnectionPool(String jdbcUrl) {
        this(jdbcUrl, new Properties(), 1);
    }

    /**
     * Get a new or reused connection from the connection pool.
     *
     * @return The connection.
     * @throws SQLException
     *             In case we are unable to open a connection.
     * @throws InterruptedException
     *             If interrupted.
     */
    public synchronized Connection getConnection() throws SQLException, InterruptedException {
        while (true) {
            if (connections.isEmpty()) {
                if (openConnections < maxConnections) {
                    Connection newConnection = DriverManager.getConnection(jdbcUrl, properties);
                    newConnection.setAutoCommit(false);
                    openConnections++;
                    return newConnection;
                } else {
                    // Retry when someone has returned a connection.
                    this.wait();
                }
            } else {
                Connection connection = connections.remove(connections.size() - 1);
                try {
                    if (connection.isValid(5)) {
                        return connection;
                    }
                } catch (SQLException ex) {
                    LOGGER.debug("Connection validation failed", ex);
                }
                // This connection is no longer valid. We should get another one.
                closeQuietly(connection);
                openConnections--;
            }
        }
    }

    /**
     * Return a borrowed connection to the connection pool. Connections that have
     * been closed by the borrower are dropped.
     *
     * @param connection
     *            The connection to return.
     */
    public synchronized void returnConnection(Connection connection) {
        boolean closed;
        try {
            closed = connection.isClosed();
        } catch (SQLException e) {
            closed = true;
        }
        if (closed) {
            openConnections--;
        } else {
            connections.add(connection);
        }
        this.notify();
    }

    /**
     * Run the given work in its own transaction on a borrowed connection. The
     * transaction is committed if the work succeeds and rolled back otherwise.
     * After a failure the connection is closed, so that the next call starts
     * with a fresh one.
     *
     * @param <T>
     *            The type of the result.
     * @param work
     *            The work to run.
     * @return The result of the work.
     * @throws SQLException
     *             In case of database errors.
     * @throws InterruptedException
     *             If interrupted while waiting for a connection.
     */
    public <T> T execute(SqlFunction<T> work) throws SQLException, InterruptedException {
        Connection connection = getConnection();
        try {
            T result;
            try {
                result = work.apply(connection);
                connection.commit();
            } catch (SQLException exc) {
                try {
                    connection.rollback();
                } catch (SQLException e) {
                    exc.addSuppressed(e);
                }
                throw exc;
            }
            return result;
        } catch (SQLException exc) {
            // The pool knows how to handle closed connections.
            closeQuietly(connection);
            throw exc;
        } finally {
            returnConnection(connection);
        }
    }

    private static void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            LOGGER.warn("Failed to close database connection", e);
        }
    }

    @Override
    public synchronized void close() throws SQLException {
        for (Connection connection : connections) {
            connection.close();
        }
        openConnections -= connections.size();
        connections.clear();
    }
}
