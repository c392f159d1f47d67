package com.billow;

import java.sql.SQLException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns everything the consumer needs for its lifetime: the configuration, the
 * database connection and the components built on top of them. It is created
 * once at startup, before the loop runs, and closed on shutdown.
 */
public class ConsumerContext implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConsumerContext.class);

    private final ConsumerConfig config;
    private final DbConnectionPool connectionPool;
    private final ConsumerLoop loop;
    private boolean closed = false;

    /**
     * Create the context and wire up all components. No connection is opened
     * until the first store call.
     *
     * @param config
     *            The consumer configuration.
     */
    public ConsumerContext(ConsumerConfig config) {
        this.config = config;
        // The loop is single threaded, so a single connection is all we need.
        this.connectionPool = new DbConnectionPool(config.getJdbcUrl(), config.getConnectionProperties(), 1);
        SlotReader slotReader = new PostgresSlotReader(connectionPool, config.getMaxChanges(),
                config.getPluginOptions());
        AggregateStore store = new PostgresAggregateStore(connectionPool, config.getUserIdType());
        ChangeProcessor processor = new ChangeProcessor(new ChangeDecoder(), new ChangeRouter(), store);
        this.loop = new ConsumerLoop(slotReader, processor, config.getSlotName(), config.getPollInterval());
    }

    public ConsumerConfig getConfig() {
        return config;
    }

    public ConsumerLoop getLoop() {
        return loop;
    }

    @Override
    public synchronized void close() throws SQLException {
        if (closed) {
            return;
        }
        closed = true;
        connectionPool.close();
        LOGGER.info("Database connection closed");
    }
}
