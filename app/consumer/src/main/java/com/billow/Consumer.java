package com.billow;

import java.sql.SQLException;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

/**
 * The main application class of the CDC consumer. It reads the configuration,
 * sets up the consumer context and runs the consumer loop until the process is
 * terminated.
 */
public class Consumer {
    private static final Logger LOGGER = LoggerFactory.getLogger(Consumer.class);

    /** This class is only for static methods. You should not instantiate it. */
    private Consumer() {
    }

    /**
     * Run the consumer configured by the given arguments.
     *
     * @param args
     *            The command line arguments.
     */
    public static void main(String[] args) {
        // Parse command line.
        ArgumentParser parser = ConsumerConfig.createParser();
        Namespace cmd;
        try {
            cmd = parser.parseArgs(args);
        } catch (ArgumentParserException e) {
            parser.handleError(e);
            System.exit(1);
            return;
        }
        ConsumerConfig config;
        try {
            config = ConsumerConfig.fromArgs(cmd, System.getenv());
        } catch (ConfigException e) {
            LOGGER.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }
        // Configures logging.
        LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        loggerContext.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(config.getLogLevel()));
        loggerContext.getLogger("com.billow").setLevel(Level.toLevel(config.getLogLevel()));
        LOGGER.info("Billow CDC consumer for slot {} on {}", config.getSlotName(), config.getJdbcUrl());
        ConsumerContext context = new ConsumerContext(config);
        ConsumerLoop loop = context.getLoop();
        // Add a shutdown hook to let the current batch finish before exiting.
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutting down CDC consumer");
            loop.requestShutdown();
            try {
                if (!loop.awaitTermination(Duration.ofSeconds(30))) {
                    LOGGER.warn("CDC consumer did not stop within 30 seconds");
                }
                context.close();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (SQLException e) {
                LOGGER.warn("Failed to close database connection", e);
            }
        }));
        try {
            loop.run();
        } finally {
            try {
                context.close();
            } catch (SQLException e) {
                LOGGER.warn("Failed to close database connection", e);
            }
        }
    }
}
