package com.p14n.eventstream.data;

/**
 * Configuration interface for the event broker.
 * Defines the settings the broker and its dispatcher read at construction.
 */
public interface EventBrokerConfig {

    /**
     * Gets the instrumentation scope name used for the broker's tracer and
     * meter.
     *
     * @return The scope name
     */
    String scopeName();

    /**
     * Gets the time in milliseconds to wait for dispatcher threads to stop on
     * shutdown.
     * Default is 5000 milliseconds.
     *
     * @return The shutdown timeout in milliseconds
     */
    default long shutdownTimeoutMillis() {
        return 5000;
    }
}
