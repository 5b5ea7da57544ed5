package com.p14n.eventstream.data;

public record ConfigData(String scopeName,
        long shutdownTimeoutMillis) implements EventBrokerConfig {

    public ConfigData {
        if (scopeName == null || scopeName.trim().isEmpty()) {
            throw new IllegalArgumentException("scopeName cannot be null or empty");
        }
        if (shutdownTimeoutMillis < 0) {
            throw new IllegalArgumentException("shutdownTimeoutMillis cannot be negative");
        }
    }

    public ConfigData(String scopeName) {
        this(scopeName, 5000);
    }
}
