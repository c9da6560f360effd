package com.rpaflow.core.log;

public enum LogLevel {
    INFO("INFO"),
    WARNING("WARN"),
    ERROR("ERROR"),
    DEBUG("DEBUG");

    private final String label;

    LogLevel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
