package com.supporters.application.config;

/**
 * Known configuration keys, with the value used when nothing is configured.
 */
public enum ConfigKey {
    DB_URL("db.url", "jdbc:sqlite:data/supporters.db"),
    REPORT_FORMAT("report.format", "csv"),
    REPORT_CADENCES("report.cadences", "Annual,Monthly"),
    LOG_LEVEL("log.level", "WARN");

    private final String key;
    private final String defaultValue;

    ConfigKey(String key, String defaultValue) {
        this.key = key;
        this.defaultValue = defaultValue;
    }

    public String key() { return key; }
    public String defaultValue() { return defaultValue; }
}
