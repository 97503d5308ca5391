package com.supporters.application.config;

import com.supporters.application.ports.ConfigPort;

import java.util.Locale;
import java.util.Set;

public final class ConfigValidator {

    private static final Set<String> LOG_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    public ConfigValidationResult validate(ConfigPort config) {
        ConfigValidationResult res = new ConfigValidationResult();

        String url = config.get(ConfigKey.DB_URL.key(), ConfigKey.DB_URL.defaultValue());
        if (url == null || !url.startsWith("jdbc:sqlite:")) {
            res.addError("db.url must be a jdbc:sqlite: URL, got: " + url);
        }

        try {
            ReportSettings.parseFormat(config.get(ConfigKey.REPORT_FORMAT.key(), ConfigKey.REPORT_FORMAT.defaultValue()));
        } catch (IllegalArgumentException e) {
            res.addError("report.format: " + e.getMessage());
        }

        try {
            if (ReportSettings.parseCadences(
                    config.get(ConfigKey.REPORT_CADENCES.key(), ConfigKey.REPORT_CADENCES.defaultValue())).isEmpty()) {
                res.addError("report.cadences is empty; reports would count nobody");
            }
        } catch (IllegalArgumentException e) {
            res.addError("report.cadences: " + e.getMessage());
        }

        String level = config.get(ConfigKey.LOG_LEVEL.key(), ConfigKey.LOG_LEVEL.defaultValue());
        if (level == null || !LOG_LEVELS.contains(level.trim().toUpperCase(Locale.ROOT))) {
            res.addError("log.level must be one of " + LOG_LEVELS + ", got: " + level);
        }

        return res;
    }
}
