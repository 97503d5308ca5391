package com.supporters.application.config;

import com.supporters.application.ports.ConfigPort;
import com.supporters.domain.payment.Cadence;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Report options resolved from configuration.
 */
public record ReportSettings(ReportFormat format, Set<Cadence> cadences) {

    public enum ReportFormat { CSV, JSON }

    public static ReportSettings from(ConfigPort config) {
        return new ReportSettings(
                parseFormat(get(config, ConfigKey.REPORT_FORMAT)),
                parseCadences(get(config, ConfigKey.REPORT_CADENCES)));
    }

    public ReportSettings withFormat(ReportFormat f) {
        return new ReportSettings(f, cadences);
    }

    /**
     * @throws IllegalArgumentException on an unknown format
     */
    public static ReportFormat parseFormat(String raw) {
        String v = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        try {
            return ReportFormat.valueOf(v);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown report format '" + raw + "', expected csv or json", e);
        }
    }

    /**
     * Comma-separated cadence labels, e.g. {@code Annual,Monthly}.
     *
     * @throws IllegalArgumentException on an unrecognised label
     */
    public static Set<Cadence> parseCadences(String raw) {
        Set<Cadence> out = EnumSet.noneOf(Cadence.class);
        if (raw == null || raw.isBlank()) return out;
        for (String part : raw.split(",")) {
            if (part.isBlank()) continue;
            Cadence c = Cadence.fromLabel(part);
            if (c == Cadence.UNKNOWN) {
                throw new IllegalArgumentException("Unknown cadence '" + part.trim() + "', expected Annual or Monthly");
            }
            out.add(c);
        }
        return out;
    }

    private static String get(ConfigPort config, ConfigKey key) {
        return config.get(key.key(), key.defaultValue());
    }
}
