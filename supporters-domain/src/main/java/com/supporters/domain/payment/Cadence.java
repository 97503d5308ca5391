package com.supporters.domain.payment;

import java.util.Locale;

/**
 * Payment frequency class, carried as the trailing {@code :Label} token of a program label.
 */
public enum Cadence {
    MONTHLY("Monthly"),
    ANNUAL("Annual"),
    UNKNOWN("");

    public static final char LABEL_DELIMITER = ':';

    private final String label;

    Cadence(String label) {
        this.label = label;
    }

    /** Program-label suffix, e.g. {@code Monthly}. Empty for {@link #UNKNOWN}. */
    public String label() {
        return label;
    }

    /** Suffix as stored on payments, e.g. {@code :Monthly}. */
    public String programSuffix() {
        return LABEL_DELIMITER + label;
    }

    /**
     * Derives the cadence from a program label such as {@code General Fund:Monthly}.
     * Only the token after the last delimiter counts, and it must equal a label exactly
     * (same case, no padding), the same rule the ledgers apply with {@link #programSuffix()}.
     * Labels without a delimiter are treated as a bare token.
     */
    public static Cadence fromProgram(String program) {
        if (program == null || program.isBlank()) return UNKNOWN;
        String token = program.substring(program.lastIndexOf(LABEL_DELIMITER) + 1);
        for (Cadence c : values()) {
            if (c != UNKNOWN && c.label.equals(token)) return c;
        }
        return UNKNOWN;
    }

    /** Case-insensitive lookup for configured labels, e.g. {@code report.cadences=annual,monthly}. */
    public static Cadence fromLabel(String label) {
        if (label == null) return UNKNOWN;
        String norm = label.trim().toLowerCase(Locale.ROOT);
        for (Cadence c : values()) {
            if (c != UNKNOWN && c.label.toLowerCase(Locale.ROOT).equals(norm)) return c;
        }
        return UNKNOWN;
    }
}
