package com.supporters.application.report;

import java.util.Optional;

/**
 * Three-month bands of how long a returning supporter had been expired.
 */
public enum ExpiryBucket {
    UP_TO_3_MONTHS("Were 0-3mo expired"),
    UP_TO_6_MONTHS("Were 3-6mo expired"),
    UP_TO_9_MONTHS("Were 6-9mo expired"),
    UP_TO_12_MONTHS("Were 9-12mo expired"),
    OVER_A_YEAR("Were >1yr expired");

    private final String column;

    ExpiryBucket(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }

    /** 1-3 months -> first band, ... , 13+ months -> last band; 0 is not a return. */
    public static Optional<ExpiryBucket> of(int monthsExpired) {
        if (monthsExpired <= 0) return Optional.empty();
        int band = Math.min((monthsExpired + 2) / 3, values().length);
        return Optional.of(values()[band - 1]);
    }
}
