package com.supporters.application.report;

import com.supporters.application.ports.PaymentLedgerPort;
import com.supporters.domain.calendar.MonthDate;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Inclusive range of report months, both ends normalised to the first of the month.
 *
 * Each month is evaluated as of its last calendar day, or as of today for the current month.
 */
public record MonthRange(MonthDate start, MonthDate end, MonthDate today) {

    public MonthRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(today, "today");
        start = start.firstOfMonth();
        end = end.firstOfMonth();
        if (end.isBefore(start)) {
            throw new InvalidReportRangeException("End month predates start month");
        }
    }

    /**
     * Resolves {@code --start-month}/{@code --end-month} values ({@code YYYY-MM}, null for default).
     * Start defaults to the month of the earliest payment, end to the current month.
     *
     * @throws InvalidReportRangeException on malformed months, reversed range or an empty ledger
     */
    public static MonthRange resolve(String startMonth, String endMonth, PaymentLedgerPort ledger, Clock clock) {
        MonthDate today = MonthDate.from(LocalDate.now(clock));

        MonthDate start;
        if (startMonth == null || startMonth.isBlank()) {
            start = ledger.earliestPaymentDate()
                    .orElseThrow(() -> new InvalidReportRangeException(
                            "No payments recorded; pass --start-month YYYY-MM"));
        } else {
            start = parse(startMonth, "--start-month");
        }

        MonthDate end = (endMonth == null || endMonth.isBlank()) ? today : parse(endMonth, "--end-month");
        return new MonthRange(start, end, today);
    }

    public List<ReportMonth> months() {
        List<ReportMonth> out = new ArrayList<>();
        MonthDate month = start;
        while (!month.isAfter(end)) {
            out.add(new ReportMonth(month.formatMonth(), asOf(month)));
            month = month.roundMonthUp();
        }
        return out;
    }

    /** Latest as-of date of any month in the range. */
    public MonthDate lastAsOf() {
        return asOf(end);
    }

    private MonthDate asOf(MonthDate month) {
        return month.sameMonth(today) ? today : month.endOfMonth();
    }

    private static MonthDate parse(String raw, String option) {
        try {
            return MonthDate.parseMonth(raw);
        } catch (IllegalArgumentException e) {
            throw new InvalidReportRangeException(option + ": " + e.getMessage(), e);
        }
    }
}
