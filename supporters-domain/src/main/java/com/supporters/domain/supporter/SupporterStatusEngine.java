package com.supporters.domain.supporter;

import com.supporters.domain.calendar.MonthDate;
import com.supporters.domain.payment.PaymentHistory;

import java.util.Objects;
import java.util.Optional;

/**
 * Lifecycle classification of one supporter as of a date.
 *
 * Stateless: every call is a function of the supplied history and date only, so one
 * instance can be shared across threads. Payments dated after {@code asOf} are ignored.
 */
public final class SupporterStatusEngine {

    /** Days past the lapse date from which a supporter counts as lost. */
    public static final long LOST_THRESHOLD_DAYS = 365;

    /** Days past the lapse date from which a supporter counts as lapsed. */
    public static final long LAPSED_THRESHOLD_DAYS = 0;

    private final LapseCalculator lapseCalculator;

    public SupporterStatusEngine() {
        this(new LapseCalculator());
    }

    public SupporterStatusEngine(LapseCalculator lapseCalculator) {
        this.lapseCalculator = Objects.requireNonNull(lapseCalculator, "lapseCalculator");
    }

    /**
     * @return the status, or empty when the supporter had not paid yet as of {@code asOf}
     */
    public Optional<SupporterStatus> status(PaymentHistory history, MonthDate asOf) {
        PaymentHistory payments = visible(history, asOf);
        if (payments.isEmpty()) return Optional.empty();

        long daysPastDue = asOf.daysSince(lapseCalculator.lapseDate(payments));
        if (daysPastDue >= LOST_THRESHOLD_DAYS) return Optional.of(SupporterStatus.LOST);
        if (daysPastDue >= LAPSED_THRESHOLD_DAYS) return Optional.of(SupporterStatus.LAPSED);
        if (inCurrentMonth(payments.first().date(), asOf)) return Optional.of(SupporterStatus.NEW);
        return Optional.of(SupporterStatus.ACTIVE);
    }

    /**
     * How many months overdue the supporter was when making this month's payment.
     *
     * 0 unless the newest payment falls in the as-of month, the supporter is not brand new,
     * and that payment came after the lapse date of the previous one. Paying in the lapse
     * month itself already counts as one month.
     */
    public int monthsExpiredAtReturn(PaymentHistory history, MonthDate asOf) {
        PaymentHistory payments = visible(history, asOf);
        if (payments.isEmpty()) return 0;

        // started paying this month, not a return
        if (inCurrentMonth(payments.first().date(), asOf)) return 0;

        MonthDate lastDate = payments.last().date();
        if (!inCurrentMonth(lastDate, asOf)) return 0;

        // first payment is before this month, so there are at least two
        MonthDate pastLapseDate = lapseCalculator.secondLastLapseDate(payments);
        if (!lastDate.isAfter(pastLapseDate)) return 0;

        return Math.toIntExact(lastDate.monthIndex() - pastLapseDate.monthIndex() + 1);
    }

    public Optional<MonthDate> lapseDate(PaymentHistory history, MonthDate asOf) {
        PaymentHistory payments = visible(history, asOf);
        if (payments.isEmpty()) return Optional.empty();
        return Optional.of(lapseCalculator.lapseDate(payments));
    }

    /** {@code firstOfMonth(asOf) <= date <= asOf}. */
    static boolean inCurrentMonth(MonthDate date, MonthDate asOf) {
        return !date.isBefore(asOf.firstOfMonth()) && !date.isAfter(asOf);
    }

    private static PaymentHistory visible(PaymentHistory history, MonthDate asOf) {
        Objects.requireNonNull(history, "history");
        Objects.requireNonNull(asOf, "asOf");
        return history.upTo(asOf);
    }
}
