package com.supporters.domain.supporter;

import com.supporters.domain.calendar.MonthDate;
import com.supporters.domain.payment.Cadence;
import com.supporters.domain.payment.PaymentHistory;

import java.util.Objects;

/**
 * Lapse date = first day of the month after the period a payment covers.
 *
 * A monthly payment covers one month, anything else (annual or unlabelled) covers a year.
 */
public final class LapseCalculator {

    public MonthDate lapseDate(MonthDate paymentDate, Cadence cadence) {
        Objects.requireNonNull(paymentDate, "paymentDate");
        MonthDate coverageEnd = (cadence == Cadence.MONTHLY)
                ? paymentDate.nextMonth()
                : paymentDate.nextYear();
        return coverageEnd.roundMonthUp();
    }

    /** Lapse date of the most recent payment, using the history's derived cadence. */
    public MonthDate lapseDate(PaymentHistory history) {
        return lapseDate(history.last().date(), history.cadence());
    }

    /**
     * Lapse date of the payment before the most recent one. The cadence is the one derived
     * from the whole history, not re-derived as of that earlier payment.
     *
     * @throws IllegalArgumentException if the history holds fewer than two payments
     */
    public MonthDate secondLastLapseDate(PaymentHistory history) {
        Objects.requireNonNull(history, "history");
        if (history.size() < 2) {
            throw new IllegalArgumentException(
                    "Second-to-last lapse date needs at least 2 payments, got " + history.size());
        }
        return lapseDate(history.secondLast().date(), history.cadence());
    }
}
