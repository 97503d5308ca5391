package com.supporters.domain.payment;

import com.supporters.domain.calendar.MonthDate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Chronologically ordered payments of one supporter.
 *
 * Payments sharing a date keep the order they were supplied in; the last one supplied
 * is treated as the most recent. Histories are immutable and cheap to truncate.
 */
public final class PaymentHistory {

    private static final PaymentHistory EMPTY = new PaymentHistory(List.of());

    private final List<Payment> payments;

    private PaymentHistory(List<Payment> payments) {
        this.payments = payments;
    }

    public static PaymentHistory empty() {
        return EMPTY;
    }

    /**
     * @throws IllegalArgumentException if the payments are not in non-decreasing date order
     *                                  or belong to more than one supporter
     */
    public static PaymentHistory of(List<Payment> payments) {
        Objects.requireNonNull(payments, "payments");
        if (payments.isEmpty()) return EMPTY;

        List<Payment> copy = new ArrayList<>(payments.size());
        Payment prev = null;
        for (Payment p : payments) {
            Objects.requireNonNull(p, "payment");
            if (prev != null) {
                if (p.date().isBefore(prev.date())) {
                    throw new IllegalArgumentException(
                            "Payments out of order: " + p.date() + " after " + prev.date());
                }
                if (!p.entity().equals(prev.entity())) {
                    throw new IllegalArgumentException(
                            "Mixed supporters in one history: " + prev.entity() + ", " + p.entity());
                }
            }
            copy.add(p);
            prev = p;
        }
        return new PaymentHistory(Collections.unmodifiableList(copy));
    }

    public static PaymentHistory of(Payment... payments) {
        return of(List.of(payments));
    }

    /** Payments dated on or before {@code asOf}. */
    public PaymentHistory upTo(MonthDate asOf) {
        Objects.requireNonNull(asOf, "asOf");
        int end = payments.size();
        while (end > 0 && payments.get(end - 1).date().isAfter(asOf)) end--;
        if (end == payments.size()) return this;
        if (end == 0) return EMPTY;
        return new PaymentHistory(payments.subList(0, end));
    }

    public boolean isEmpty() {
        return payments.isEmpty();
    }

    public int size() {
        return payments.size();
    }

    public Payment first() {
        requireAtLeast(1);
        return payments.get(0);
    }

    public Payment last() {
        requireAtLeast(1);
        return payments.get(payments.size() - 1);
    }

    /**
     * @throws IllegalArgumentException if fewer than two payments are present
     */
    public Payment secondLast() {
        requireAtLeast(2);
        return payments.get(payments.size() - 2);
    }

    /**
     * Cadence of the newest payment carrying a program label; {@link Cadence#UNKNOWN} if none does.
     */
    public Cadence cadence() {
        for (int i = payments.size() - 1; i >= 0; i--) {
            Payment p = payments.get(i);
            if (p.hasProgram()) return p.cadence();
        }
        return Cadence.UNKNOWN;
    }

    public List<Payment> payments() {
        return payments;
    }

    private void requireAtLeast(int n) {
        if (payments.size() < n) {
            throw new IllegalArgumentException(
                    "History has " + payments.size() + " payment(s), at least " + n + " required");
        }
    }

    @Override
    public String toString() {
        return "PaymentHistory{size=" + payments.size() + "}";
    }
}
