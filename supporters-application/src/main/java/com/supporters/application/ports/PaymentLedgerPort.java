package com.supporters.application.ports;

import com.supporters.domain.calendar.MonthDate;
import com.supporters.domain.payment.Cadence;
import com.supporters.domain.payment.Payment;
import com.supporters.domain.payment.PaymentHistory;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read/write boundary over recorded payments.
 * Infrastructure provides implementation (SQLite, in-memory).
 */
public interface PaymentLedgerPort {

    /**
     * Distinct supporter ids having at least one payment labelled with one of the given cadences,
     * in first-seen order. An empty set yields an empty list.
     */
    List<String> supporterIds(Set<Cadence> cadences);

    /**
     * Payments of one supporter dated on or before {@code asOf}, ascending by date.
     * A null {@code asOf} returns the full history.
     */
    PaymentHistory paymentsAsOf(String supporterId, MonthDate asOf);

    /** Date of the earliest payment in the ledger, if any. */
    Optional<MonthDate> earliestPaymentDate();

    /** Appends payments; returns how many were stored. */
    int record(List<Payment> payments);
}
