package com.supporters.application.ports.impl;

import com.supporters.application.ports.PaymentLedgerPort;
import com.supporters.domain.calendar.MonthDate;
import com.supporters.domain.payment.Cadence;
import com.supporters.domain.payment.Payment;
import com.supporters.domain.payment.PaymentHistory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ledger kept in memory, in insertion order. Used by tests and dry runs.
 */
public final class InMemoryPaymentLedger implements PaymentLedgerPort {

    private final CopyOnWriteArrayList<Payment> payments = new CopyOnWriteArrayList<>();

    @Override
    public List<String> supporterIds(Set<Cadence> cadences) {
        if (cadences == null || cadences.isEmpty()) return List.of();
        Set<String> seen = new LinkedHashSet<>();
        for (Payment p : payments) {
            if (p.program() == null) continue;
            for (Cadence c : cadences) {
                if (c != Cadence.UNKNOWN && p.program().endsWith(c.programSuffix())) {
                    seen.add(p.entity());
                    break;
                }
            }
        }
        return new ArrayList<>(seen);
    }

    @Override
    public PaymentHistory paymentsAsOf(String supporterId, MonthDate asOf) {
        if (supporterId == null) return PaymentHistory.empty();
        List<Payment> out = new ArrayList<>();
        for (Payment p : payments) {
            if (!p.entity().equals(supporterId)) continue;
            if (asOf != null && p.date().isAfter(asOf)) continue;
            out.add(p);
        }
        // stable: same-day payments stay in insertion order
        out.sort(Comparator.comparing(Payment::date));
        return PaymentHistory.of(out);
    }

    @Override
    public Optional<MonthDate> earliestPaymentDate() {
        return payments.stream().map(Payment::date).min(Comparator.naturalOrder());
    }

    @Override
    public int record(List<Payment> batch) {
        if (batch == null || batch.isEmpty()) return 0;
        payments.addAll(batch);
        return batch.size();
    }
}
