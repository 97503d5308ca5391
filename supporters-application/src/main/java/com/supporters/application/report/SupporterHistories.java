package com.supporters.application.report;

import com.supporters.application.ports.PaymentLedgerPort;
import com.supporters.domain.calendar.MonthDate;
import com.supporters.domain.payment.Cadence;
import com.supporters.domain.payment.PaymentHistory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads each matching supporter's history once for a whole report range.
 * The status engine truncates per month, so one load up to the last as-of date suffices.
 */
final class SupporterHistories {

    private SupporterHistories() {}

    static Map<String, PaymentHistory> load(PaymentLedgerPort ledger, Set<Cadence> cadences, MonthDate upTo) {
        List<String> ids = ledger.supporterIds(cadences);
        Map<String, PaymentHistory> out = new LinkedHashMap<>();
        for (String id : ids) {
            out.put(id, ledger.paymentsAsOf(id, upTo));
        }
        return out;
    }
}
