package com.supporters.application.report;

import com.supporters.application.ports.PaymentLedgerPort;
import com.supporters.domain.payment.Cadence;
import com.supporters.domain.payment.PaymentHistory;
import com.supporters.domain.supporter.SupporterStatus;
import com.supporters.domain.supporter.SupporterStatusEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Per month: supporters in each lifecycle status, split by the cadence they had as of that month.
 */
public final class StatusReportService {

    private static final Logger log = LoggerFactory.getLogger(StatusReportService.class);

    /** Cadences that get their own columns, in column order. */
    static final List<Cadence> SPLIT = List.of(Cadence.ANNUAL, Cadence.MONTHLY);

    private final PaymentLedgerPort ledger;
    private final SupporterStatusEngine engine;
    private final Set<Cadence> cadences;

    public StatusReportService(PaymentLedgerPort ledger, SupporterStatusEngine engine, Set<Cadence> cadences) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.cadences = cadences == null || cadences.isEmpty()
                ? EnumSet.noneOf(Cadence.class)
                : EnumSet.copyOf(cadences);
    }

    public static List<String> columns() {
        List<String> cols = new ArrayList<>();
        cols.add("Month");
        for (Cadence c : SPLIT) {
            for (SupporterStatus s : SupporterStatus.values()) cols.add(c.label() + " " + s.displayName());
        }
        for (SupporterStatus s : SupporterStatus.values()) cols.add("Total " + s.displayName());
        return cols;
    }

    public ReportTable build(MonthRange range) {
        Objects.requireNonNull(range, "range");
        Map<String, PaymentHistory> histories = SupporterHistories.load(ledger, cadences, range.lastAsOf());
        log.info("[REPORT] status start={} end={} supporters={}",
                range.start().formatMonth(), range.end().formatMonth(), histories.size());

        ReportTable table = new ReportTable("status", columns());
        for (ReportMonth month : range.months()) {
            table.addRow(row(month, histories.values()));
        }
        return table;
    }

    private List<Object> row(ReportMonth month, Iterable<PaymentHistory> histories) {
        Map<Cadence, Map<SupporterStatus, Integer>> byCadence = new EnumMap<>(Cadence.class);
        Map<SupporterStatus, Integer> totals = new EnumMap<>(SupporterStatus.class);

        for (PaymentHistory h : histories) {
            Optional<SupporterStatus> status = engine.status(h, month.asOf());
            if (status.isEmpty()) continue;

            Cadence cadence = h.upTo(month.asOf()).cadence();
            byCadence.computeIfAbsent(cadence, k -> new EnumMap<>(SupporterStatus.class))
                    .merge(status.get(), 1, Integer::sum);
            totals.merge(status.get(), 1, Integer::sum);
        }

        List<Object> row = new ArrayList<>();
        row.add(month.label());
        for (Cadence c : SPLIT) {
            Map<SupporterStatus, Integer> counts = byCadence.getOrDefault(c, Map.of());
            for (SupporterStatus s : SupporterStatus.values()) row.add(counts.getOrDefault(s, 0));
        }
        for (SupporterStatus s : SupporterStatus.values()) row.add(totals.getOrDefault(s, 0));

        log.debug("[REPORT] status month={} asOf={} totals={}", month.label(), month.asOf(), totals);
        return row;
    }
}
