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
import java.util.Set;

/**
 * Per month: how many supporters were new, and how long returning supporters had been expired.
 */
public final class ReturningReportService {

    private static final Logger log = LoggerFactory.getLogger(ReturningReportService.class);

    public static final String COL_MONTH = "Month";
    public static final String COL_TOTAL_NEW = "Total New";

    private final PaymentLedgerPort ledger;
    private final SupporterStatusEngine engine;
    private final Set<Cadence> cadences;

    public ReturningReportService(PaymentLedgerPort ledger, SupporterStatusEngine engine, Set<Cadence> cadences) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.cadences = cadences == null || cadences.isEmpty()
                ? EnumSet.noneOf(Cadence.class)
                : EnumSet.copyOf(cadences);
    }

    public static List<String> columns() {
        List<String> cols = new ArrayList<>();
        cols.add(COL_MONTH);
        cols.add(COL_TOTAL_NEW);
        for (ExpiryBucket b : ExpiryBucket.values()) cols.add(b.column());
        return cols;
    }

    public ReportTable build(MonthRange range) {
        Objects.requireNonNull(range, "range");
        Map<String, PaymentHistory> histories = SupporterHistories.load(ledger, cadences, range.lastAsOf());
        log.info("[REPORT] returning start={} end={} supporters={}",
                range.start().formatMonth(), range.end().formatMonth(), histories.size());

        ReportTable table = new ReportTable("returning", columns());
        for (ReportMonth month : range.months()) {
            table.addRow(row(month, histories.values()));
        }
        return table;
    }

    private List<Object> row(ReportMonth month, Iterable<PaymentHistory> histories) {
        int totalNew = 0;
        Map<ExpiryBucket, Integer> buckets = new EnumMap<>(ExpiryBucket.class);

        for (PaymentHistory h : histories) {
            if (engine.status(h, month.asOf()).filter(s -> s == SupporterStatus.NEW).isPresent()) {
                totalNew++;
            }
            ExpiryBucket.of(engine.monthsExpiredAtReturn(h, month.asOf()))
                    .ifPresent(b -> buckets.merge(b, 1, Integer::sum));
        }

        List<Object> row = new ArrayList<>();
        row.add(month.label());
        row.add(totalNew);
        for (ExpiryBucket b : ExpiryBucket.values()) row.add(buckets.getOrDefault(b, 0));

        log.debug("[REPORT] returning month={} asOf={} new={} returned={}",
                month.label(), month.asOf(), totalNew, buckets);
        return row;
    }
}
