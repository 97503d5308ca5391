package com.supporters.cli.tools;

import com.supporters.application.config.ReportSettings;
import com.supporters.application.ports.ConfigPort;
import com.supporters.application.ports.PaymentLedgerPort;
import com.supporters.application.report.InvalidReportRangeException;
import com.supporters.application.report.MonthRange;
import com.supporters.application.report.ReportTable;
import com.supporters.application.report.ReturningReportService;
import com.supporters.application.report.StatusReportService;
import com.supporters.cli.bootstrap.Bootstrap;
import com.supporters.domain.DomainException;
import com.supporters.domain.supporter.SupporterStatusEngine;
import com.supporters.infrastructure.config.FileConfigService;
import com.supporters.infrastructure.report.ReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Objects;

/**
 * Monthly supporter reports written to stdout.
 *
 * Usage:
 *   java -jar supporters-cli.jar returning-report [--start-month YYYY-MM] [--end-month YYYY-MM] [--format csv|json] [--db PATH] [--profile NAME]
 *   java -jar supporters-cli.jar status-report    (same options)
 *
 * Exit codes:
 *   0: OK
 *   1: Runtime failure (storage, output)
 *   2: Usage or configuration problem
 */
public final class ReportTool {

    private static final Logger log = LoggerFactory.getLogger(ReportTool.class);

    public enum Kind { RETURNING, STATUS }

    private final Kind kind;
    private final Clock clock;
    private final Writer out;
    private final PrintStream err;

    public ReportTool(Kind kind, Clock clock, Writer out, PrintStream err) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    public static int run(Kind kind, String[] args) {
        Writer stdout = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
        return new ReportTool(kind, Clock.systemDefaultZone(), stdout, System.err).execute(args);
    }

    public int execute(String[] args) {
        ReportOptions opts;
        try {
            opts = ReportOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return 2;
        }

        ConfigPort config;
        ReportSettings settings;
        try {
            config = FileConfigService.defaultFromWorkingDir(opts.profile());
            Bootstrap.applyLogLevel(config);
            settings = ReportSettings.from(config);
            if (opts.format() != null) {
                settings = settings.withFormat(ReportSettings.parseFormat(opts.format()));
            }
        } catch (IOException | IllegalArgumentException e) {
            err.println("Configuration problem: " + e.getMessage());
            return 2;
        }

        try {
            PaymentLedgerPort ledger = Bootstrap.createLedger(config, opts.db());
            MonthRange range = MonthRange.resolve(opts.startMonth(), opts.endMonth(), ledger, clock);

            ReportTable table = build(ledger, settings, range);
            ReportWriter.forFormat(settings.format()).write(table, out);
            log.info("[REPORT] kind={} rows={} format={}", kind, table.rows().size(), settings.format());
            return 0;
        } catch (InvalidReportRangeException e) {
            err.println(e.getMessage());
            return 2;
        } catch (IllegalArgumentException e) {
            err.println("Configuration problem: " + e.getMessage());
            return 2;
        } catch (DomainException | IOException e) {
            err.println("Report failed: " + e.getMessage());
            if (opts.verbose()) e.printStackTrace(err);
            return 1;
        }
    }

    private ReportTable build(PaymentLedgerPort ledger, ReportSettings settings, MonthRange range) {
        SupporterStatusEngine engine = new SupporterStatusEngine();
        return switch (kind) {
            case RETURNING -> new ReturningReportService(ledger, engine, settings.cadences()).build(range);
            case STATUS -> new StatusReportService(ledger, engine, settings.cadences()).build(range);
        };
    }
}
