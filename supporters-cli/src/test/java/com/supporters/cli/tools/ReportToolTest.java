package com.supporters.cli.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.supporters.domain.calendar.MonthDate;
import com.supporters.domain.payment.Payment;
import com.supporters.infrastructure.db.Database;
import com.supporters.infrastructure.db.SqlitePaymentLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReportToolTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-10-19T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    private Path db;
    private final StringWriter out = new StringWriter();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
    private final PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);

    @BeforeEach
    void seed() {
        db = dir.resolve("supporters.db");
        new SqlitePaymentLedger(Database.forFile(db)).record(List.of(
                Payment.of("alice", MonthDate.of(2024, 1, 10), "General:Monthly"),
                Payment.of("alice", MonthDate.of(2024, 4, 10), "General:Monthly"),
                Payment.of("bob", MonthDate.of(2024, 4, 5), "General:Annual")));
    }

    private int run(ReportTool.Kind kind, String... args) {
        return new ReportTool(kind, CLOCK, out, err).execute(args);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    void returningReportAsCsv() {
        int code = run(ReportTool.Kind.RETURNING,
                "--db", db.toString(), "--start-month", "2024-04", "--end-month", "2024-04", "--format", "csv");

        assertThat(code).isZero();
        assertThat(out.toString()).isEqualTo(
                "Month,Total New,Were 0-3mo expired,Were 3-6mo expired,Were 6-9mo expired,Were 9-12mo expired,Were >1yr expired\n"
                        + "2024-04,1,1,0,0,0,0\n");
    }

    @Test
    void startMonthDefaultsToEarliestPayment() {
        int code = run(ReportTool.Kind.RETURNING, "--db", db.toString(), "--end-month", "2024-02", "--format", "csv");

        assertThat(code).isZero();
        assertThat(out.toString().split("\n"))
                .hasSize(3)
                .contains("2024-01,1,0,0,0,0,0", "2024-02,0,0,0,0,0,0");
    }

    @Test
    void statusReportAsJson() throws Exception {
        int code = run(ReportTool.Kind.STATUS,
                "--db=" + db, "--start-month=2024-04", "--end-month=2024-04", "--format=json");

        assertThat(code).isZero();
        JsonNode root = new ObjectMapper().readTree(out.toString());
        assertThat(root.isArray()).isTrue();
        assertThat(root.size()).isEqualTo(1);
        assertThat(root.get(0).get("Month").asText()).isEqualTo("2024-04");
        assertThat(root.get(0).get("Annual New").asInt()).isEqualTo(1);
        assertThat(root.get(0).get("Monthly Active").asInt()).isEqualTo(1);
        assertThat(root.get(0).get("Total Lapsed").asInt()).isZero();
    }

    @Test
    void reversedRangeIsUsageError() {
        int code = run(ReportTool.Kind.RETURNING,
                "--db", db.toString(), "--start-month", "2024-05", "--end-month", "2024-04");

        assertThat(code).isEqualTo(2);
        assertThat(err()).contains("End month predates start month");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void malformedMonthIsUsageError() {
        int code = run(ReportTool.Kind.STATUS, "--db", db.toString(), "--start-month", "April");

        assertThat(code).isEqualTo(2);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void unknownArgumentIsUsageError() {
        int code = run(ReportTool.Kind.RETURNING, "--db", db.toString(), "--bogus");

        assertThat(code).isEqualTo(2);
        assertThat(err()).contains("Unknown argument: --bogus");
    }

    @Test
    void unknownFormatIsUsageError() {
        int code = run(ReportTool.Kind.RETURNING, "--db", db.toString(), "--format", "xml");

        assertThat(code).isEqualTo(2);
        assertThat(err()).contains("Configuration problem");
    }

    @Test
    void emptyLedgerWithoutStartMonthIsUsageError() {
        Path empty = dir.resolve("empty.db");

        int code = run(ReportTool.Kind.RETURNING, "--db", empty.toString());

        assertThat(code).isEqualTo(2);
        assertThat(err()).contains("--start-month");
    }
}
