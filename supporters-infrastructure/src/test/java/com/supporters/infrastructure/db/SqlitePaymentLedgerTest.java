package com.supporters.infrastructure.db;

import com.supporters.domain.calendar.MonthDate;
import com.supporters.domain.payment.Cadence;
import com.supporters.domain.payment.Payment;
import com.supporters.domain.payment.PaymentHistory;
import com.supporters.domain.supporter.SupporterStatus;
import com.supporters.domain.supporter.SupporterStatusEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqlitePaymentLedgerTest {

    @TempDir
    Path dir;

    private SqlitePaymentLedger ledger;

    private static Payment pay(String entity, String date, String program) {
        return new Payment(MonthDate.parse(date), entity, "payee-" + entity, program, "25.00");
    }

    @BeforeEach
    void setUp() {
        ledger = new SqlitePaymentLedger(Database.forFile(dir.resolve("nested/ledger.db")));
    }

    @Test
    void emptyLedger() {
        assertThat(ledger.earliestPaymentDate()).isEmpty();
        assertThat(ledger.supporterIds(EnumSet.of(Cadence.ANNUAL, Cadence.MONTHLY))).isEmpty();
        assertThat(ledger.paymentsAsOf("alice", null).isEmpty()).isTrue();
    }

    @Test
    void roundTripsPaymentFields() {
        ledger.record(List.of(pay("alice", "2024-02-29", "Fund:Monthly")));

        Payment p = ledger.paymentsAsOf("alice", null).last();
        assertThat(p.date()).isEqualTo(MonthDate.of(2024, 2, 29));
        assertThat(p.payee()).isEqualTo("payee-alice");
        assertThat(p.program()).isEqualTo("Fund:Monthly");
        assertThat(p.amount()).isEqualTo("25.00");
    }

    @Test
    void historiesAreOrderedAndTruncated() {
        assertThat(ledger.record(List.of(
                pay("alice", "2024-03-10", "Fund:Monthly"),
                pay("alice", "2024-01-10", "Fund:Monthly"),
                pay("alice", "2024-02-10", null)))).isEqualTo(3);

        PaymentHistory all = ledger.paymentsAsOf("alice", null);
        assertThat(all.payments()).extracting(Payment::date).containsExactly(
                MonthDate.of(2024, 1, 10), MonthDate.of(2024, 2, 10), MonthDate.of(2024, 3, 10));

        assertThat(ledger.paymentsAsOf("alice", MonthDate.of(2024, 2, 10)).size()).isEqualTo(2);
        assertThat(ledger.earliestPaymentDate()).contains(MonthDate.of(2024, 1, 10));
    }

    @Test
    void sameDayPaymentsFollowInsertionOrder() {
        ledger.record(List.of(pay("alice", "2024-04-10", "Fund:Annual")));
        ledger.record(List.of(pay("alice", "2024-04-10", "Fund:Monthly")));

        PaymentHistory h = ledger.paymentsAsOf("alice", null);
        assertThat(h.secondLast().program()).isEqualTo("Fund:Annual");
        assertThat(h.last().program()).isEqualTo("Fund:Monthly");
        assertThat(h.cadence()).isEqualTo(Cadence.MONTHLY);
    }

    @Test
    void supporterIdsMatchExactCadenceSuffix() {
        ledger.record(List.of(
                pay("bob", "2024-01-01", "Fund:Annual"),
                pay("alice", "2024-01-02", "Fund:Monthly"),
                pay("bob", "2024-01-03", "Fund:Monthly"),
                pay("carol", "2024-01-04", "Fund:monthly"),
                pay("dave", "2024-01-05", "Monthly:Gala"),
                pay("erin", "2024-01-06", null)));

        assertThat(ledger.supporterIds(EnumSet.of(Cadence.ANNUAL, Cadence.MONTHLY)))
                .containsExactly("bob", "alice");
        assertThat(ledger.supporterIds(Set.of(Cadence.MONTHLY))).containsExactly("alice", "bob");
        assertThat(ledger.supporterIds(Set.of(Cadence.UNKNOWN))).isEmpty();
    }

    @Test
    void lookupAndHistoryCadenceAgreeOnLabels() {
        ledger.record(List.of(
                pay("carol", "2024-01-04", "Fund:monthly"),
                pay("alice", "2024-01-05", "Fund:Monthly")));

        assertThat(ledger.supporterIds(Set.of(Cadence.MONTHLY))).containsExactly("alice");
        assertThat(ledger.paymentsAsOf("carol", null).cadence()).isEqualTo(Cadence.UNKNOWN);
        assertThat(ledger.paymentsAsOf("alice", null).cadence()).isEqualTo(Cadence.MONTHLY);
    }

    @Test
    void feedsTheStatusEngine() {
        ledger.record(List.of(
                pay("alice", "2024-01-10", "Fund:Monthly"),
                pay("alice", "2024-04-10", "Fund:Monthly")));

        SupporterStatusEngine engine = new SupporterStatusEngine();
        MonthDate asOf = MonthDate.of(2024, 4, 10);
        PaymentHistory h = ledger.paymentsAsOf("alice", asOf);

        assertThat(engine.status(h, asOf)).contains(SupporterStatus.ACTIVE);
        assertThat(engine.monthsExpiredAtReturn(h, asOf)).isEqualTo(2);
    }

    @Test
    void rejectsNonSqliteUrl() {
        assertThatThrownBy(() -> new Database("jdbc:h2:mem:x"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
