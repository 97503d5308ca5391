package com.supporters.cli.bootstrap;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.supporters.application.ports.ConfigPort;
import com.supporters.application.ports.PaymentLedgerPort;
import com.supporters.domain.calendar.MonthDate;
import com.supporters.domain.payment.Payment;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BootstrapTest {

    @TempDir
    Path dir;

    private final Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

    @AfterEach
    void restoreRootLevel() {
        root.setLevel(Level.WARN);
    }

    private static ConfigPort config(Map<String, String> values) {
        return values::getOrDefault;
    }

    @Test
    void pathsBecomeSqliteUrls() {
        assertThat(Bootstrap.toUrl("data/x.db")).isEqualTo("jdbc:sqlite:data/x.db");
        assertThat(Bootstrap.toUrl("jdbc:sqlite:y.db")).isEqualTo("jdbc:sqlite:y.db");
    }

    @Test
    void configuredUrlIsUsedWithoutOverride() {
        Path db = dir.resolve("nested/ledger.db");

        PaymentLedgerPort ledger = Bootstrap.createLedger(config(Map.of("db.url", "jdbc:sqlite:" + db)), null);
        ledger.record(List.of(Payment.of("alice", MonthDate.of(2024, 1, 1), "X:Annual")));

        assertThat(Files.exists(db)).isTrue();
    }

    @Test
    void configuredLogLevelIsApplied() {
        Bootstrap.applyLogLevel(config(Map.of("log.level", "debug")));

        assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void unsetOrUnknownLogLevelUsesDefault() {
        root.setLevel(Level.TRACE);
        Bootstrap.applyLogLevel(config(Map.of()));
        assertThat(root.getLevel()).isEqualTo(Level.WARN);

        root.setLevel(Level.TRACE);
        Bootstrap.applyLogLevel(config(Map.of("log.level", "chatty")));
        assertThat(root.getLevel()).isEqualTo(Level.WARN);
    }
}
