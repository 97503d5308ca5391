package com.supporters.cli.bootstrap;

import ch.qos.logback.classic.Level;
import com.supporters.application.config.ConfigKey;
import com.supporters.application.ports.ConfigPort;
import com.supporters.application.ports.PaymentLedgerPort;
import com.supporters.infrastructure.db.Database;
import com.supporters.infrastructure.db.SqlitePaymentLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires infrastructure adapters from configuration for CLI commands.
 */
public final class Bootstrap {

    private static final Logger log = LoggerFactory.getLogger(Bootstrap.class);

    private Bootstrap() {}

    /**
     * @param dbOverride JDBC URL or file path from the command line; null to use {@code db.url}
     */
    public static PaymentLedgerPort createLedger(ConfigPort config, String dbOverride) {
        String url = (dbOverride == null || dbOverride.isBlank())
                ? config.get(ConfigKey.DB_URL.key(), ConfigKey.DB_URL.defaultValue())
                : toUrl(dbOverride.trim());
        log.debug("[BOOT] ledger url={}", url);
        return new SqlitePaymentLedger(new Database(url));
    }

    /**
     * Applies {@code log.level}, or its default, to the root logger when Logback is the bound backend.
     * Unrecognised levels fall back to the default.
     */
    public static void applyLogLevel(ConfigPort config) {
        String level = config.get(ConfigKey.LOG_LEVEL.key(), ConfigKey.LOG_LEVEL.defaultValue());
        Level fallback = Level.toLevel(ConfigKey.LOG_LEVEL.defaultValue());

        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.toLevel(level.trim(), fallback));
        }
    }

    static String toUrl(String db) {
        return db.startsWith(Database.URL_PREFIX) ? db : Database.URL_PREFIX + db;
    }
}
