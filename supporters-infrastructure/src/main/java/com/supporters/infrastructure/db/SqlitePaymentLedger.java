package com.supporters.infrastructure.db;

import com.supporters.application.ports.PaymentLedgerPort;
import com.supporters.domain.calendar.MonthDate;
import com.supporters.domain.payment.Cadence;
import com.supporters.domain.payment.Payment;
import com.supporters.domain.payment.PaymentHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Payment ledger stored in the SQLite {@code payments} table.
 * Dates are ISO text, so text ordering is chronological; same-day rows are ordered by id.
 */
public final class SqlitePaymentLedger implements PaymentLedgerPort {

    private static final Logger log = LoggerFactory.getLogger(SqlitePaymentLedger.class);

    private final Database database;

    public SqlitePaymentLedger(Database database) {
        this.database = Objects.requireNonNull(database, "database");
        database.initSchema();
    }

    @Override
    public List<String> supporterIds(Set<Cadence> cadences) {
        List<String> suffixes = new ArrayList<>();
        if (cadences != null) {
            for (Cadence c : cadences) {
                if (c != Cadence.UNKNOWN) suffixes.add(c.programSuffix());
            }
        }
        if (suffixes.isEmpty()) return List.of();

        StringBuilder sql = new StringBuilder("""
            SELECT entity
            FROM payments
            WHERE program IS NOT NULL AND (
        """);
        for (int i = 0; i < suffixes.size(); i++) {
            if (i > 0) sql.append(" OR ");
            sql.append("substr(program, -?) = ?");
        }
        sql.append(") ORDER BY id ASC");

        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement(sql.toString())) {

            int idx = 1;
            for (String s : suffixes) {
                ps.setInt(idx++, s.length());
                ps.setString(idx++, s);
            }

            Set<String> seen = new LinkedHashSet<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) seen.add(rs.getString("entity"));
            }
            return new ArrayList<>(seen);
        } catch (SQLException e) {
            throw new LedgerAccessException("supporterIds() failed for " + cadences, e);
        }
    }

    @Override
    public PaymentHistory paymentsAsOf(String supporterId, MonthDate asOf) {
        if (supporterId == null) return PaymentHistory.empty();

        StringBuilder sql = new StringBuilder("""
            SELECT id,date,entity,payee,program,amount
            FROM payments
            WHERE entity = ?
        """);
        if (asOf != null) sql.append(" AND date <= ?");
        sql.append(" ORDER BY date ASC, id ASC");

        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement(sql.toString())) {

            ps.setString(1, supporterId);
            if (asOf != null) ps.setString(2, asOf.toString());

            List<Payment> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(map(rs));
            }
            return PaymentHistory.of(out);
        } catch (SQLException e) {
            throw new LedgerAccessException("paymentsAsOf() failed for " + supporterId, e);
        }
    }

    @Override
    public Optional<MonthDate> earliestPaymentDate() {
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT MIN(date) AS first_date FROM payments");
             ResultSet rs = ps.executeQuery()) {

            if (!rs.next()) return Optional.empty();
            String v = rs.getString("first_date");
            return v == null ? Optional.empty() : Optional.of(MonthDate.parse(v));
        } catch (SQLException e) {
            throw new LedgerAccessException("earliestPaymentDate() failed", e);
        }
    }

    @Override
    public int record(List<Payment> payments) {
        if (payments == null || payments.isEmpty()) return 0;

        String sql = "INSERT INTO payments(date,entity,payee,program,amount) VALUES (?,?,?,?,?)";
        try (Connection c = database.getConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (Payment p : payments) {
                    ps.setString(1, p.date().toString());
                    ps.setString(2, p.entity());
                    ps.setString(3, p.payee());
                    ps.setString(4, p.program());
                    ps.setString(5, p.amount());
                    ps.addBatch();
                }
                ps.executeBatch();
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new LedgerAccessException("record() failed for " + payments.size() + " payment(s)", e);
        }

        log.info("[LEDGER] recorded payments={}", payments.size());
        return payments.size();
    }

    private static Payment map(ResultSet rs) throws SQLException {
        return new Payment(
                MonthDate.parse(rs.getString("date")),
                rs.getString("entity"),
                rs.getString("payee"),
                rs.getString("program"),
                rs.getString("amount")
        );
    }
}
