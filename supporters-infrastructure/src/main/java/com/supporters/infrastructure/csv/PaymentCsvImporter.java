package com.supporters.infrastructure.csv;

import com.supporters.application.ports.PaymentLedgerPort;
import com.supporters.domain.calendar.MonthDate;
import com.supporters.domain.payment.Payment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Loads payments from CSV with header {@code date,entity,payee,program,amount} (any column order).
 * The whole file is parsed before anything is recorded, so a bad line leaves the ledger untouched.
 */
public final class PaymentCsvImporter {

    private static final Logger log = LoggerFactory.getLogger(PaymentCsvImporter.class);

    static final List<String> REQUIRED = List.of("date", "entity");

    private final PaymentLedgerPort ledger;

    public PaymentCsvImporter(PaymentLedgerPort ledger) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    public int importFile(Path file) throws IOException {
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            int n = ledger.record(parse(r));
            log.info("[IMPORT] file={} payments={}", file, n);
            return n;
        }
    }

    /**
     * @throws PaymentImportException on a missing header column or a malformed row
     */
    public List<Payment> parse(Reader reader) throws IOException {
        BufferedReader in = (reader instanceof BufferedReader) ? (BufferedReader) reader : new BufferedReader(reader);

        String header = in.readLine();
        if (header == null) return List.of();
        if (header.startsWith("\uFEFF")) header = header.substring(1);

        Map<String, Integer> cols = columns(header);
        List<Payment> out = new ArrayList<>();

        int lineNo = 1;
        String line;
        while ((line = in.readLine()) != null) {
            lineNo++;
            if (line.isBlank()) continue;
            try {
                List<String> f = Csv.split(line);
                String entity = field(f, cols, "entity");
                if (entity == null) throw new IllegalArgumentException("entity is empty");
                String date = field(f, cols, "date");
                if (date == null) throw new IllegalArgumentException("date is empty");

                out.add(new Payment(
                        MonthDate.parse(date),
                        entity,
                        field(f, cols, "payee"),
                        field(f, cols, "program"),
                        field(f, cols, "amount")));
            } catch (RuntimeException e) {
                throw new PaymentImportException(lineNo, e.getMessage(), e);
            }
        }
        return out;
    }

    private static Map<String, Integer> columns(String header) {
        List<String> names = Csv.split(header);
        Map<String, Integer> cols = new HashMap<>();
        for (int i = 0; i < names.size(); i++) {
            cols.put(names.get(i).trim().toLowerCase(Locale.ROOT), i);
        }
        for (String req : REQUIRED) {
            if (!cols.containsKey(req)) {
                throw new PaymentImportException(1, "missing column '" + req + "' in header", null);
            }
        }
        return cols;
    }

    private static String field(List<String> fields, Map<String, Integer> cols, String name) {
        Integer idx = cols.get(name);
        if (idx == null || idx >= fields.size()) return null;
        String v = fields.get(idx).trim();
        return v.isEmpty() ? null : v;
    }
}
