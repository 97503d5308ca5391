package com.supporters.infrastructure.report;

import com.supporters.application.report.ReportTable;
import com.supporters.infrastructure.csv.Csv;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Header line plus one line per row, {@code \n} terminated.
 */
public final class CsvReportWriter implements ReportWriter {

    @Override
    public void write(ReportTable table, Writer out) throws IOException {
        writeLine(out, table.columns());
        for (List<Object> row : table.rows()) {
            writeLine(out, row);
        }
        out.flush();
    }

    private static void writeLine(Writer out, List<?> values) throws IOException {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(',');
            Object v = values.get(i);
            sb.append(Csv.escape(v == null ? "" : String.valueOf(v)));
        }
        sb.append('\n');
        out.write(sb.toString());
    }
}
