package com.supporters.infrastructure.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.supporters.application.report.ReportTable;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders rows as a JSON array of objects keyed by column name, columns in table order.
 */
public final class JsonReportWriter implements ReportWriter {

    private final ObjectMapper om = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

    @Override
    public void write(ReportTable table, Writer out) throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (List<Object> row : table.rows()) {
            Map<String, Object> obj = new LinkedHashMap<>();
            for (int i = 0; i < table.columns().size(); i++) {
                obj.put(table.columns().get(i), row.get(i));
            }
            rows.add(obj);
        }
        om.writeValue(out, rows);
        out.write('\n');
        out.flush();
    }
}
