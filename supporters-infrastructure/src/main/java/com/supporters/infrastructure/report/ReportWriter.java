package com.supporters.infrastructure.report;

import com.supporters.application.config.ReportSettings.ReportFormat;
import com.supporters.application.report.ReportTable;

import java.io.IOException;
import java.io.Writer;

public interface ReportWriter {

    void write(ReportTable table, Writer out) throws IOException;

    static ReportWriter forFormat(ReportFormat format) {
        return switch (format) {
            case CSV -> new CsvReportWriter();
            case JSON -> new JsonReportWriter();
        };
    }
}
