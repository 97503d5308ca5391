package com.supporters.cli.tools;

import java.util.List;

/**
 * Options of the report commands:
 * {@code [--start-month YYYY-MM] [--end-month YYYY-MM] [--format csv|json] [--db PATH|URL] [--profile NAME] [--verbose]}.
 */
public record ReportOptions(
        String startMonth,
        String endMonth,
        String format,
        String db,
        String profile,
        boolean verbose
) {

    public static ReportOptions parse(String[] args) {
        CliArgs a = CliArgs.parse(args,
                List.of("--start-month", "--end-month", "--format", "--db", "--profile"),
                List.of("--verbose"));
        return new ReportOptions(
                a.value("--start-month"),
                a.value("--end-month"),
                a.value("--format"),
                a.value("--db"),
                a.value("--profile"),
                a.flag("--verbose"));
    }
}
