package com.supporters.application.report;

import com.supporters.domain.calendar.MonthDate;

/** One report row: its {@code YYYY-MM} label and the date statuses are evaluated as of. */
public record ReportMonth(String label, MonthDate asOf) {
}
