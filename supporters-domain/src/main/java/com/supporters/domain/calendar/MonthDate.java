package com.supporters.domain.calendar;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Year;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Calendar date with month arithmetic that clamps to the last valid day of the target month.
 *
 * Month lengths come from a fixed table: February is always 28 days, whatever the year.
 * A 29 February date can still be constructed (it is a real date), but any month shift
 * lands on day 28 at most.
 */
public record MonthDate(int year, int month, int day) implements Comparable<MonthDate> {

    private static final int[] MONTH_MAXDAY = {31, 28, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31};

    private static final DateTimeFormatter MONTH_FMT = DateTimeFormatter.ofPattern("yyyy-MM");

    public MonthDate {
        // validates against the real calendar
        LocalDate.of(year, month, day);
    }

    public static MonthDate of(int year, int month, int day) {
        return new MonthDate(year, month, day);
    }

    public static MonthDate from(LocalDate date) {
        Objects.requireNonNull(date, "date");
        return new MonthDate(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    /** ISO date, e.g. {@code 2024-03-15}. */
    public static MonthDate parse(String iso) {
        Objects.requireNonNull(iso, "iso");
        return from(LocalDate.parse(iso.trim()));
    }

    /**
     * Parses {@code YYYY-MM} into the first day of that month.
     *
     * @throws IllegalArgumentException if the text is not a year-month
     */
    public static MonthDate parseMonth(String yearMonth) {
        if (yearMonth == null || yearMonth.isBlank()) {
            throw new IllegalArgumentException("Month is empty, expected YYYY-MM");
        }
        try {
            YearMonth ym = YearMonth.parse(yearMonth.trim(), MONTH_FMT);
            return new MonthDate(ym.getYear(), ym.getMonthValue(), 1);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid month '" + yearMonth + "', expected YYYY-MM", e);
        }
    }

    public static int maxDay(int month) {
        return MONTH_MAXDAY[month - 1];
    }

    public MonthDate adjustMonth(int delta) {
        return adjustMonth(delta, day);
    }

    /**
     * Shifts by {@code delta} whole months (either sign) and uses {@code targetDay},
     * clamped to the fixed-table length of the resulting month.
     *
     * @throws java.time.DateTimeException if the result falls outside the supported year range
     */
    public MonthDate adjustMonth(int delta, int targetDay) {
        if (targetDay < 1) throw new IllegalArgumentException("day must be >= 1: " + targetDay);
        long index = (long) year * 12 + (month - 1) + delta;
        long newYear = Math.floorDiv(index, 12L);
        int newMonth = (int) Math.floorMod(index, 12L) + 1;
        if (newYear < Year.MIN_VALUE || newYear > Year.MAX_VALUE) {
            throw new DateTimeException("Year out of range after shifting " + this + " by " + delta + " month(s)");
        }
        return new MonthDate((int) newYear, newMonth, Math.min(targetDay, maxDay(newMonth)));
    }

    public MonthDate nextMonth() {
        return adjustMonth(1);
    }

    public MonthDate nextMonth(int targetDay) {
        return adjustMonth(1, targetDay);
    }

    public MonthDate nextYear() {
        return adjustMonth(12);
    }

    /** First day of the following month. */
    public MonthDate roundMonthUp() {
        return adjustMonth(1, 1);
    }

    public MonthDate firstOfMonth() {
        return new MonthDate(year, month, 1);
    }

    /** Last real calendar day of this month (29 February in leap years). */
    public MonthDate endOfMonth() {
        return new MonthDate(year, month, YearMonth.of(year, month).lengthOfMonth());
    }

    /** {@code year * 12 + month}, for month differences. */
    public long monthIndex() {
        return (long) year * 12 + month;
    }

    public boolean sameMonth(MonthDate other) {
        return other != null && other.year == year && other.month == month;
    }

    /** Signed number of days from {@code other} to this date ({@code this - other}). */
    public long daysSince(MonthDate other) {
        return ChronoUnit.DAYS.between(other.toLocalDate(), toLocalDate());
    }

    public boolean isBefore(MonthDate other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(MonthDate other) {
        return compareTo(other) > 0;
    }

    public LocalDate toLocalDate() {
        return LocalDate.of(year, month, day);
    }

    public String formatMonth() {
        return YearMonth.of(year, month).format(MONTH_FMT);
    }

    @Override
    public int compareTo(MonthDate o) {
        if (year != o.year) return Integer.compare(year, o.year);
        if (month != o.month) return Integer.compare(month, o.month);
        return Integer.compare(day, o.day);
    }

    @Override
    public String toString() {
        return toLocalDate().toString();
    }
}
