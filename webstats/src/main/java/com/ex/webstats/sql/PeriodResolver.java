package com.ex.webstats.sql;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.temporal.WeekFields;
import java.util.Locale;

import com.ex.webstats.data.query.FilterState;

/**
 * Maps a date-range preset to an inclusive civil-date window relative to {@code now}.
 * Pure: the caller supplies {@code now} already in the reporting timezone.
 */
public final class PeriodResolver {
    private PeriodResolver(){}

    public static final String CUSTOM = "custom";
    private static final int DEFAULT_TRAILING_DAYS = 30;

    public static ResolvedPeriod resolve(FilterState filters, ZonedDateTime now) {
        return resolve(filters.dateRange(), filters.customStartDate(), filters.customEndDate(), now);
    }

    public static ResolvedPeriod resolve(String preset, LocalDate customStart, LocalDate customEnd, ZonedDateTime now) {
        LocalDate today = now.toLocalDate();
        String key = preset == null ? "" : preset.trim().toLowerCase(Locale.ROOT);

        // custom only counts when both ends are present
        if (CUSTOM.equals(key) && customStart != null && customEnd != null) {
            return ofDateRange(customStart, customEnd, customStart + " - " + customEnd);
        }

        return switch (key) {
            case "today" -> ofDay(today, "Today");
            case "yesterday" -> ofDay(today.minusDays(1), "Yesterday");
            case "this_week" -> ofDateRange(weekRange(today, 0)[0], today, "This week");
            case "last_7_days" -> ofDateRange(today.minusDays(6), today, "Last 7 days");
            case "last_week" -> {
                LocalDate[] range = weekRange(today, -1);
                yield ofDateRange(range[0], range[1], "Last week");
            }
            case "last_28_days" -> ofDateRange(today.minusDays(27), today, "Last 28 days");
            case "current_month", "this-month" -> ofDateRange(today.withDayOfMonth(1), today, labelMonth(today));
            case "last_month", "last-month" -> {
                LocalDate start = today.withDayOfMonth(1).minusMonths(1);
                yield ofDateRange(start, start.plusMonths(1).minusDays(1), labelMonth(start));
            }
            default -> trailing(today, DEFAULT_TRAILING_DAYS);
        };
    }

    /* ===== Helpers ===== */

    private static ResolvedPeriod trailing(LocalDate today, int days) {
        return ofDateRange(today.minusDays(days), today, "Last " + days + " days");
    }

    private static ResolvedPeriod ofDay(LocalDate day, String label){
        return ofDateRange(day, day, label);
    }

    private static ResolvedPeriod ofDateRange(LocalDate start, LocalDate endInclusive, String label){
        return new ResolvedPeriod(start, endInclusive, label);
    }

    // Monday..Sunday of the week offsetWeeks away from base
    private static LocalDate[] weekRange(LocalDate base, int offsetWeeks){
        WeekFields wf = WeekFields.ISO;
        LocalDate shifted = base.plusWeeks(offsetWeeks);
        LocalDate monday = shifted.with(wf.dayOfWeek(), 1);
        LocalDate sunday = shifted.with(wf.dayOfWeek(), 7);
        return new LocalDate[]{monday, sunday};
    }

    private static String labelMonth(LocalDate anyDay){
        return anyDay.getYear() + "-" + String.format(Locale.ROOT, "%02d", anyDay.getMonthValue());
    }

    /** Both ends inclusive; the end day runs until 23:59:59. */
    public record ResolvedPeriod(LocalDate start, LocalDate end, String label) {}
}
