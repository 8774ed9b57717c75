package com.flagship.tool_ledger.history;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Partition key scheme of the two ledgers.
 *
 * Per-item buckets are keyed {@code MM-YYYY}, global buckets {@code YYYY/MM/DD}. Both
 * formats are part of the persisted layout and must not change.
 */
public class PartitionKeys {

    private static final DateTimeFormatter MONTH_KEY = DateTimeFormatter.ofPattern("MM-uuuu");
    private static final DateTimeFormatter DAY_KEY = DateTimeFormatter.ofPattern("uuuu/MM/dd");

    private final ZoneId zone;
    private final int maxMonthPartitions;
    private final int maxDayPartitions;

    public PartitionKeys(ZoneId zone, int maxMonthPartitions, int maxDayPartitions) {
        this.zone = zone;
        this.maxMonthPartitions = maxMonthPartitions;
        this.maxDayPartitions = maxDayPartitions;
    }

    public ZoneId getZone() {
        return zone;
    }

    public String monthKey(Instant instant) {
        return MONTH_KEY.format(instant.atZone(zone));
    }

    public String dayKey(Instant instant) {
        return DAY_KEY.format(instant.atZone(zone));
    }

    /**
     * Day key split into its year, month and day path segments.
     */
    public String[] daySegments(Instant instant) {
        return dayKey(instant).split("/");
    }

    /**
     * Month keys covering {@code [start, end]}, oldest first.
     *
     * @throws IllegalArgumentException if the range is inverted or spans too many months
     */
    public List<String> monthKeys(Instant start, Instant end) {
        requireOrdered(start, end);
        YearMonth first = YearMonth.from(start.atZone(zone));
        YearMonth last = YearMonth.from(end.atZone(zone));
        long count = ChronoUnit.MONTHS.between(first, last) + 1;
        if (count > maxMonthPartitions) {
            throw new IllegalArgumentException(String.format(
                "Range spans %d months, at most %d are allowed", count, maxMonthPartitions));
        }
        List<String> keys = new ArrayList<>();
        for (YearMonth month = first; !month.isAfter(last); month = month.plusMonths(1)) {
            keys.add(MONTH_KEY.format(month.atDay(1)));
        }
        return keys;
    }

    /**
     * Days covering {@code [start, end]} as path segments, oldest first.
     *
     * @throws IllegalArgumentException if the range is inverted or spans too many days
     */
    public List<String[]> daySegments(Instant start, Instant end) {
        if (!fitsDayPartitions(start, end)) {
            throw new IllegalArgumentException(String.format(
                "Range spans %d days, at most %d are allowed", dayCount(start, end), maxDayPartitions));
        }
        LocalDate first = LocalDate.ofInstant(start, zone);
        LocalDate last = LocalDate.ofInstant(end, zone);
        List<String[]> keys = new ArrayList<>();
        for (LocalDate day = first; !day.isAfter(last); day = day.plusDays(1)) {
            keys.add(DAY_KEY.format(day).split("/"));
        }
        return keys;
    }

    public boolean fitsDayPartitions(Instant start, Instant end) {
        requireOrdered(start, end);
        return dayCount(start, end) <= maxDayPartitions;
    }

    private long dayCount(Instant start, Instant end) {
        return ChronoUnit.DAYS.between(LocalDate.ofInstant(start, zone), LocalDate.ofInstant(end, zone)) + 1;
    }

    private static void requireOrdered(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Both start and end are required");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Start " + start + " is after end " + end);
        }
    }
}
