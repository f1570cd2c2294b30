package com.tablette.widgets.reacttable;

import com.tablette.core.Dimension;
import com.tablette.core.HierarchicalIndex;
import com.tablette.core.Interval;
import com.tablette.core.Level;
import com.tablette.core.ResultTable;
import com.tablette.core.Totals;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Prepares a result table's indexes for transformation: datetime levels are rendered with a
 * pattern for their interval, missing index values become the totals value, and the column
 * level is marked as the metrics level.
 */
public final class IndexNormalizer {
    private static final Map<Interval, DateTimeFormatter> DATE_FORMATS = new EnumMap<>(Interval.class);

    static {
        DATE_FORMATS.put(Interval.HOURLY, DateTimeFormatter.ofPattern("yyyy-MM-dd HH:00", Locale.ROOT));
        DATE_FORMATS.put(Interval.DAILY, DateTimeFormatter.ofPattern("yyyy-MM-dd", Locale.ROOT));
        DATE_FORMATS.put(Interval.WEEKLY, DateTimeFormatter.ofPattern("yyyy-MM-dd", Locale.ROOT));
        DATE_FORMATS.put(Interval.MONTHLY, DateTimeFormatter.ofPattern("yyyy-MM", Locale.ROOT));
        DATE_FORMATS.put(Interval.QUARTERLY, DateTimeFormatter.ofPattern("yyyy-'Q'Q", Locale.ROOT));
        DATE_FORMATS.put(Interval.ANNUALLY, DateTimeFormatter.ofPattern("yyyy", Locale.ROOT));
    }

    private IndexNormalizer() {}

    /**
     * @param dimensions the selected dimensions, positionally matching the row index levels
     */
    public static ResultTable normalize(ResultTable table, List<Dimension> dimensions) {
        HierarchicalIndex columns = table.columnIndex();
        if (columns.depth() == 1) {
            table = table.withColumnIndex(columns.withLevel(0, Level.metrics()));
        }
        if (table.isEmpty()) {
            return table;
        }
        return table.withRowIndex(normalizeIndex(table.rowIndex(), dimensions));
    }

    static HierarchicalIndex normalizeIndex(HierarchicalIndex index, List<Dimension> dimensions) {
        if (index.isDefault()) {
            return index;
        }
        int levels = Math.min(index.depth(), dimensions.size());
        for (int i = 0; i < levels; i++) {
            Dimension dimension = dimensions.get(i);
            if (dimension.isDatetime()) {
                DateTimeFormatter formatter = dateFormat(dimension.interval());
                index = index.mapLevel(i, value -> formatDate(value, formatter));
            }
        }
        return index.fillMissing(Totals.VALUE);
    }

    static DateTimeFormatter dateFormat(Interval interval) {
        return DATE_FORMATS.getOrDefault(interval, DATE_FORMATS.get(Interval.DAILY));
    }

    static Object formatDate(Object value, DateTimeFormatter formatter) {
        LocalDateTime dateTime = toLocalDateTime(value);
        return dateTime != null ? formatter.format(dateTime) : value;
    }

    private static LocalDateTime toLocalDateTime(Object value) {
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toLocalDateTime();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toLocalDateTime();
        }
        if (value instanceof Instant) {
            return LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().atStartOfDay();
        }
        if (value instanceof Date) {
            return LocalDateTime.ofInstant(((Date) value).toInstant(), ZoneOffset.UTC);
        }
        return null;
    }
}
