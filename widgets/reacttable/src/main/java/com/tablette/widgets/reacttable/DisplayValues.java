package com.tablette.widgets.reacttable;

import com.tablette.core.DeepPaths;
import com.tablette.core.Dimension;
import com.tablette.core.HierarchicalIndex;
import com.tablette.core.ResultTable;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw to display value lookups, per dimension key.
 */
public final class DisplayValues {
    private static final DisplayValues EMPTY = new DisplayValues(Map.of());

    private final Map<String, Map<Object, String>> byDimension;

    private DisplayValues(Map<String, Map<Object, String>> byDimension) {
        this.byDimension = byDimension;
    }

    public static DisplayValues empty() {
        return EMPTY;
    }

    public static DisplayValues of(Map<String, ? extends Map<?, String>> byDimension) {
        Map<String, Map<Object, String>> copy = new LinkedHashMap<>();
        byDimension.forEach((key, values) -> copy.put(key, Collections.unmodifiableMap(new LinkedHashMap<Object, String>(values))));
        return new DisplayValues(Collections.unmodifiableMap(copy));
    }

    /**
     * Collects display values from the display-field columns of {@code table} (the first
     * value seen for each raw value wins) and from the static display values of each
     * dimension, which take precedence. The display-field columns are removed from the
     * returned table.
     */
    public static Extraction extract(ResultTable table, List<Dimension> dimensions) {
        Map<String, Map<Object, String>> byDimension = new LinkedHashMap<>();
        HierarchicalIndex index = table.rowIndex();

        for (Dimension dimension : dimensions) {
            if (dimension.hasDisplayField() && table.hasColumn(dimension.displayKey())) {
                int level = index.indexOf(dimension.key());
                if (level >= 0) {
                    List<Object> displays = table.column(dimension.displayKey());
                    Map<Object, String> values = new LinkedHashMap<>();
                    for (int row = 0; row < displays.size(); row++) {
                        Object display = displays.get(row);
                        values.putIfAbsent(index.entry(row).get(level), display != null ? display.toString() : "null");
                    }
                    byDimension.put(dimension.key(), values);
                }
                table = table.dropColumn(dimension.displayKey());
            }

            if (!dimension.displayValues().isEmpty()) {
                byDimension.put(dimension.key(), dimension.displayValues());
            }
        }

        return new Extraction(table, of(byDimension));
    }

    /**
     * @return the display value for {@code value} of dimension {@code key}, or null
     */
    public String lookup(String key, Object value) {
        if (key == null) {
            return null;
        }
        Object display = DeepPaths.get(byDimension, Arrays.asList(key, value));
        return display != null ? display.toString() : null;
    }

    public record Extraction(ResultTable table, DisplayValues displayValues) {}
}
