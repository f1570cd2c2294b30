package com.tablette.widgets.reacttable;

import com.tablette.core.DeepPaths;
import com.tablette.core.HierarchicalIndex;
import com.tablette.core.Item;
import com.tablette.core.Level;
import com.tablette.core.ResultTable;
import com.tablette.core.Totals;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds one {@link RowRecord} per table row. Index values are keyed by their level name;
 * cells are keyed by the path of their column so that they line up with the accessors
 * produced by {@link ColumnHeaderBuilder}.
 */
public final class RowDataBuilder {
    private final Map<String, Item> items;
    private final DisplayValues displayValues;

    public RowDataBuilder(Map<String, Item> items, DisplayValues displayValues) {
        this.items = items;
        this.displayValues = displayValues;
    }

    public List<RowRecord> build(ResultTable table) {
        HierarchicalIndex rows = table.rowIndex();
        HierarchicalIndex columns = table.columnIndex();
        List<List<Object>> columnPaths = columnPaths(columns, table.name());
        List<Item> columnItems = new ArrayList<>(columnPaths.size());
        for (List<Object> path : columnPaths) {
            columnItems.add(items.get(DeepPaths.keyOf(path.get(0))));
        }

        List<RowRecord> records = new ArrayList<>(table.rowCount());
        for (ResultTable.Row row : table.rows()) {
            RowRecord record = new RowRecord();

            for (int i = 0; i < rows.depth(); i++) {
                Level level = rows.level(i);
                if (!level.isNamed()) {
                    continue;
                }
                Object value = row.index().get(i);
                record.put(List.of(level.name()), CellValue.of(value, indexDisplay(level, value)));
            }

            for (int column = 0; column < columnPaths.size(); column++) {
                Object value = row.values().get(column);
                Item item = columnItems.get(column);
                String display = item != null
                        ? ValueFormatter.format(value, item.prefix(), item.suffix(), item.precision())
                        : null;
                record.put(columnPaths.get(column), CellValue.of(value, display));
            }

            records.add(record);
        }
        return records;
    }

    private String indexDisplay(Level level, Object value) {
        if (level.isMetrics() || Totals.isTotals(value)) {
            Item item = items.get(DeepPaths.keyOf(value));
            if (item != null) {
                return item.label();
            }
        }
        return displayValues.lookup(level.name(), value);
    }

    private static List<List<Object>> columnPaths(HierarchicalIndex columns, String collapsedMetric) {
        List<List<Object>> paths = new ArrayList<>(columns.size());
        for (List<Object> entry : columns.entries()) {
            List<Object> path = new ArrayList<>(entry);
            if (collapsedMetric != null) {
                path.add(collapsedMetric);
            }
            paths.add(path);
        }
        return paths;
    }
}
