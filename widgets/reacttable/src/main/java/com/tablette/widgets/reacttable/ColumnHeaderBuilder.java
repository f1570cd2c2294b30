package com.tablette.widgets.reacttable;

import com.tablette.core.DeepPaths;
import com.tablette.core.Dimension;
import com.tablette.core.HierarchicalIndex;
import com.tablette.core.Item;
import com.tablette.core.Level;
import com.tablette.core.ResultTable;
import com.tablette.core.Totals;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds column header definitions for a pivoted result table.
 */
public final class ColumnHeaderBuilder {
    private final Map<String, Item> items;
    private final DisplayValues displayValues;

    /**
     * @param items         metrics, references and the totals item by key
     * @param displayValues display values of dimension values
     */
    public ColumnHeaderBuilder(Map<String, Item> items, DisplayValues displayValues) {
        this.items = items;
        this.displayValues = displayValues;
    }

    /**
     * One flat header per named row level, accessed by the level name. A table whose rows
     * carry no dimensions gets none.
     */
    public List<ColumnHeaderNode> dimensionHeaders(ResultTable table, List<Dimension> dimensions) {
        List<ColumnHeaderNode> headers = new ArrayList<>();
        HierarchicalIndex rows = table.rowIndex();
        if (rows.isDefault()) {
            return headers;
        }

        for (Level level : rows.levels()) {
            if (!level.isNamed()) {
                continue;
            }
            headers.add(ColumnHeaderNode.leaf(dimensionLabel(level, dimensions), level.name()));
        }
        return headers;
    }

    /**
     * Converts the column index into a header tree, one tree level per index level.
     * <pre>
     * [{Header: "2024-01", columns: [{Header: "Sales", accessor: "2024-01.sales"}, ...]}, ...]
     * </pre>
     * If the metrics level was collapsed out of the column index, its sole key (the table's
     * name) is appended to every accessor so that leaves still address a metric.
     */
    public List<ColumnHeaderNode> metricHeaders(ResultTable table) {
        HierarchicalIndex columns = table.columnIndex();
        if (columns.isEmpty()) {
            return new ArrayList<>();
        }
        return build(columns, new ArrayList<>(), table.name());
    }

    private List<ColumnHeaderNode> build(HierarchicalIndex columns, List<Object> previousLevels, String collapsedMetric) {
        Level level = columns.level(0);
        List<ColumnHeaderNode> headers = new ArrayList<>();

        for (HierarchicalIndex.Group group : columns.groupByOuterLevel()) {
            Object value = group.value();
            boolean totals = Totals.isTotals(value);
            String header = header(level, value, totals);

            List<Object> levels = new ArrayList<>(previousLevels);
            levels.add(value);

            if (!group.isLeaf()) {
                headers.add(ColumnHeaderNode.group(header, build(group.rest(), levels, collapsedMetric), totals));
                continue;
            }

            if (collapsedMetric != null) {
                levels.add(collapsedMetric);
            }
            headers.add(ColumnHeaderNode.leaf(header, DeepPaths.join(levels), totals));
        }
        return headers;
    }

    private String header(Level level, Object value, boolean totals) {
        if (level.isMetrics() || totals) {
            Item item = items.get(DeepPaths.keyOf(value));
            return item != null ? item.label() : DeepPaths.keyOf(value);
        }
        String display = displayValues.lookup(level.name(), value);
        return display != null ? display : DeepPaths.keyOf(value);
    }

    private static String dimensionLabel(Level level, List<Dimension> dimensions) {
        if (level.isMetrics()) {
            return "";
        }
        for (Dimension dimension : dimensions) {
            if (dimension.key().equals(level.name())) {
                return dimension.label();
            }
        }
        return level.name();
    }
}
