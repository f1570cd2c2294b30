package com.tablette.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A two dimensional query result: a row index of dimension values, a column index of
 * metric keys (or, after pivoting, combinations of dimension values and metric keys) and a
 * grid of scalar cells.
 * <p>
 * Tables are immutable. Transforming methods return new tables and never touch the
 * receiver, so a table handed in by a caller can be shared freely.
 */
public final class ResultTable {
    private final HierarchicalIndex rowIndex;
    private final HierarchicalIndex columnIndex;
    private final List<List<Object>> cells;
    private final String name;

    private ResultTable(HierarchicalIndex rowIndex, HierarchicalIndex columnIndex, List<List<Object>> cells, String name) {
        this.rowIndex = rowIndex;
        this.columnIndex = columnIndex;
        this.cells = cells;
        this.name = name;
    }

    public static ResultTable of(HierarchicalIndex rowIndex, HierarchicalIndex columnIndex, List<List<Object>> cells) {
        return of(rowIndex, columnIndex, cells, null);
    }

    public static ResultTable of(HierarchicalIndex rowIndex, HierarchicalIndex columnIndex,
                                 List<List<Object>> cells, String name) {
        if (rowIndex.size() != cells.size()) {
            throw new IllegalArgumentException(
                    "Row index has " + rowIndex.size() + " entries but there are " + cells.size() + " rows");
        }
        List<List<Object>> copied = new ArrayList<>(cells.size());
        for (List<Object> row : cells) {
            if (row.size() != columnIndex.size()) {
                throw new IllegalArgumentException(
                        "Row " + row + " does not match " + columnIndex.size() + " columns");
            }
            copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        return new ResultTable(rowIndex, columnIndex, Collections.unmodifiableList(copied), name);
    }

    public static Builder builder() {
        return new Builder();
    }

    public HierarchicalIndex rowIndex() {
        return rowIndex;
    }

    public HierarchicalIndex columnIndex() {
        return columnIndex;
    }

    /**
     * The sole metric key when the metrics level was collapsed out of the column index,
     * otherwise null.
     */
    public String name() {
        return name;
    }

    public int rowCount() {
        return cells.size();
    }

    public int columnCount() {
        return columnIndex.size();
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    public Object value(int row, int column) {
        return cells.get(row).get(column);
    }

    public List<Row> rows() {
        List<Row> rows = new ArrayList<>(cells.size());
        for (int i = 0; i < cells.size(); i++) {
            rows.add(new Row(rowIndex.entry(i), cells.get(i)));
        }
        return rows;
    }

    /**
     * Position of a column in a flat column index, or -1.
     */
    public int columnPosition(String key) {
        List<List<Object>> columns = columnIndex.entries();
        for (int i = 0; i < columns.size(); i++) {
            if (key.equals(columns.get(i).get(0))) {
                return i;
            }
        }
        return -1;
    }

    public boolean hasColumn(String key) {
        return columnPosition(key) >= 0;
    }

    public List<Object> column(String key) {
        int position = columnPosition(key);
        if (position < 0) {
            throw new MissingColumnException(List.of(key));
        }
        List<Object> values = new ArrayList<>(cells.size());
        for (List<Object> row : cells) {
            values.add(row.get(position));
        }
        return values;
    }

    /**
     * Selects columns of a flat column index by key, in the requested order.
     *
     * @throws MissingColumnException when any key is absent
     */
    public ResultTable select(List<String> keys) {
        List<Integer> positions = new ArrayList<>(keys.size());
        List<String> missing = new ArrayList<>();
        for (String key : keys) {
            int position = columnPosition(key);
            if (position < 0) {
                missing.add(key);
            } else {
                positions.add(position);
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingColumnException(missing);
        }
        return selectColumns(positions);
    }

    public ResultTable selectColumns(List<Integer> positions) {
        List<List<Object>> selected = new ArrayList<>(cells.size());
        for (List<Object> row : cells) {
            List<Object> copy = new ArrayList<>(positions.size());
            for (int position : positions) {
                copy.add(row.get(position));
            }
            selected.add(copy);
        }
        return of(rowIndex, columnIndex.select(positions), selected, name);
    }

    public ResultTable dropColumn(String key) {
        int position = columnPosition(key);
        if (position < 0) {
            return this;
        }
        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < columnIndex.size(); i++) {
            if (i != position) {
                kept.add(i);
            }
        }
        return selectColumns(kept);
    }

    /**
     * Replaces null and NaN cells.
     */
    public ResultTable fillMissing(Object replacement) {
        return mapCells(value -> isMissing(value) ? replacement : value);
    }

    public ResultTable replaceInfinite(Object replacement) {
        return mapCells(value -> isInfinite(value) ? replacement : value);
    }

    public ResultTable withRowIndex(HierarchicalIndex index) {
        return of(index, columnIndex, cells, name);
    }

    public ResultTable withColumnIndex(HierarchicalIndex index) {
        return of(rowIndex, index, cells, name);
    }

    public ResultTable transpose() {
        List<List<Object>> swapped = new ArrayList<>(columnIndex.size());
        for (int column = 0; column < columnIndex.size(); column++) {
            List<Object> row = new ArrayList<>(cells.size());
            for (List<Object> original : cells) {
                row.add(original.get(column));
            }
            swapped.add(row);
        }
        return of(columnIndex, rowIndex, swapped, name);
    }

    private ResultTable mapCells(UnaryOperator<Object> mapper) {
        List<List<Object>> mapped = new ArrayList<>(cells.size());
        for (List<Object> row : cells) {
            List<Object> copy = new ArrayList<>(row);
            copy.replaceAll(mapper);
            mapped.add(copy);
        }
        return of(rowIndex, columnIndex, mapped, name);
    }

    static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double) {
            return ((Double) value).isNaN();
        }
        if (value instanceof Float) {
            return ((Float) value).isNaN();
        }
        return false;
    }

    private static boolean isInfinite(Object value) {
        if (value instanceof Double) {
            return ((Double) value).isInfinite();
        }
        if (value instanceof Float) {
            return ((Float) value).isInfinite();
        }
        return false;
    }

    @Override
    public String toString() {
        return "ResultTable{rows=" + rowIndex + ", columns=" + columnIndex + ", name=" + name + "}";
    }

    public record Row(List<Object> index, List<Object> values) {}

    /**
     * Assembles a table in the shape a query result arrives in: one row level per selected
     * dimension and one flat, unnamed column level holding the result's column keys.
     */
    public static class Builder {
        private final List<String> dimensions = new ArrayList<>();
        private final List<String> columns = new ArrayList<>();
        private final List<List<Object>> index = new ArrayList<>();
        private final List<List<Object>> rows = new ArrayList<>();

        public Builder dimensions(String... keys) {
            this.dimensions.addAll(Arrays.asList(keys));
            return this;
        }

        public Builder columns(String... keys) {
            this.columns.addAll(Arrays.asList(keys));
            return this;
        }

        /**
         * A bare {@code null} for {@code values} is read as a single null cell.
         */
        public Builder row(List<?> dimensionValues, Object... values) {
            this.index.add(new ArrayList<>(dimensionValues));
            this.rows.add(new ArrayList<>(Arrays.asList(values != null ? values : new Object[]{null})));
            return this;
        }

        public ResultTable build() {
            HierarchicalIndex rowIndex;
            if (dimensions.isEmpty()) {
                rowIndex = HierarchicalIndex.range(rows.size());
            } else {
                List<Level> levels = new ArrayList<>(dimensions.size());
                for (String dimension : dimensions) {
                    levels.add(Level.dimension(dimension));
                }
                rowIndex = HierarchicalIndex.of(levels, index);
            }
            HierarchicalIndex columnIndex = HierarchicalIndex.flat(Level.unnamed(), columns);
            return of(rowIndex, columnIndex, rows);
        }
    }
}
