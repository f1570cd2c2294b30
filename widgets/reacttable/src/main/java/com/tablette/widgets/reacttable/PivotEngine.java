package com.tablette.widgets.reacttable;

import com.tablette.core.HierarchicalIndex;
import com.tablette.core.Level;
import com.tablette.core.ResultTable;
import com.tablette.core.TableTransformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Moves dimension levels from the row axis to the column axis and optionally transposes
 * the result.
 * <p>
 * Pivoted levels become the outer column levels and the metrics level stays innermost, so a
 * table of {@code (region, date) x (sales)} pivoted on {@code date} becomes
 * {@code (region) x (date, sales)}. Row entries and pivoted value combinations keep the
 * order in which they first appear; combinations with no source row hold null.
 */
public final class PivotEngine {
    private static final Logger logger = LoggerFactory.getLogger(PivotEngine.class);

    private PivotEngine() {}

    public static ResultTable pivot(ResultTable table, List<String> pivotKeys, boolean transpose) {
        ResultTable pivoted = unstack(table, pivotKeys);
        return transpose ? pivoted.transpose() : pivoted;
    }

    static ResultTable unstack(ResultTable table, List<String> pivotKeys) {
        HierarchicalIndex rows = table.rowIndex();
        List<Integer> moved = new ArrayList<>();
        List<Integer> remaining = new ArrayList<>();
        for (int i = 0; i < rows.depth(); i++) {
            Level level = rows.level(i);
            if (level.isNamed() && pivotKeys.contains(level.name())) {
                moved.add(i);
            } else {
                remaining.add(i);
            }
        }

        if (moved.size() < pivotKeys.size()) {
            logger.debug("Ignoring pivot keys not present in the row index {}: {}", rows.levels(), pivotKeys);
        }
        if (moved.isEmpty()) {
            return table;
        }

        Map<List<Object>, Integer> rowPositions = new LinkedHashMap<>();
        Map<List<Object>, Integer> pivotPositions = new LinkedHashMap<>();
        for (List<Object> entry : rows.entries()) {
            rowPositions.putIfAbsent(pick(entry, remaining), rowPositions.size());
            pivotPositions.putIfAbsent(pick(entry, moved), pivotPositions.size());
        }

        HierarchicalIndex columns = table.columnIndex();
        int width = columns.size();

        List<List<Object>> cells = new ArrayList<>(rowPositions.size());
        for (int i = 0; i < rowPositions.size(); i++) {
            cells.add(new ArrayList<>(Collections.nCopies(pivotPositions.size() * width, null)));
        }
        boolean[][] filled = new boolean[rowPositions.size()][pivotPositions.size()];
        for (int i = 0; i < table.rowCount(); i++) {
            List<Object> entry = rows.entry(i);
            int row = rowPositions.get(pick(entry, remaining));
            int block = pivotPositions.get(pick(entry, moved));
            if (filled[row][block]) {
                throw new TableTransformException("Cannot pivot: duplicate row index entry " + entry);
            }
            filled[row][block] = true;
            for (int column = 0; column < width; column++) {
                cells.get(row).set(block * width + column, table.value(i, column));
            }
        }

        List<Level> columnLevels = new ArrayList<>();
        for (int i : moved) {
            columnLevels.add(rows.level(i));
        }
        columnLevels.addAll(columns.levels());
        List<List<Object>> columnEntries = new ArrayList<>(pivotPositions.size() * width);
        for (List<Object> pivotValues : pivotPositions.keySet()) {
            for (List<Object> column : columns.entries()) {
                List<Object> combined = new ArrayList<>(pivotValues);
                combined.addAll(column);
                columnEntries.add(combined);
            }
        }
        HierarchicalIndex pivotedColumns = HierarchicalIndex.of(columnLevels, columnEntries);

        if (!remaining.isEmpty()) {
            List<Level> rowLevels = new ArrayList<>();
            for (int i : remaining) {
                rowLevels.add(rows.level(i));
            }
            HierarchicalIndex pivotedRows = HierarchicalIndex.of(rowLevels, new ArrayList<>(rowPositions.keySet()));
            return ResultTable.of(pivotedRows, pivotedColumns, cells, table.name());
        }

        HierarchicalIndex pivotedRows = HierarchicalIndex.range(cells.size());
        int metricsLevel = metricsLevel(pivotedColumns);
        if (width == 1 && metricsLevel >= 0) {
            String metric = String.valueOf(columns.entry(0).get(metricsLevel - moved.size()));
            logger.debug("Collapsing the metrics level of a single metric table to {}", metric);
            return ResultTable.of(pivotedRows, pivotedColumns.dropLevel(metricsLevel), cells, metric);
        }
        return ResultTable.of(pivotedRows, pivotedColumns, cells, table.name());
    }

    private static int metricsLevel(HierarchicalIndex index) {
        for (int i = 0; i < index.depth(); i++) {
            if (index.level(i).isMetrics()) {
                return i;
            }
        }
        return -1;
    }

    private static List<Object> pick(List<Object> entry, List<Integer> positions) {
        List<Object> picked = new ArrayList<>(positions.size());
        for (int position : positions) {
            picked.add(entry.get(position));
        }
        return picked;
    }
}
