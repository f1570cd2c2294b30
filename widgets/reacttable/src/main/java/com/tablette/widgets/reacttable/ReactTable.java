package com.tablette.widgets.reacttable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tablette.core.Dimension;
import com.tablette.core.Item;
import com.tablette.core.Metric;
import com.tablette.core.Reference;
import com.tablette.core.ReferenceItem;
import com.tablette.core.ResultTable;
import com.tablette.core.TableTransformException;
import com.tablette.core.Totals;
import com.tablette.core.TotalsItem;
import com.tablette.widgets.reacttable.config.ReactTableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Transforms a query result into the {@code columns} and {@code data} props of a
 * react-table grid.
 * <p>
 * Cells are objects with a {@code raw} value and an optional {@code display} value, so the
 * grid needs a cell component that renders {@code display} when present and sorts on
 * {@code raw}.
 * <p>
 * A transform never modifies the table or the descriptors it is given, and instances hold no
 * mutable state, so one instance may serve concurrent requests.
 */
public class ReactTable {
    private static final Logger logger = LoggerFactory.getLogger(ReactTable.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    static final String MISSING_VALUE = "NaN";
    static final String INFINITE_VALUE = "Inf";

    private final ReactTableConfig config;

    public ReactTable(ReactTableConfig config) {
        this.config = config;
    }

    public static ReactTable of(Metric metric, Metric... metrics) {
        ReactTableConfig.Builder builder = ReactTableConfig.builder().metric(metric);
        builder.metrics(Arrays.asList(metrics));
        return new ReactTable(builder.build());
    }

    public ReactTableResult transform(ResultTable table, List<Dimension> dimensions) {
        return transform(table, dimensions, List.of());
    }

    /**
     * @param table      the query result; one row level per dimension, one column per metric
     *                   and reference plus the display-field columns of the dimensions
     * @param dimensions the dimensions selected in the query, in row level order
     * @param references the references selected in the query
     * @throws com.tablette.core.MissingColumnException when the table lacks a required column
     */
    public ReactTableResult transform(ResultTable table, List<Dimension> dimensions, List<Reference> references) {
        Map<String, Item> items = items(references);

        List<String> required = new ArrayList<>();
        for (Dimension dimension : dimensions) {
            if (dimension.hasDisplayField()) {
                required.add(dimension.displayKey());
            }
        }
        items.keySet().stream().filter(key -> !Totals.VALUE.equals(key)).forEach(required::add);

        ResultTable working = table.select(required)
                .fillMissing(MISSING_VALUE)
                .replaceInfinite(INFINITE_VALUE);

        DisplayValues.Extraction extraction = DisplayValues.extract(working, dimensions);
        DisplayValues displayValues = extraction.displayValues();

        working = IndexNormalizer.normalize(extraction.table(), dimensions);
        working = PivotEngine.pivot(working, config.pivot(), config.transpose());
        working = limitColumns(working);

        ColumnHeaderBuilder headers = new ColumnHeaderBuilder(items, displayValues);
        List<ColumnHeaderNode> columns = new ArrayList<>(headers.dimensionHeaders(working, dimensions));
        columns.addAll(headers.metricHeaders(working));

        List<RowRecord> data = new RowDataBuilder(items, displayValues).build(working);

        logger.debug("Transformed {} rows into {} header columns and {} records",
                table.rowCount(), columns.size(), data.size());
        return new ReactTableResult(columns, data);
    }

    /**
     * Transforms and serialises the result to JSON.
     */
    public String render(ResultTable table, List<Dimension> dimensions, List<Reference> references) {
        ReactTableResult result = transform(table, dimensions, references);
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialise react table result", e);
            throw new TableTransformException("Failed to serialise react table result", e);
        }
    }

    /**
     * Metrics crossed with no reference and then each reference, followed by the totals item.
     */
    Map<String, Item> items(List<Reference> references) {
        Map<String, Item> items = new LinkedHashMap<>();
        for (Metric metric : config.metrics()) {
            items.put(metric.key(), ReferenceItem.of(metric, null));
            for (Reference reference : references) {
                ReferenceItem item = ReferenceItem.of(metric, reference);
                items.put(item.key(), item);
            }
        }
        items.put(Totals.VALUE, TotalsItem.INSTANCE);
        return items;
    }

    private ResultTable limitColumns(ResultTable table) {
        Integer maxColumns = config.maxColumns();
        if (maxColumns == null || table.columnCount() <= maxColumns) {
            return table;
        }
        logger.warn("Truncating react table from {} to {} columns", table.columnCount(), maxColumns);
        List<Integer> kept = new ArrayList<>(maxColumns);
        for (int i = 0; i < maxColumns; i++) {
            kept.add(i);
        }
        return table.selectColumns(kept);
    }

    @Override
    public String toString() {
        return "ReactTable(" + config.metrics().stream().map(Metric::key).collect(Collectors.joining(",")) + ")";
    }
}
