package com.tablette.widgets.reacttable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tablette.core.BasicDimension;
import com.tablette.core.Dimension;
import com.tablette.core.Interval;
import com.tablette.core.Metric;
import com.tablette.core.MissingColumnException;
import com.tablette.core.Reference;
import com.tablette.core.ResultTable;
import com.tablette.core.Totals;
import com.tablette.core.modifiers.Rollup;
import com.tablette.widgets.reacttable.config.ReactTableConfig;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReactTableTest {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final Metric sales = Metric.of("sales", "Sales");
    private final Metric profit = new Metric("profit", "Profit", "$", null, 2);
    private final Dimension region = BasicDimension.builder("region").label("Region").build();
    private final Dimension month = BasicDimension.builder("date").label("Date").interval(Interval.MONTHLY).build();

    private ResultTable regionMonthSales() {
        return ResultTable.builder()
                .dimensions("region", "date")
                .columns("sales")
                .row(List.of("north", LocalDate.of(2024, 1, 1)), 100)
                .row(List.of("north", LocalDate.of(2024, 2, 1)), 150)
                .row(List.of("south", LocalDate.of(2024, 1, 1)), 200)
                .row(List.of("south", LocalDate.of(2024, 2, 1)), 250)
                .build();
    }

    private static void assertAccessorsAgree(ReactTableResult result) {
        for (RowRecord record : result.data()) {
            for (String accessor : result.leafAccessors()) {
                assertNotNull(record.get(accessor), "record " + record + " lacks " + accessor);
            }
        }
    }

    @Test
    void pivotedDatesBecomeHeaderGroups() {
        ReactTable widget = new ReactTable(ReactTableConfig.builder().metric(sales).pivot("date").build());

        ReactTableResult result = widget.transform(regionMonthSales(), List.of(region, month));

        List<ColumnHeaderNode> columns = result.columns();
        assertEquals(3, columns.size());
        assertEquals(ColumnHeaderNode.leaf("Region", "region"), columns.get(0));
        assertEquals("2024-01", columns.get(1).header());
        assertEquals(List.of(ColumnHeaderNode.leaf("Sales", "2024-01.sales")), columns.get(1).columns());
        assertEquals("2024-02", columns.get(2).header());
        assertEquals(List.of("2024-02.sales"), columns.get(2).leafAccessors());

        assertEquals(2, result.data().size());
        RowRecord north = result.data().get(0);
        assertEquals(CellValue.raw("north"), north.get("region"));
        assertEquals(CellValue.raw(100), north.get("2024-01.sales"));
        assertEquals(CellValue.raw(150), north.get("2024-02.sales"));
        assertFalse(north.get("2024-02.sales").hasDisplay());
        assertEquals(CellValue.raw(250), result.data().get(1).get("2024-02.sales"));
        assertAccessorsAgree(result);
    }

    @Test
    void emptyResultStillHasHeaders() {
        ResultTable empty = ResultTable.builder()
                .dimensions("region")
                .columns("sales", "profit")
                .build();

        ReactTableResult result = ReactTable.of(sales, profit).transform(empty, List.of(region));

        assertEquals(List.of(
                ColumnHeaderNode.leaf("Region", "region"),
                ColumnHeaderNode.leaf("Sales", "sales"),
                ColumnHeaderNode.leaf("Profit", "profit")), result.columns());
        assertTrue(result.data().isEmpty());
    }

    @Test
    void referencesAddColumnsPerGroup() {
        Reference weekOverWeek = Reference.of("wow", "WoW");
        ResultTable table = ResultTable.builder()
                .dimensions("region")
                .columns("sales", "sales_wow")
                .row(List.of("north"), 100, 90)
                .row(List.of("south"), 200, 180)
                .build();
        ReactTable widget = new ReactTable(ReactTableConfig.builder().metric(sales).pivot("region").build());

        ReactTableResult result = widget.transform(table, List.of(region), List.of(weekOverWeek));

        assertEquals(2, result.columns().size());
        ColumnHeaderNode north = result.columns().get(0);
        assertEquals("north", north.header());
        assertEquals(List.of(
                ColumnHeaderNode.leaf("Sales", "north.sales"),
                ColumnHeaderNode.leaf("Sales (WoW)", "north.sales_wow")), north.columns());
        assertEquals(List.of("north.sales", "north.sales_wow", "south.sales", "south.sales_wow"), result.leafAccessors());

        assertEquals(1, result.data().size());
        assertEquals(CellValue.raw(180), result.data().get(0).get("south.sales_wow"));
        assertAccessorsAgree(result);
    }

    @Test
    void rollupRowsAreLabelledTotals() {
        ResultTable table = ResultTable.builder()
                .dimensions("region")
                .columns("sales")
                .row(List.of("north"), 100)
                .row(List.of("south"), 200)
                .row(Arrays.asList((Object) null), 300)
                .build();

        ReactTableResult result = ReactTable.of(sales).transform(table, List.of(new Rollup(region)));

        RowRecord totals = result.data().get(2);
        assertEquals(new CellValue(Totals.VALUE, "Totals"), totals.get("region"));
        assertEquals(CellValue.raw(300), totals.get("sales"));
    }

    @Test
    void pivotedRollupColumnIsMarked() {
        ResultTable table = ResultTable.builder()
                .dimensions("date", "region")
                .columns("sales")
                .row(List.of(LocalDate.of(2024, 1, 1), "north"), 100)
                .row(List.of(LocalDate.of(2024, 1, 1), "south"), 200)
                .row(Arrays.asList(LocalDate.of(2024, 1, 1), null), 300)
                .build();
        ReactTable widget = new ReactTable(ReactTableConfig.builder().metric(sales).pivot("region").build());

        ReactTableResult result = widget.transform(table, List.of(month, region));

        List<ColumnHeaderNode> columns = result.columns();
        assertEquals(4, columns.size());
        assertEquals("Date", columns.get(0).header());
        assertFalse(columns.get(1).totalsMarker());
        assertFalse(columns.get(2).totalsMarker());
        ColumnHeaderNode totals = columns.get(3);
        assertTrue(totals.totalsMarker());
        assertEquals("Totals", totals.header());
        assertEquals(List.of("$totals.sales"), totals.leafAccessors());
        assertEquals(CellValue.raw(300), result.data().get(0).get(List.of(Totals.VALUE, "sales")));
        assertAccessorsAgree(result);
    }

    @Test
    void singleMetricPivotedOnEveryDimensionCollapses() {
        ResultTable table = ResultTable.builder()
                .dimensions("region")
                .columns("sales")
                .row(List.of("north"), 100)
                .row(List.of("south"), 200)
                .build();
        ReactTable widget = new ReactTable(ReactTableConfig.builder().metric(sales).pivot("region").build());

        ReactTableResult result = widget.transform(table, List.of(region));

        assertEquals(List.of(
                ColumnHeaderNode.leaf("north", "north.sales"),
                ColumnHeaderNode.leaf("south", "south.sales")), result.columns());
        assertEquals(1, result.data().size());
        assertEquals(CellValue.raw(200), result.data().get(0).get("south.sales"));
        assertAccessorsAgree(result);
    }

    @Test
    void transposeMovesMetricsToRows() {
        ResultTable table = ResultTable.builder()
                .dimensions("region")
                .columns("sales", "profit")
                .row(List.of("north"), 100, 1.5)
                .row(List.of("south"), 200, 2.25)
                .build();
        ReactTable widget = new ReactTable(ReactTableConfig.builder()
                .metric(sales).metric(profit).transpose(true).build());

        ReactTableResult result = widget.transform(table, List.of(region));

        assertEquals(List.of(
                ColumnHeaderNode.leaf("", "metrics"),
                ColumnHeaderNode.leaf("north", "north"),
                ColumnHeaderNode.leaf("south", "south")), result.columns());
        RowRecord profitRow = result.data().get(1);
        assertEquals(new CellValue("profit", "Profit"), profitRow.get("metrics"));
        assertEquals(CellValue.raw(2.25), profitRow.get("south"));
        assertAccessorsAgree(result);
    }

    @Test
    void metricsAreFormattedWhenNotPivoted() {
        ResultTable table = ResultTable.builder()
                .dimensions("region")
                .columns("sales", "profit")
                .row(List.of("north"), 1234567, 1.5)
                .row(List.of("south"), null, Double.NEGATIVE_INFINITY)
                .build();

        ReactTableResult result = ReactTable.of(sales, profit).transform(table, List.of(region));

        assertEquals(new CellValue(1234567, "1,234,567"), result.data().get(0).get("sales"));
        assertEquals(new CellValue(1.5, "$1.50"), result.data().get(0).get("profit"));
        assertEquals(CellValue.raw("NaN"), result.data().get(1).get("sales"));
        assertEquals(new CellValue("Inf", "$Inf"), result.data().get(1).get("profit"));
    }

    @Test
    void displayFieldsLabelDimensionValues() {
        Dimension account = BasicDimension.builder("account").label("Account").displayKey("account_display").build();
        ResultTable table = ResultTable.builder()
                .dimensions("account")
                .columns("account_display", "sales")
                .row(List.of(1), "Acme", 10)
                .row(List.of(2), "Globex", 20)
                .build();

        ReactTableResult flat = ReactTable.of(sales).transform(table, List.of(account));
        ReactTableResult pivoted = new ReactTable(ReactTableConfig.builder().metric(sales).pivot("account").build())
                .transform(table, List.of(account));

        assertEquals(List.of(ColumnHeaderNode.leaf("Account", "account"), ColumnHeaderNode.leaf("Sales", "sales")),
                flat.columns());
        assertEquals(new CellValue(2, "Globex"), flat.data().get(1).get("account"));
        assertEquals(List.of(ColumnHeaderNode.leaf("Acme", "1.sales"), ColumnHeaderNode.leaf("Globex", "2.sales")),
                pivoted.columns());
        assertAccessorsAgree(pivoted);
    }

    @Test
    void staticDisplayValuesLabelDimensionValues() {
        Dimension gender = BasicDimension.builder("gender").label("Gender")
                .displayValue("m", "Male").displayValue("f", "Female").build();
        ResultTable table = ResultTable.builder()
                .dimensions("gender")
                .columns("sales")
                .row(List.of("m"), 10)
                .build();

        ReactTableResult result = ReactTable.of(sales).transform(table, List.of(gender));

        assertEquals(new CellValue("m", "Male"), result.data().get(0).get("gender"));
    }

    @Test
    void missingMetricColumnsFailTheTransform() {
        ResultTable table = ResultTable.builder()
                .dimensions("region")
                .columns("sales")
                .row(List.of("north"), 1)
                .build();

        MissingColumnException e = assertThrows(MissingColumnException.class,
                () -> ReactTable.of(sales, profit).transform(table, List.of(region)));
        assertEquals(List.of("profit"), e.getMissing());
    }

    @Test
    void maxColumnsCapsTheColumns() {
        ReactTable widget = new ReactTable(ReactTableConfig.builder()
                .metric(sales).pivot("date").maxColumns(1).build());

        ReactTableResult result = widget.transform(regionMonthSales(), List.of(region, month));

        assertEquals(List.of("region", "2024-01.sales"), result.leafAccessors());
        assertNull(result.data().get(0).get("2024-02.sales"));
    }

    @Test
    void inputTableIsNotModified() {
        ResultTable table = regionMonthSales();
        ReactTable widget = new ReactTable(ReactTableConfig.builder().metric(sales).pivot("date").build());

        widget.transform(table, List.of(region, month));

        assertEquals(LocalDate.of(2024, 1, 1), table.rowIndex().entry(0).get(1));
        assertEquals(2, table.rowIndex().depth());
        assertFalse(table.columnIndex().level(0).isMetrics());
    }

    @Test
    void rendersJson() throws Exception {
        ResultTable table = ResultTable.builder()
                .dimensions("date", "region")
                .columns("sales")
                .row(List.of(LocalDate.of(2024, 1, 1), "north"), 100)
                .row(Arrays.asList(LocalDate.of(2024, 1, 1), null), 100)
                .build();
        ReactTable widget = new ReactTable(ReactTableConfig.builder().metric(sales).pivot("region").build());

        JsonNode json = objectMapper.readTree(widget.render(table, List.of(month, region), List.of()));

        JsonNode columns = json.get("columns");
        assertEquals("Date", columns.get(0).get("Header").asText());
        assertEquals("date", columns.get(0).get("accessor").asText());
        assertFalse(columns.get(0).has("columns"));
        assertFalse(columns.get(1).has("className"));
        assertEquals("totals-marker", columns.get(2).get("className").asText());
        assertEquals("$totals.sales", columns.get(2).get("columns").get(0).get("accessor").asText());

        JsonNode row = json.get("data").get(0);
        assertEquals("2024-01", row.get("date").get("raw").asText());
        assertEquals(100, row.get("north").get("sales").get("raw").asInt());
        assertFalse(row.get("north").get("sales").has("display"));
        assertEquals(100, row.get("$totals").get("sales").get("raw").asInt());
    }

    @Test
    void describesItsMetrics() {
        assertEquals("ReactTable(sales,profit)", ReactTable.of(sales, profit).toString());
    }
}
