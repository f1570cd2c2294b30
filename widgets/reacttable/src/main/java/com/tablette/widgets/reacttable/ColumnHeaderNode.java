package com.tablette.widgets.reacttable;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * A column header. Group headers carry nested {@code columns}; leaf headers carry the
 * {@code accessor} path of the row data they display.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"Header", "columns", "accessor", "className"})
public record ColumnHeaderNode(
        @JsonProperty("Header") String header,
        @JsonProperty("columns") List<ColumnHeaderNode> columns,
        @JsonProperty("accessor") String accessor,
        @JsonIgnore boolean totalsMarker
) {
    public static final String TOTALS_CLASS = "totals-marker";

    public ColumnHeaderNode {
        if ((columns == null) == (accessor == null)) {
            throw new IllegalArgumentException("A header has either nested columns or an accessor: " + header);
        }
        if (columns != null) {
            columns = List.copyOf(columns);
        }
    }

    public static ColumnHeaderNode leaf(String header, String accessor) {
        return new ColumnHeaderNode(header, null, accessor, false);
    }

    public static ColumnHeaderNode leaf(String header, String accessor, boolean totals) {
        return new ColumnHeaderNode(header, null, accessor, totals);
    }

    public static ColumnHeaderNode group(String header, List<ColumnHeaderNode> columns, boolean totals) {
        return new ColumnHeaderNode(header, columns, null, totals);
    }

    @JsonProperty("className")
    public String className() {
        return totalsMarker ? TOTALS_CLASS : null;
    }

    @JsonIgnore
    public boolean isLeaf() {
        return accessor != null;
    }

    /**
     * Accessors of every leaf under (and including) this node, left to right.
     */
    @JsonIgnore
    public List<String> leafAccessors() {
        List<String> accessors = new ArrayList<>();
        collect(this, accessors);
        return accessors;
    }

    private static void collect(ColumnHeaderNode node, List<String> accessors) {
        if (node.isLeaf()) {
            accessors.add(node.accessor());
            return;
        }
        for (ColumnHeaderNode child : node.columns()) {
            collect(child, accessors);
        }
    }
}
