package com.tablette.widgets.reacttable;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public record ReactTableResult(
        @JsonProperty("columns") List<ColumnHeaderNode> columns,
        @JsonProperty("data") List<RowRecord> data
) {
    public ReactTableResult {
        columns = List.copyOf(columns);
        data = List.copyOf(data);
    }

    @JsonIgnore
    public List<String> leafAccessors() {
        List<String> accessors = new ArrayList<>();
        for (ColumnHeaderNode column : columns) {
            accessors.addAll(column.leafAccessors());
        }
        return accessors;
    }
}
