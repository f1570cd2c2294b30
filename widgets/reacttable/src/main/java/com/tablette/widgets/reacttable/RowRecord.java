package com.tablette.widgets.reacttable;

import com.fasterxml.jackson.annotation.JsonValue;
import com.tablette.core.DeepPaths;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One row of table data: {@link CellValue}s nested by the components of their accessor path.
 */
public final class RowRecord {
    private final Map<String, Object> values = new LinkedHashMap<>();

    void put(List<?> path, CellValue cell) {
        DeepPaths.set(values, path, cell);
    }

    public CellValue get(List<?> path) {
        List<String> keys = new ArrayList<>(path.size());
        for (Object component : path) {
            keys.add(DeepPaths.keyOf(component));
        }
        Object value = DeepPaths.get(values, keys);
        return value instanceof CellValue ? (CellValue) value : null;
    }

    /**
     * Looks up a cell by its dot-delimited accessor.
     */
    public CellValue get(String accessor) {
        return get(Arrays.asList(accessor.split("\\.")));
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return "RowRecord" + values;
    }
}
