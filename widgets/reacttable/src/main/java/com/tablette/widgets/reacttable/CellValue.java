package com.tablette.widgets.reacttable;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single cell: the raw value plus, when it reads differently, the value to show.
 */
public record CellValue(
        @JsonProperty("raw") Object raw,
        @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("display") String display
) {
    public static CellValue raw(Object raw) {
        return new CellValue(raw, null);
    }

    public static CellValue of(Object raw, String display) {
        if (display == null || Objects.equals(display, String.valueOf(raw))) {
            return raw(raw);
        }
        return new CellValue(raw, display);
    }

    public boolean hasDisplay() {
        return display != null;
    }
}
