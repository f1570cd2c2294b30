package com.tablette.core;

/**
 * The distinguished index value that marks an aggregated (rollup) row or column.
 * Missing index values are normalised to {@link #VALUE}; the same literal is used in
 * header accessors and row keys so that a client can group them together.
 */
public final class Totals {
    public static final String VALUE = "$totals";
    public static final String LABEL = "Totals";

    private Totals() {}

    public static boolean isTotals(Object value) {
        return VALUE.equals(value);
    }
}
