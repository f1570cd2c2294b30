package com.tablette.core;

public interface Filter extends Attributed, DeepCopyable<Filter> {
    String key();

    Definition definition();

    /**
     * Whether the filter is left out of the auxiliary query that computes rollup rows.
     */
    default boolean isExcludedFromRollup() {
        return false;
    }
}
