package com.tablette.core;

/**
 * Anything that labels and formats a column of values: a metric, a metric compared
 * against a reference, or the totals pseudo-item.
 */
public interface Item {
    String key();

    String label();

    String prefix();

    String suffix();

    Integer precision();
}
