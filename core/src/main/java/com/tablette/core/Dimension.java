package com.tablette.core;

import java.util.Map;

/**
 * Descriptor of a dimension as seen by result transforms. Implemented by
 * {@link BasicDimension} and by the modifiers in {@code com.tablette.core.modifiers}.
 */
public interface Dimension extends Attributed, DeepCopyable<Dimension> {
    String key();

    String label();

    void setLabel(String label);

    Definition definition();

    /**
     * Key of the result column holding human readable values for this dimension, or null.
     */
    String displayKey();

    /**
     * Static raw value to display value mapping. Empty when the dimension has none.
     */
    Map<Object, String> displayValues();

    /**
     * Interval of a datetime dimension, null for any other dimension.
     */
    Interval interval();

    default boolean hasDisplayField() {
        return displayKey() != null;
    }

    default boolean isDatetime() {
        return interval() != null;
    }

    default boolean isRollup() {
        return false;
    }
}
