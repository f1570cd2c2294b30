package com.tablette.core;

/**
 * One level of a {@link HierarchicalIndex}. The kind tells consumers whether the level's
 * values are dimension values or metric/reference keys.
 */
public record Level(String name, Kind kind) {
    public static final String METRICS_NAME = "metrics";

    public enum Kind {
        DIMENSION,
        METRICS
    }

    public static Level dimension(String name) {
        return new Level(name, Kind.DIMENSION);
    }

    public static Level metrics() {
        return new Level(METRICS_NAME, Kind.METRICS);
    }

    public static Level unnamed() {
        return new Level(null, Kind.DIMENSION);
    }

    public boolean isNamed() {
        return name != null;
    }

    public boolean isMetrics() {
        return kind == Kind.METRICS;
    }
}
