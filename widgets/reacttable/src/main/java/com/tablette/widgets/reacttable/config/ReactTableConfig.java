package com.tablette.widgets.reacttable.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tablette.core.Metric;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Configuration of a react-table widget: which metrics to show, which dimensions to pivot
 * onto the column axis, whether to transpose, and an optional cap on the column count.
 */
public record ReactTableConfig(
        @JsonProperty("metrics") List<Metric> metrics,
        @JsonProperty("pivot") List<String> pivot,
        @JsonProperty("transpose") boolean transpose,
        @JsonProperty("maxColumns") Integer maxColumns
) {
    public ReactTableConfig {
        if (metrics == null || metrics.isEmpty()) {
            throw new IllegalArgumentException("A react table needs at least one metric");
        }
        if (maxColumns != null && maxColumns < 0) {
            throw new IllegalArgumentException("maxColumns must not be negative: " + maxColumns);
        }
        metrics = List.copyOf(metrics);
        pivot = pivot == null ? List.of() : List.copyOf(pivot);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<Metric> metrics = new ArrayList<>();
        private final List<String> pivot = new ArrayList<>();
        private boolean transpose = false;
        private Integer maxColumns;

        public Builder metric(Metric metric) {
            this.metrics.add(metric);
            return this;
        }

        public Builder metrics(List<Metric> metrics) {
            this.metrics.addAll(metrics);
            return this;
        }

        public Builder pivot(String... dimensionKeys) {
            this.pivot.addAll(Arrays.asList(dimensionKeys));
            return this;
        }

        public Builder transpose(boolean transpose) {
            this.transpose = transpose;
            return this;
        }

        public Builder maxColumns(Integer maxColumns) {
            this.maxColumns = maxColumns;
            return this;
        }

        public ReactTableConfig build() {
            return new ReactTableConfig(metrics, pivot, transpose, maxColumns);
        }
    }
}
