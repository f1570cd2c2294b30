package com.tablette.core;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Metric(
        @JsonProperty("key") String key,
        @JsonProperty("label") String label,
        @JsonProperty("prefix") String prefix,
        @JsonProperty("suffix") String suffix,
        @JsonProperty("precision") Integer precision
) implements Item {
    public Metric {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Metric key is required");
        }
    }

    public static Metric of(String key, String label) {
        return new Metric(key, label, null, null, null);
    }

    @Override
    public String label() {
        return label != null ? label : key;
    }
}
