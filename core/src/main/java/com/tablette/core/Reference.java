package com.tablette.core;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A comparison of every metric against an alternate period, e.g. week-over-week. The delta
 * variants compare the difference rather than the raw value.
 */
public record Reference(
        @JsonProperty("key") String key,
        @JsonProperty("label") String label,
        @JsonProperty("delta") boolean delta,
        @JsonProperty("deltaPercent") boolean deltaPercent
) {
    public static Reference of(String key, String label) {
        return new Reference(key, label, false, false);
    }

    public Reference asDelta() {
        return new Reference(key, label, true, false);
    }

    public Reference asDeltaPercent() {
        return new Reference(key, label, true, true);
    }

    public String tag() {
        if (deltaPercent) {
            return key + "_delta_percent";
        }
        return delta ? key + "_delta" : key;
    }

    public String tagLabel() {
        if (deltaPercent) {
            return label + " Δ%";
        }
        return delta ? label + " Δ" : label;
    }

    public String keyFor(Item item) {
        return item.key() + "_" + tag();
    }

    public String labelFor(Item item) {
        return item.label() + " (" + tagLabel() + ")";
    }
}
