package com.tablette.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class BasicDimension implements Dimension {
    private final String key;
    private String label;
    private final Definition definition;
    private final String displayKey;
    private final Map<Object, String> displayValues;
    private final Interval interval;
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    private BasicDimension(String key, String label, Definition definition, String displayKey,
                           Map<Object, String> displayValues, Interval interval) {
        this.key = key;
        this.label = label;
        this.definition = definition;
        this.displayKey = displayKey;
        this.displayValues = displayValues;
        this.interval = interval;
    }

    public static Builder builder(String key) {
        return new Builder(key);
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public String label() {
        return label != null ? label : key;
    }

    @Override
    public void setLabel(String label) {
        this.label = label;
    }

    @Override
    public Definition definition() {
        return definition;
    }

    @Override
    public String displayKey() {
        return displayKey;
    }

    @Override
    public Map<Object, String> displayValues() {
        return displayValues;
    }

    @Override
    public Interval interval() {
        return interval;
    }

    @Override
    public Object attribute(String name) {
        return attributes.get(name);
    }

    @Override
    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    @Override
    public void setAttribute(String name, Object value) {
        attributes.put(name, value);
    }

    @Override
    public Dimension deepCopy(Map<Object, Object> visited) {
        Object seen = visited.get(this);
        if (seen != null) {
            return (Dimension) seen;
        }
        BasicDimension copy = new BasicDimension(key, label, definition, displayKey, displayValues, interval);
        visited.put(this, copy);
        attributes.forEach((name, value) -> copy.attributes.put(name, Copies.deepCopy(value, visited)));
        return copy;
    }

    @Override
    public String toString() {
        return "Dimension(" + key + ")";
    }

    public static class Builder {
        private final String key;
        private String label;
        private Definition definition;
        private String displayKey;
        private final Map<Object, String> displayValues = new LinkedHashMap<>();
        private Interval interval;

        private Builder(String key) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("Dimension key is required");
            }
            this.key = key;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder definition(Definition definition) {
            this.definition = definition;
            return this;
        }

        public Builder definition(String sql) {
            this.definition = Definition.of(sql);
            return this;
        }

        public Builder displayKey(String displayKey) {
            this.displayKey = displayKey;
            return this;
        }

        public Builder displayValue(Object raw, String display) {
            this.displayValues.put(raw, display);
            return this;
        }

        public Builder displayValues(Map<?, String> values) {
            this.displayValues.putAll(values);
            return this;
        }

        public Builder interval(Interval interval) {
            this.interval = interval;
            return this;
        }

        public BasicDimension build() {
            return new BasicDimension(key, label,
                    definition != null ? definition : Definition.of(key),
                    displayKey,
                    Collections.unmodifiableMap(new LinkedHashMap<>(displayValues)),
                    interval);
        }
    }
}
