package com.tablette.core;

import java.util.LinkedHashMap;
import java.util.Map;

public class BasicFilter implements Filter {
    private final String key;
    private final Definition definition;
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    public BasicFilter(String key, Definition definition) {
        this.key = key;
        this.definition = definition;
    }

    public static BasicFilter of(String key, String sql) {
        return new BasicFilter(key, Definition.of(sql));
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public Definition definition() {
        return definition;
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
    public Filter deepCopy(Map<Object, Object> visited) {
        Object seen = visited.get(this);
        if (seen != null) {
            return (Filter) seen;
        }
        BasicFilter copy = new BasicFilter(key, definition);
        visited.put(this, copy);
        attributes.forEach((name, value) -> copy.attributes.put(name, Copies.deepCopy(value, visited)));
        return copy;
    }

    @Override
    public String toString() {
        return "Filter(" + key + ": " + definition.toSql() + ")";
    }
}
