package com.tablette.core;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads and writes nested maps by an explicit sequence of path components.
 */
public final class DeepPaths {
    public static final String DELIMITER = ".";

    private DeepPaths() {}

    /**
     * Looks up {@code path} one map level per component, comparing components by equality.
     *
     * @return the value, or null when any step is absent or is not a map
     */
    public static Object get(Map<?, ?> root, List<?> path) {
        Object current = root;
        for (Object component : path) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(component);
        }
        return current;
    }

    /**
     * Writes {@code value} at {@code path}, keying every level by the component's string form
     * and creating intermediate maps as needed.
     *
     * @throws TableTransformException when an intermediate step already holds a non-map value
     */
    @SuppressWarnings("unchecked")
    public static void set(Map<String, Object> root, List<?> path, Object value) {
        if (path.isEmpty()) {
            throw new IllegalArgumentException("Path must have at least one component");
        }
        Map<String, Object> current = root;
        for (Object component : path.subList(0, path.size() - 1)) {
            String key = keyOf(component);
            Object next = current.computeIfAbsent(key, k -> new LinkedHashMap<String, Object>());
            if (!(next instanceof Map)) {
                throw new TableTransformException("Path " + join(path) + " runs through the value at " + key);
            }
            current = (Map<String, Object>) next;
        }
        current.put(keyOf(path.get(path.size() - 1)), value);
    }

    public static String join(List<?> path) {
        return path.stream().map(DeepPaths::keyOf).collect(Collectors.joining(DELIMITER));
    }

    public static String keyOf(Object component) {
        return String.valueOf(component);
    }
}
