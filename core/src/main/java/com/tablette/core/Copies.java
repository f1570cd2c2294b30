package com.tablette.core;

import java.util.Map;

public final class Copies {
    private Copies() {}

    public static Object deepCopy(Object value, Map<Object, Object> visited) {
        if (value instanceof DeepCopyable) {
            return ((DeepCopyable<?>) value).deepCopy(visited);
        }
        return value;
    }
}
