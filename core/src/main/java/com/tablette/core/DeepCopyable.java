package com.tablette.core;

import java.util.Map;

public interface DeepCopyable<T> {
    /**
     * Copies this object and everything it owns. {@code visited} maps originals to their
     * copies (by identity) so that shared or cyclic references are copied exactly once.
     */
    T deepCopy(Map<Object, Object> visited);
}
