package com.tablette.core;

/**
 * Free-form named attributes carried by schema objects alongside their typed properties.
 */
public interface Attributed {
    /**
     * @return the attribute value, or null when the attribute is not set
     */
    Object attribute(String name);

    boolean hasAttribute(String name);

    void setAttribute(String name, Object value);
}
