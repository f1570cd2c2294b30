package com.tablette.core.modifiers;

import com.tablette.core.Attributed;
import com.tablette.core.Copies;
import com.tablette.core.DeepCopyable;

import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Decorates a schema object, overriding selected behaviour and forwarding everything else.
 * <p>
 * Attributes are read from the modifier first and then from the wrapped object. Writing an
 * attribute the wrapped object already owns writes through to it; any other attribute is
 * kept on the modifier. Two modifiers are equal when their string forms are, which combine
 * the modifier class with the wrapped object.
 *
 * @param <T> the wrapped type
 * @param <M> the concrete modifier type
 */
public abstract class Modifier<T extends Attributed & DeepCopyable<T>, M extends Modifier<T, M>> implements Attributed {
    private T wrapped;
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    protected Modifier(T wrapped) {
        this.wrapped = Objects.requireNonNull(wrapped, "wrapped");
    }

    /**
     * Creates an empty modifier of the same concrete type around {@code target}.
     */
    protected abstract M newInstance(T target);

    public T wrapped() {
        return wrapped;
    }

    /**
     * A modifier of the same type, carrying the same local attributes, around another object.
     * This modifier is left unchanged.
     */
    public M rebind(T target) {
        M rebound = newInstance(target);
        Modifier<T, M> base = rebound;
        base.attributes.putAll(attributes);
        return rebound;
    }

    /**
     * Shallow copy: local attributes are duplicated, the wrapped object is shared.
     */
    public M copy() {
        return rebind(wrapped);
    }

    /**
     * Deep copy: the wrapped object is duplicated as well.
     */
    public M deepCopy() {
        return deepCopyModifier(new IdentityHashMap<>());
    }

    protected M deepCopyModifier(Map<Object, Object> visited) {
        @SuppressWarnings("unchecked")
        M seen = (M) visited.get(this);
        if (seen != null) {
            return seen;
        }
        M copy = newInstance(wrapped);
        visited.put(this, copy);
        Modifier<T, M> base = copy;
        base.wrapped = wrapped.deepCopy(visited);
        attributes.forEach((name, value) -> base.attributes.put(name, Copies.deepCopy(value, visited)));
        return copy;
    }

    @Override
    public Object attribute(String name) {
        if (attributes.containsKey(name)) {
            return attributes.get(name);
        }
        return wrapped.attribute(name);
    }

    @Override
    public boolean hasAttribute(String name) {
        return attributes.containsKey(name) || wrapped.hasAttribute(name);
    }

    @Override
    public void setAttribute(String name, Object value) {
        if (wrapped.hasAttribute(name)) {
            wrapped.setAttribute(name, value);
            return;
        }
        attributes.put(name, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return toString().equals(o.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + wrapped + ")";
    }
}
