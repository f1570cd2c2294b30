package com.tablette.core.modifiers;

import com.tablette.core.Definition;
import com.tablette.core.Dimension;
import com.tablette.core.Interval;

import java.util.Map;

/**
 * Base for modifiers of a {@link Dimension}; forwards every dimension property to the
 * wrapped dimension.
 */
public abstract class DimensionModifier<M extends DimensionModifier<M>> extends Modifier<Dimension, M> implements Dimension {

    protected DimensionModifier(Dimension dimension) {
        super(dimension);
    }

    public Dimension dimension() {
        return wrapped();
    }

    @Override
    public String key() {
        return wrapped().key();
    }

    @Override
    public String label() {
        return wrapped().label();
    }

    @Override
    public void setLabel(String label) {
        wrapped().setLabel(label);
    }

    @Override
    public Definition definition() {
        return wrapped().definition();
    }

    @Override
    public String displayKey() {
        return wrapped().displayKey();
    }

    @Override
    public Map<Object, String> displayValues() {
        return wrapped().displayValues();
    }

    @Override
    public Interval interval() {
        return wrapped().interval();
    }

    @Override
    public boolean isRollup() {
        return wrapped().isRollup();
    }

    @Override
    public Dimension deepCopy(Map<Object, Object> visited) {
        return deepCopyModifier(visited);
    }
}
