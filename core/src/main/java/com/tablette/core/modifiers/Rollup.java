package com.tablette.core.modifiers;

import com.tablette.core.Definition;
import com.tablette.core.Dimension;

/**
 * Marks a dimension for rollup. The dimension's definition becomes NULL, so an aggregation
 * query grouped on it returns the totals across all of its values.
 */
public class Rollup extends DimensionModifier<Rollup> {

    public Rollup(Dimension dimension) {
        super(dimension);
    }

    @Override
    protected Rollup newInstance(Dimension target) {
        return new Rollup(target);
    }

    @Override
    public Definition definition() {
        return Definition.NULL;
    }

    @Override
    public boolean isRollup() {
        return true;
    }
}
