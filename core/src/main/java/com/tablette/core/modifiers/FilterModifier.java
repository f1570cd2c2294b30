package com.tablette.core.modifiers;

import com.tablette.core.Definition;
import com.tablette.core.Filter;

import java.util.Map;

public abstract class FilterModifier<M extends FilterModifier<M>> extends Modifier<Filter, M> implements Filter {

    protected FilterModifier(Filter filter) {
        super(filter);
    }

    public Filter filter() {
        return wrapped();
    }

    @Override
    public String key() {
        return wrapped().key();
    }

    @Override
    public Definition definition() {
        return wrapped().definition();
    }

    @Override
    public boolean isExcludedFromRollup() {
        return wrapped().isExcludedFromRollup();
    }

    @Override
    public Filter deepCopy(Map<Object, Object> visited) {
        return deepCopyModifier(visited);
    }
}
