package com.tablette.core.modifiers;

import com.tablette.core.Filter;

/**
 * Tags a filter so that it is left out of the query computing rollup rows.
 */
public class OmitFromRollup extends FilterModifier<OmitFromRollup> {

    public OmitFromRollup(Filter filter) {
        super(filter);
    }

    @Override
    protected OmitFromRollup newInstance(Filter target) {
        return new OmitFromRollup(target);
    }

    @Override
    public boolean isExcludedFromRollup() {
        return true;
    }
}
