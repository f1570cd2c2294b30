package com.tablette.core;

public enum TotalsItem implements Item {
    INSTANCE;

    @Override
    public String key() {
        return Totals.VALUE;
    }

    @Override
    public String label() {
        return Totals.LABEL;
    }

    @Override
    public String prefix() {
        return null;
    }

    @Override
    public String suffix() {
        return null;
    }

    @Override
    public Integer precision() {
        return null;
    }
}
