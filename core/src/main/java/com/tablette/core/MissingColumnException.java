package com.tablette.core;

import java.util.List;

/**
 * Raised when a result table does not contain columns the caller asked for. This is an
 * upstream query/schema contract breach and aborts the transform.
 */
public class MissingColumnException extends TableTransformException {
    private final List<String> missing;

    public MissingColumnException(List<String> missing) {
        super("Result table is missing columns: " + missing);
        this.missing = List.copyOf(missing);
    }

    public List<String> getMissing() {
        return missing;
    }
}
