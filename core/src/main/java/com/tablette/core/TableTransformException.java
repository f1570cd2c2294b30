package com.tablette.core;

public class TableTransformException extends RuntimeException {
    public TableTransformException(String message) {
        super(message);
    }

    public TableTransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
