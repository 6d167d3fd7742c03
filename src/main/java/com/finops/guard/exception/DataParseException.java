package com.finops.guard.exception;

/**
 * A cost row carries a {@code day} value that is not an ISO-8601 calendar date.
 */
public class DataParseException extends RuntimeException {

    private final String dimension;
    private final String rawValue;

    public DataParseException(String dimension, String rawValue, Throwable cause) {
        super(String.format("Unparseable day '%s' for dimension %s", rawValue, dimension), cause);
        this.dimension = dimension;
        this.rawValue = rawValue;
    }

    public String getDimension() {
        return dimension;
    }

    public String getRawValue() {
        return rawValue;
    }
}
