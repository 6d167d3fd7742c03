package com.finops.guard.model;

/**
 * Grouping key for cost series: {@code account:service}.
 */
public final class Dimension {

    public static final String SEPARATOR = ":";

    private Dimension() {}

    public static String key(String account, String service) {
        return account + SEPARATOR + service;
    }

    /**
     * Service part of a dimension key, or the whole key when it has no separator.
     */
    public static String serviceOf(String dimension) {
        int idx = dimension.indexOf(SEPARATOR);
        return idx < 0 ? dimension : dimension.substring(idx + SEPARATOR.length());
    }
}
