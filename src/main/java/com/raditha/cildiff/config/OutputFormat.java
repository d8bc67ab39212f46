package com.raditha.cildiff.config;

import java.util.Locale;

/**
 * How a diff is written to standard output.
 */
public enum OutputFormat {
    /** CIL statements under comment headers. */
    CIL,
    /** One JSON document mirroring the diff tree. */
    JSON;

    public static OutputFormat fromString(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Output format must be 'cil' or 'json', got: " + value, e);
        }
    }
}
