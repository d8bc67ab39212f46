package com.raditha.cildiff.cli;

/**
 * Layout of JSON output selected with {@code --json[=pretty]}.
 */
public enum JsonLayout {
    /**
     * Compact mode - the whole document on one line.
     */
    COMPACT,

    /**
     * Pretty mode - indented, one field per line.
     */
    PRETTY;

    /**
     * Convert a string value to JsonLayout enum.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding layout
     * @throws IllegalArgumentException if the value is not a valid layout
     */
    public static JsonLayout fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("JsonLayout value cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "", "compact" -> COMPACT;
            case "pretty" -> PRETTY;
            default -> throw new IllegalArgumentException(
                    "Invalid JSON layout: " + value + ". Must be: compact or pretty");
        };
    }
}
