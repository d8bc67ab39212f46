package com.raditha.cildiff.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * A reference that is written either as the name of a declared structure or as an
 * anonymous inline structure. Exactly one of the two is present.
 *
 * @param name   the referenced name, or null when inline
 * @param inline the inline structure, or null when named
 * @param <T>    payload type of the inline form
 */
public record Ref<T extends CilData>(String name, T inline) {

    public Ref {
        if ((name == null) == (inline == null)) {
            throw new IllegalArgumentException("Reference must be either named or inline");
        }
    }

    public static <T extends CilData> Ref<T> named(String name) {
        return new Ref<>(Objects.requireNonNull(name), null);
    }

    public static <T extends CilData> Ref<T> inline(T value) {
        return new Ref<>(null, Objects.requireNonNull(value));
    }

    public boolean isNamed() {
        return name != null;
    }

    /**
     * The name when named, otherwise the inline structure.
     */
    @JsonValue
    public Object value() {
        return isNamed() ? name : inline;
    }
}
