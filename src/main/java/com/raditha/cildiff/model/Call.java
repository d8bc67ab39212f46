package com.raditha.cildiff.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * A macro call. Arguments are positional and may be nested lists.
 */
public record Call(String macro, List<Argument> arguments) implements CilData {

    public Call {
        arguments = List.copyOf(arguments);
    }

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }

    /**
     * A call argument: either a string leaf or a list of nested arguments.
     *
     * @param value    the string value, or null for a list
     * @param children nested arguments of a list
     */
    public record Argument(String value, List<Argument> children) {

        public Argument {
            children = List.copyOf(children);
            if (value != null && !children.isEmpty()) {
                throw new IllegalArgumentException("A string argument cannot have nested arguments");
            }
        }

        public static Argument string(String value) {
            return new Argument(value, List.of());
        }

        public static Argument list(List<Argument> children) {
            return new Argument(null, children);
        }

        public boolean isList() {
            return value == null;
        }

        @JsonValue
        public Object json() {
            return isList() ? children : value;
        }
    }
}
