package com.raditha.cildiff.model;

import java.util.List;

/**
 * A macro declaration; the body statements are the node's children.
 */
public record Macro(String name, List<Parameter> parameters) implements CilData {

    public Macro {
        parameters = List.copyOf(parameters);
    }

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }

    /**
     * @param type parameter type keyword, e.g. {@code type} or {@code classpermission}
     * @param name parameter name
     */
    public record Parameter(String type, String name) {
    }
}
