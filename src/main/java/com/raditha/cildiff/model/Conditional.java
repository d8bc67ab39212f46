package com.raditha.cildiff.model;


/**
 * {@code booleanif} and {@code tunableif}; the branches are the node's children.
 */
public record Conditional(CilExpr condition) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
