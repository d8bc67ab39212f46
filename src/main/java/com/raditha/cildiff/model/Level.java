package com.raditha.cildiff.model;


/**
 * A level: a sensitivity and optional categories.
 *
 * @param name       declared name, or null when anonymous
 * @param categories category expression, or null
 */
public record Level(String name, String sensitivity, CilExpr categories) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
