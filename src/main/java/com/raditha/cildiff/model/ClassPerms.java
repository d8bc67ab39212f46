package com.raditha.cildiff.model;


/**
 * A class together with a permission expression, written inline as {@code (file (read write))}.
 */
public record ClassPerms(String className, CilExpr permissions) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
