package com.raditha.cildiff.model;


/**
 * {@code boolean} and {@code tunable} declarations.
 */
public record BooleanDecl(String name, boolean value) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
