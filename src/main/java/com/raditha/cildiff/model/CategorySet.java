package com.raditha.cildiff.model;


/**
 * {@code categoryset}.
 */
public record CategorySet(String name, CilExpr categories) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
