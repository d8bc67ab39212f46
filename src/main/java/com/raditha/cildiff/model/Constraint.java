package com.raditha.cildiff.model;


/**
 * {@code constrain} and {@code mlsconstrain}.
 */
public record Constraint(Ref<ClassPerms> classPerms, CilExpr expression) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
