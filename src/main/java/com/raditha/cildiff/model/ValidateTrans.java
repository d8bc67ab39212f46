package com.raditha.cildiff.model;


/**
 * {@code validatetrans} and {@code mlsvalidatetrans}.
 */
public record ValidateTrans(String className, CilExpr expression) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
