package com.raditha.cildiff.model;


/**
 * {@code typeattributeset}, {@code roleattributeset} and {@code userattributeset}.
 */
public record AttributeSet(String attribute, CilExpr expression) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
