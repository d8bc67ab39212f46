package com.raditha.cildiff.model;

public record SensitivityCategory(String sensitivity, CilExpr categories) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
