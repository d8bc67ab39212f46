package com.raditha.cildiff.model;


/**
 * {@code mls} and {@code handleunknown}: a singleton setting whose identity is its flavor.
 */
public record PolicySetting(String value) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
