package com.raditha.cildiff.model;

public record UserLevel(String user, Ref<Level> level) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
