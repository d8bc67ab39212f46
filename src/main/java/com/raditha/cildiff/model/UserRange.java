package com.raditha.cildiff.model;

public record UserRange(String user, Ref<LevelRange> range) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
