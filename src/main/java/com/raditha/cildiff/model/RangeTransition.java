package com.raditha.cildiff.model;

public record RangeTransition(String source, String executable, String objectClass, Ref<LevelRange> range) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
