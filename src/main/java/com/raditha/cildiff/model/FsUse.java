package com.raditha.cildiff.model;

public record FsUse(String type, String fileSystem, Ref<Context> context) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
