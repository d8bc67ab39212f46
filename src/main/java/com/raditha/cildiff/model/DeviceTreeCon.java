package com.raditha.cildiff.model;

public record DeviceTreeCon(String path, Ref<Context> context) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
