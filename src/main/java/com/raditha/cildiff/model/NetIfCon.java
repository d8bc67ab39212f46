package com.raditha.cildiff.model;

public record NetIfCon(String interfaceName, Ref<Context> interfaceContext, Ref<Context> packetContext) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
