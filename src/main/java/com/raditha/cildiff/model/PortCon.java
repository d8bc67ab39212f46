package com.raditha.cildiff.model;


/**
 * {@code portcon}; a single port is stored with {@code low == high}.
 */
public record PortCon(String protocol, long low, long high, Ref<Context> context) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
