package com.raditha.cildiff.model;


/**
 * {@code iomemcon}, {@code ioportcon}, {@code pcidevicecon} and {@code pirqcon}.
 * Flavors that take a single value store it with {@code low == high}.
 */
public record DeviceCon(long low, long high, Ref<Context> context) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
