package com.raditha.cildiff.model;

public record ClassPermissionSet(String name, ClassPerms classPerms) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
