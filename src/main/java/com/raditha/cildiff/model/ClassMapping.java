package com.raditha.cildiff.model;

public record ClassMapping(String classMap, String mapPerm, Ref<ClassPerms> classPerms) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
