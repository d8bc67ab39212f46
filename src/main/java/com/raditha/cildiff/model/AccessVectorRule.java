package com.raditha.cildiff.model;


/**
 * {@code allow}, {@code auditallow}, {@code dontaudit}, {@code neverallow} and {@code deny}.
 */
public record AccessVectorRule(String source, String target, Ref<ClassPerms> classPerms) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
