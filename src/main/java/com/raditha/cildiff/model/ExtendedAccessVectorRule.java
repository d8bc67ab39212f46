package com.raditha.cildiff.model;


/**
 * {@code allowx}, {@code auditallowx}, {@code dontauditx} and {@code neverallowx}.
 */
public record ExtendedAccessVectorRule(String source, String target, Ref<PermissionX> permissionX) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
