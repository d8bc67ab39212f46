package com.raditha.cildiff.model;


/**
 * Extended permissions, either declared by name or written inline in an extended rule.
 *
 * @param name        declared name, or null when anonymous
 * @param kind        the extended permission kind, e.g. {@code ioctl}
 * @param className   the class the permissions apply to
 * @param permissions the permission expression
 */
public record PermissionX(String name, String kind, String className, CilExpr permissions) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
