package com.raditha.cildiff.model;


/**
 * {@code selinuxuser} and {@code selinuxuserdefault}.
 *
 * @param name the login name, or null for selinuxuserdefault
 */
public record SelinuxUser(String name, String user, Ref<LevelRange> range) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
