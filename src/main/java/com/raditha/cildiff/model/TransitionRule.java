package com.raditha.cildiff.model;


/**
 * Type and role transition rules.
 *
 * @param objectName the object name of a named type transition, otherwise null
 */
public record TransitionRule(String source, String target, String objectClass, String objectName, String result) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
