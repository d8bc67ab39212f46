package com.raditha.cildiff.model;


/**
 * A security context.
 *
 * @param name  declared name, or null when anonymous
 * @param range level range of the context
 */
public record Context(String name, String user, String role, String type, Ref<LevelRange> range) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
