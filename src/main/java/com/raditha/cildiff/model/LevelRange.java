package com.raditha.cildiff.model;


/**
 * A range between two levels.
 *
 * @param name declared name, or null when anonymous
 */
public record LevelRange(String name, Ref<Level> low, Ref<Level> high) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
