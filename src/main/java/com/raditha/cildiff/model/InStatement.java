package com.raditha.cildiff.model;


/**
 * {@code (in [before|after] block ...)}; the inserted statements are the node's children.
 */
public record InStatement(boolean after, String block) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
