package com.raditha.cildiff.model;


/**
 * Payload of the synthetic root node.
 */
public record Root() implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
