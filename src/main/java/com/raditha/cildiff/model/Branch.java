package com.raditha.cildiff.model;


/**
 * Payload of the true or false branch of a conditional. The branch value is the flavor.
 */
public record Branch() implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
