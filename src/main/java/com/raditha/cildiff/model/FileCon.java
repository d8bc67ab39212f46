package com.raditha.cildiff.model;


/**
 * {@code filecon}.
 *
 * @param context the file context, or null for the empty context {@code ()}
 */
public record FileCon(String path, String fileType, Ref<Context> context) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
