package com.raditha.cildiff.model;


/**
 * {@code genfscon}.
 *
 * @param fileType optional file type, or null
 */
public record GenFsCon(String fileSystem, String path, String fileType, Ref<Context> context) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
