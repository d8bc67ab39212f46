package com.raditha.cildiff.model;


/**
 * A statement that consists of a keyword and a single declared or referenced name,
 * such as {@code (type foo_t)} or {@code (blockinherit base)}.
 */
public record NameStatement(String name) implements CilData {

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
