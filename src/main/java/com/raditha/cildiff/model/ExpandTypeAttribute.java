package com.raditha.cildiff.model;

import java.util.List;

public record ExpandTypeAttribute(List<String> attributes, boolean expand) implements CilData {

    public ExpandTypeAttribute {
        attributes = List.copyOf(attributes);
    }

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
