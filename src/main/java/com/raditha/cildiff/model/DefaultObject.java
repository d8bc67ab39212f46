package com.raditha.cildiff.model;

import java.util.List;

/**
 * {@code defaultuser}, {@code defaultrole}, {@code defaulttype} and {@code defaultrange}.
 *
 * @param classes the affected classes; their order carries no meaning
 * @param object  {@code source}, {@code target} or {@code glblub}
 * @param range   {@code low}, {@code high} or {@code low-high} for defaultrange, otherwise null
 */
public record DefaultObject(List<String> classes, String object, String range) implements CilData {

    public DefaultObject {
        classes = List.copyOf(classes);
    }

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
