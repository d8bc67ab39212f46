package com.raditha.cildiff.model;

import java.util.List;

/**
 * {@code classorder}, {@code sidorder}, {@code sensitivityorder} and {@code categoryorder}.
 *
 * @param unordered whether the list started with the {@code unordered} keyword
 * @param order     the names in source order, without the marker
 */
public record OrderStatement(boolean unordered, List<String> order) implements CilData {

    public OrderStatement {
        order = List.copyOf(order);
    }

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
