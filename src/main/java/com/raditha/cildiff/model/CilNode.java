package com.raditha.cildiff.model;

import java.util.List;
import java.util.Objects;

/**
 * One node of a parsed CIL policy.
 * <p>
 * Nodes are immutable once built. Only container flavors carry children; the children of a
 * conditional are exactly its true and false branches.
 */
public final class CilNode {

    private final CilFlavor flavor;
    private final CilData data;
    private final List<CilNode> children;
    private final int line;

    public CilNode(CilFlavor flavor, CilData data, List<CilNode> children, int line) {
        this.flavor = Objects.requireNonNull(flavor, "flavor");
        this.data = Objects.requireNonNull(data, "data");
        this.children = List.copyOf(children);
        this.line = line;
        validateChildren();
    }

    public static CilNode leaf(CilFlavor flavor, CilData data, int line) {
        return new CilNode(flavor, data, List.of(), line);
    }

    public static CilNode root(List<CilNode> children) {
        return new CilNode(CilFlavor.ROOT, new Root(), children, 0);
    }

    private void validateChildren() {
        if (!flavor.isContainer() && !children.isEmpty()) {
            throw new PolicyModelException(flavor.getDisplayName() + " statement on line " + line
                    + " cannot contain " + children.size() + " child statements");
        }
        if (flavor.isConditional()) {
            boolean seenTrue = false;
            boolean seenFalse = false;
            for (CilNode child : children) {
                if (!child.flavor.isBranch()) {
                    throw new PolicyModelException(flavor.getDisplayName() + " on line " + line
                            + " may only contain true and false branches, found " + child.flavor.getDisplayName());
                }
                boolean isTrue = child.flavor == CilFlavor.CONDTRUE;
                if ((isTrue && seenTrue) || (!isTrue && seenFalse)) {
                    throw new PolicyModelException(flavor.getDisplayName() + " on line " + line
                            + " has more than one " + child.flavor.getDisplayName() + " branch");
                }
                seenTrue |= isTrue;
                seenFalse |= !isTrue;
            }
        }
    }

    public CilFlavor getFlavor() {
        return flavor;
    }

    public CilData getData() {
        return data;
    }

    /**
     * Payload cast to the record type of this flavor.
     */
    public <T extends CilData> T getData(Class<T> type) {
        if (!type.isInstance(data)) {
            throw new PolicyModelException(flavor.getDisplayName() + " on line " + line + " carries "
                    + data.getClass().getSimpleName() + ", expected " + type.getSimpleName());
        }
        return type.cast(data);
    }

    public List<CilNode> getChildren() {
        return children;
    }

    public int getLine() {
        return line;
    }

    /**
     * Number of nodes in this subtree, including this one.
     */
    public int size() {
        int count = 1;
        for (CilNode child : children) {
            count += child.size();
        }
        return count;
    }

    @Override
    public String toString() {
        return flavor.getDisplayName() + "@" + line;
    }
}
