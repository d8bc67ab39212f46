package com.raditha.cildiff.compare;

import com.raditha.cildiff.diff.DiffTreeNode;
import com.raditha.cildiff.extraction.FieldHashes;
import com.raditha.cildiff.extraction.SemanticFieldExtractor;
import com.raditha.cildiff.hash.Digest;
import com.raditha.cildiff.hash.HashState;
import com.raditha.cildiff.model.CilFlavor;
import com.raditha.cildiff.model.CilNode;
import com.raditha.cildiff.model.PolicyModelException;

/**
 * A CIL node together with its partial and full digest.
 * <p>
 * Container flavors also own the {@link NodeSet} of their children, whose aggregate digest is
 * folded into the full digest. Two nodes with equal full digests are semantically identical.
 */
public final class ComparableNode {

    private final CilNode node;
    private final Digest partialHash;
    private final Digest fullHash;
    private final NodeSet children;

    private ComparableNode(CilNode node, Digest partialHash, Digest fullHash, NodeSet children) {
        this.node = node;
        this.partialHash = partialHash;
        this.fullHash = fullHash;
        this.children = children;
    }

    /**
     * Wrap a node, recursively building the sets of all container descendants.
     */
    public static ComparableNode create(CilNode node, SemanticFieldExtractor extractor) {
        FieldHashes hashes = extractor.extract(node);
        HashState full = hashes.full();
        if (node.getFlavor().isContainer()) {
            Digest partial = hashes.isSplit() ? hashes.partial().finish() : full.copy().finish();
            NodeSet children = NodeSet.create(node.getChildren(), extractor);
            full.update(children.getFullHash());
            return new ComparableNode(node, partial, full.finish(), children);
        }
        Digest fullHash = full.finish();
        Digest partial = hashes.isSplit() ? hashes.partial().finish() : fullHash;
        return new ComparableNode(node, partial, fullHash, null);
    }

    /**
     * Compare a matched pair. Containers delegate to their child sets; leaves are fully
     * decided by the enclosing subset and produce nothing here.
     *
     * @param left     left node, or null
     * @param right    right node, or null
     * @param diffNode the diff tree node recording this pair
     */
    public static void compare(ComparableNode left, ComparableNode right, DiffTreeNode diffNode) {
        CilFlavor flavor = flavorOf(left, right);
        if (flavor == null || !flavor.isContainer()) {
            return;
        }
        NodeSet.compare(left != null ? left.children : null, right != null ? right.children : null, diffNode);
    }

    /**
     * Similarity of two nodes of the same flavor, either of which may be absent.
     */
    public static Similarity similarity(ComparableNode left, ComparableNode right) {
        CilFlavor flavor = flavorOf(left, right);
        if (flavor == null) {
            return Similarity.NONE;
        }
        if (flavor.isContainer()) {
            return NodeSet.similarity(left != null ? left.children : null, right != null ? right.children : null);
        }
        if (left != null && right != null && left.fullHash.equals(right.fullHash)) {
            return Similarity.IDENTICAL;
        }
        return new Similarity(0, left != null ? 1 : 0, right != null ? 1 : 0);
    }

    private static CilFlavor flavorOf(ComparableNode left, ComparableNode right) {
        if (left != null && right != null && left.getFlavor() != right.getFlavor()) {
            throw new PolicyModelException("Cannot compare " + left.node + " with " + right.node);
        }
        return left != null ? left.getFlavor() : right != null ? right.getFlavor() : null;
    }

    public CilNode getNode() {
        return node;
    }

    public CilFlavor getFlavor() {
        return node.getFlavor();
    }

    public Digest getPartialHash() {
        return partialHash;
    }

    public Digest getFullHash() {
        return fullHash;
    }

    /**
     * @return the child set of a container, or null for leaf flavors
     */
    public NodeSet getChildren() {
        return children;
    }

    @Override
    public String toString() {
        return node + "#" + fullHash.toHex().substring(0, 12);
    }
}
