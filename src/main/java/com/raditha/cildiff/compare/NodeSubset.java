package com.raditha.cildiff.compare;

import com.raditha.cildiff.diff.DiffTreeNode;
import com.raditha.cildiff.hash.Digest;
import com.raditha.cildiff.model.CilFlavor;
import com.raditha.cildiff.model.PolicyModelException;

import java.util.Collection;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Siblings sharing one partial digest, keyed by full digest.
 * <p>
 * A member whose full digest is already present is dropped on insertion. After
 * {@link #finish()} the subset is read-only and its digest is the single member's full
 * digest, or the digest of all sorted member digests.
 */
public final class NodeSubset {

    private final CilFlavor flavor;
    private final TreeMap<Digest, ComparableNode> members = new TreeMap<>();
    private Digest fullHash;

    NodeSubset(CilFlavor flavor) {
        this.flavor = flavor;
    }

    /**
     * Add a member.
     *
     * @return false if an identical member was already present and the new one was dropped
     */
    boolean add(ComparableNode node) {
        if (fullHash != null) {
            throw new IllegalStateException("Subset already finished");
        }
        if (node.getFlavor() != flavor) {
            throw new PolicyModelException("Subset of " + flavor.getDisplayName() + " cannot hold " + node.getNode());
        }
        return members.putIfAbsent(node.getFullHash(), node) == null;
    }

    Digest finish() {
        if (members.isEmpty()) {
            fullHash = NodeSet.EMPTY_SET_HASH;
        } else if (members.size() == 1) {
            fullHash = members.firstKey();
        } else {
            fullHash = Digest.ofSorted(members.keySet());
        }
        return fullHash;
    }

    /**
     * Compare two subsets with the same key using the matching policy of their flavor.
     */
    public static void compare(NodeSubset left, NodeSubset right, DiffTreeNode diffNode) {
        CilFlavor flavor = flavorOf(left, right);
        if (flavor == null) {
            return;
        }
        diffNode.getStats().recordSubsetComparison();
        if (Digest.compare(hashOf(left), hashOf(right)) == 0) {
            return;
        }
        SubsetMatchers.forFlavor(flavor).compare(left, right, diffNode);
    }

    public static Similarity similarity(NodeSubset left, NodeSubset right) {
        CilFlavor flavor = flavorOf(left, right);
        if (flavor == null) {
            return Similarity.NONE;
        }
        if (Digest.compare(hashOf(left), hashOf(right)) == 0) {
            return new Similarity(left.size(), 0, 0);
        }
        return SubsetMatchers.forFlavor(flavor).similarity(left, right);
    }

    private static CilFlavor flavorOf(NodeSubset left, NodeSubset right) {
        if (left != null && right != null && left.flavor != right.flavor) {
            throw new PolicyModelException("Subsets of " + left.flavor.getDisplayName() + " and "
                    + right.flavor.getDisplayName() + " share a key");
        }
        return left != null ? left.flavor : right != null ? right.flavor : null;
    }

    private static Digest hashOf(NodeSubset subset) {
        return subset != null ? subset.fullHash : null;
    }

    static NavigableMap<Digest, ComparableNode> membersOf(NodeSubset subset) {
        return subset != null ? subset.members : Collections.emptyNavigableMap();
    }

    public CilFlavor getFlavor() {
        return flavor;
    }

    public Digest getFullHash() {
        return fullHash;
    }

    /**
     * Members in ascending order of full digest.
     */
    public Collection<ComparableNode> getMembers() {
        return Collections.unmodifiableCollection(members.values());
    }

    public boolean contains(Digest fullHash) {
        return members.containsKey(fullHash);
    }

    public int size() {
        return members.size();
    }
}
