package com.raditha.cildiff.compare;

import com.raditha.cildiff.diff.ComparisonStats;
import com.raditha.cildiff.diff.DiffTreeNode;
import com.raditha.cildiff.extraction.SemanticFieldExtractor;
import com.raditha.cildiff.hash.Digest;
import com.raditha.cildiff.model.CilNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * The unordered children of one container, grouped into subsets by partial digest.
 * <p>
 * The aggregate digest is computed over the sorted subset digests, so it does not depend on
 * the order the children were written in. All empty sets share one reserved digest.
 */
public final class NodeSet {

    public static final Digest EMPTY_SET_HASH = Digest.of("<empty-set>".getBytes(StandardCharsets.UTF_8));

    private final NavigableMap<Digest, NodeSubset> subsets;
    private final Digest fullHash;

    private NodeSet(NavigableMap<Digest, NodeSubset> subsets, Digest fullHash) {
        this.subsets = subsets;
        this.fullHash = fullHash;
    }

    /**
     * Build the set of the given siblings. Exact duplicates collapse into one member.
     */
    public static NodeSet create(List<CilNode> nodes, SemanticFieldExtractor extractor) {
        if (nodes.isEmpty()) {
            return new NodeSet(Collections.emptyNavigableMap(), EMPTY_SET_HASH);
        }
        TreeMap<Digest, NodeSubset> subsets = new TreeMap<>();
        for (CilNode node : nodes) {
            ComparableNode comparable = ComparableNode.create(node, extractor);
            subsets.computeIfAbsent(comparable.getPartialHash(), k -> new NodeSubset(comparable.getFlavor()))
                    .add(comparable);
        }
        List<Digest> subsetHashes = new ArrayList<>(subsets.size());
        for (NodeSubset subset : subsets.values()) {
            subsetHashes.add(subset.finish());
        }
        return new NodeSet(Collections.unmodifiableNavigableMap(subsets), Digest.ofSorted(subsetHashes));
    }

    /**
     * Compare two sets, recording differences under {@code diffNode}.
     * <p>
     * Sets with equal aggregate digests are not descended into. Otherwise every subset key is
     * visited exactly once: from the left side, or from the right side when the left lacks it.
     */
    public static void compare(NodeSet left, NodeSet right, DiffTreeNode diffNode) {
        ComparisonStats stats = diffNode.getStats();
        stats.recordSetComparison();
        if (Digest.compare(hashOf(left), hashOf(right)) == 0) {
            stats.recordPrunedSet();
            return;
        }
        for (Map.Entry<Digest, NodeSubset> entry : subsetsOf(left).entrySet()) {
            NodeSubset.compare(entry.getValue(), subsetsOf(right).get(entry.getKey()), diffNode);
        }
        for (Map.Entry<Digest, NodeSubset> entry : subsetsOf(right).entrySet()) {
            if (!subsetsOf(left).containsKey(entry.getKey())) {
                NodeSubset.compare(null, entry.getValue(), diffNode);
            }
        }
    }

    /**
     * Sum of the per-subset similarities, keyed the same way as {@link #compare}.
     */
    public static Similarity similarity(NodeSet left, NodeSet right) {
        Similarity total = Similarity.NONE;
        for (Map.Entry<Digest, NodeSubset> entry : subsetsOf(left).entrySet()) {
            total = total.plus(NodeSubset.similarity(entry.getValue(), subsetsOf(right).get(entry.getKey())));
        }
        for (Map.Entry<Digest, NodeSubset> entry : subsetsOf(right).entrySet()) {
            if (!subsetsOf(left).containsKey(entry.getKey())) {
                total = total.plus(NodeSubset.similarity(null, entry.getValue()));
            }
        }
        return total;
    }

    private static Digest hashOf(NodeSet set) {
        return set != null ? set.fullHash : null;
    }

    private static NavigableMap<Digest, NodeSubset> subsetsOf(NodeSet set) {
        return set != null ? set.subsets : Collections.emptyNavigableMap();
    }

    public Digest getFullHash() {
        return fullHash;
    }

    /**
     * Subsets keyed by partial digest, in ascending key order.
     */
    public NavigableMap<Digest, NodeSubset> getSubsets() {
        return subsets;
    }

    NodeSubset getSubset(Digest partialHash) {
        return subsets.get(partialHash);
    }

    public boolean isEmpty() {
        return subsets.isEmpty();
    }

    /**
     * Number of distinct members across all subsets.
     */
    public int size() {
        int size = 0;
        for (NodeSubset subset : subsets.values()) {
            size += subset.size();
        }
        return size;
    }
}
