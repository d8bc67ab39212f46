package com.raditha.cildiff.compare;

import com.raditha.cildiff.diff.Diff;
import com.raditha.cildiff.diff.DiffSide;
import com.raditha.cildiff.diff.DiffTree;
import com.raditha.cildiff.diff.DiffTreeNode;
import com.raditha.cildiff.extraction.SemanticFieldExtractor;
import com.raditha.cildiff.model.NameStatement;
import com.raditha.cildiff.parser.CilAstBuilder;
import com.raditha.cildiff.parser.CilParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityMatcherTest {

    private CilAstBuilder builder;
    private SemanticFieldExtractor extractor;
    private SimilarityMatcher matcher;

    @BeforeEach
    void setUp() {
        builder = new CilAstBuilder();
        extractor = new SemanticFieldExtractor();
        matcher = new SimilarityMatcher(new FlatMatcher());
    }

    private ComparableNode policy(String text) throws CilParseException {
        return ComparableNode.create(builder.build(text), extractor);
    }

    private static List<ComparableNode> members(ComparableNode root) {
        List<ComparableNode> members = new ArrayList<>();
        root.getChildren().getSubsets().values().forEach(subset -> members.addAll(subset.getMembers()));
        return members;
    }

    private static String nameOf(ComparableNode node) {
        return node.getNode().getData(NameStatement.class).name();
    }

    @Test
    void testPairsOptionalsByContent() throws CilParseException {
        ComparableNode left = policy("(optional o1 (type a_t) (type b_t))\n"
                + "(optional o2 (type x_t) (type y_t))");
        ComparableNode right = policy("(optional o1 (type a_t) (type c_t))\n"
                + "(optional o3 (type z_t))");

        DiffTree tree = DiffTree.compare(left, right);
        DiffTreeNode root = tree.getRoot();

        assertEquals(1, root.getChildren().size());
        DiffTreeNode pair = root.getChildren().get(0);
        assertEquals("o1", nameOf(pair.getLeft()));
        assertEquals("o1", nameOf(pair.getRight()));
        assertEquals(2, pair.getDiffs().size());
        assertEquals(DiffSide.LEFT, pair.getDiffs().get(0).side());
        assertEquals(DiffSide.RIGHT, pair.getDiffs().get(1).side());

        List<Diff> rootDiffs = root.getDiffs();
        assertEquals(2, rootDiffs.size());
        assertEquals(DiffSide.LEFT, rootDiffs.get(0).side());
        assertEquals("o2", nameOf(rootDiffs.get(0).node()));
        assertEquals(DiffSide.RIGHT, rootDiffs.get(1).side());
        assertEquals("o3", nameOf(rootDiffs.get(1).node()));
    }

    @Test
    void testRenamedOptionalWithSameContentIsAnExactMatch() throws CilParseException {
        ComparableNode left = policy("(optional first (type a_t) (type b_t))");
        ComparableNode right = policy("(optional second (type a_t) (type b_t))");

        DiffTree tree = DiffTree.compare(left, right);

        assertEquals(left.getFullHash(), right.getFullHash());
        assertTrue(tree.getRoot().getChildren().isEmpty());
        assertTrue(tree.getRoot().getDiffs().isEmpty());
    }

    @Test
    void testRenamedOptionalWithChangedContentIsPaired() throws CilParseException {
        ComparableNode left = policy("(optional first (type a_t) (type b_t))");
        ComparableNode right = policy("(optional second (type a_t) (type c_t))");

        DiffTree tree = DiffTree.compare(left, right);

        assertEquals(1, tree.getRoot().getChildren().size());
        assertTrue(tree.getRoot().getDiffs().isEmpty());
        assertEquals(2, tree.getRoot().getChildren().get(0).getDiffs().size());
    }

    @Test
    void testGreedyPairingPicksBestMatches() throws CilParseException {
        ComparableNode left = policy("(optional a (type x_t) (type y_t))\n"
                + "(optional b (type p_t) (type q_t))");
        ComparableNode right = policy("(optional a2 (type x_t) (type y_t) (type z_t))\n"
                + "(optional c (type p_t))");

        DiffTree tree = DiffTree.compare(left, right);

        assertEquals(2, tree.getRoot().getChildren().size());
        assertTrue(tree.getRoot().getDiffs().isEmpty());
        for (DiffTreeNode pair : tree.getRoot().getChildren()) {
            String leftName = nameOf(pair.getLeft());
            String rightName = nameOf(pair.getRight());
            assertTrue(leftName.equals("a") && rightName.equals("a2") || leftName.equals("b") && rightName.equals("c"),
                    "Unexpected pairing " + leftName + " / " + rightName);
        }
    }

    @Test
    void testIdenticalMembersAreSkipped() throws CilParseException {
        ComparableNode left = policy("(optional same (type a_t))\n(optional gone (type b_t))");
        ComparableNode right = policy("(optional same (type a_t))");

        DiffTree tree = DiffTree.compare(left, right);

        assertTrue(tree.getRoot().getChildren().isEmpty());
        assertEquals(1, tree.getAllDiffs().size());
        assertEquals(DiffSide.LEFT, tree.getAllDiffs().get(0).side());
        assertEquals("gone", nameOf(tree.getAllDiffs().get(0).node()));
    }

    @Test
    void testUnrelatedMembersAreNeverPaired() throws CilParseException {
        ComparableNode left = policy("(optional o (type a_t))");
        ComparableNode right = policy("(optional o (type b_t))");

        DiffTree tree = DiffTree.compare(left, right);

        assertTrue(tree.getRoot().getChildren().isEmpty());
        assertEquals(2, tree.getRoot().getDiffs().size());
    }

    @Test
    void testRankOrdersByRatioThenDigest() throws CilParseException {
        List<ComparableNode> left = members(policy("(optional a (type x_t) (type y_t))\n"
                + "(optional b (type q_t))\n(optional c (type r_t))"));
        List<ComparableNode> right = members(policy("(optional d (type x_t) (type y_t) (type z_t))"));

        List<CandidatePair> ranked = matcher.rank(left, right);

        assertEquals(3, ranked.size());
        assertEquals("a", nameOf(ranked.get(0).left()));
        assertEquals(new Similarity(2, 0, 1), ranked.get(0).similarity());
        assertEquals(0, ranked.get(1).similarity().common());
        assertTrue(ranked.get(1).left().getFullHash().compareTo(ranked.get(2).left().getFullHash()) < 0);
    }

    @Test
    void testSimilarityDelegatesToFlatCounts() throws CilParseException {
        ComparableNode left = policy("(optional a (type x_t))\n(optional b (type y_t))");
        ComparableNode right = policy("(optional a (type x_t))");
        NodeSubset leftSubset = left.getChildren().getSubsets().firstEntry().getValue();
        NodeSubset rightSubset = right.getChildren().getSubsets().firstEntry().getValue();

        assertEquals(new Similarity(1, 1, 0), matcher.similarity(leftSubset, rightSubset));
    }
}
