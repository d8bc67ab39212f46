package com.raditha.cildiff.analyzer;

import com.raditha.cildiff.compare.ComparableNode;
import com.raditha.cildiff.diff.DiffSide;
import com.raditha.cildiff.diff.DiffTree;
import com.raditha.cildiff.extraction.SemanticFieldExtractor;
import com.raditha.cildiff.loader.PolicyFileLoader;
import com.raditha.cildiff.loader.PolicyLoadException;
import com.raditha.cildiff.model.CilNode;
import com.raditha.cildiff.parser.CilAstBuilder;
import com.raditha.cildiff.parser.CilParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main orchestrator for a policy comparison.
 * Coordinates loading, parsing, hashing and the recursive comparison.
 */
public class PolicyDiffAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(PolicyDiffAnalyzer.class);

    private final PolicyFileLoader loader;
    private final CilAstBuilder builder;
    private final SemanticFieldExtractor extractor;

    public PolicyDiffAnalyzer() {
        this(new PolicyFileLoader(), new CilAstBuilder(), new SemanticFieldExtractor());
    }

    public PolicyDiffAnalyzer(PolicyFileLoader loader, CilAstBuilder builder, SemanticFieldExtractor extractor) {
        this.loader = loader;
        this.builder = builder;
        this.extractor = extractor;
    }

    /**
     * Load, parse and compare two policy files.
     *
     * @param leftPath  left policy file, or {@code -} for standard input
     * @param rightPath right policy file, or {@code -} for standard input
     * @return the comparison result
     * @throws PolicyLoadException if either file cannot be read
     * @throws CilParseException   if either file is not valid CIL
     */
    public PolicyDiffReport analyze(String leftPath, String rightPath) throws PolicyLoadException, CilParseException {
        String leftText = loader.load(leftPath, DiffSide.LEFT);
        String rightText = loader.load(rightPath, DiffSide.RIGHT);
        return compare(PolicyFileLoader.displayName(leftPath), leftText,
                PolicyFileLoader.displayName(rightPath), rightText);
    }

    /**
     * Parse and compare two policies given as text.
     */
    public PolicyDiffReport compare(String leftSource, String leftText, String rightSource, String rightText)
            throws CilParseException {
        CilNode leftTree = parse(leftText, leftSource, DiffSide.LEFT);
        CilNode rightTree = parse(rightText, rightSource, DiffSide.RIGHT);

        ComparableNode left = ComparableNode.create(leftTree, extractor);
        ComparableNode right = ComparableNode.create(rightTree, extractor);
        logger.debug("Left hash: {}", left.getFullHash().toHex());
        logger.debug("Right hash: {}", right.getFullHash().toHex());

        DiffTree tree = DiffTree.compare(left, right);
        PolicyDiffReport report = new PolicyDiffReport(leftSource, rightSource, tree,
                leftTree.size() - 1, rightTree.size() - 1);
        logger.info(report.getSummary());
        logger.debug("Comparison statistics: {}", tree.getStats());
        return report;
    }

    private CilNode parse(String text, String source, DiffSide side) throws CilParseException {
        try {
            return builder.build(text);
        } catch (CilParseException e) {
            throw new CilParseException(side, source, e);
        }
    }
}
