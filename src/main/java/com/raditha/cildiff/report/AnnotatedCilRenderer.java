package com.raditha.cildiff.report;

import com.raditha.cildiff.compare.ComparableNode;
import com.raditha.cildiff.diff.Diff;
import com.raditha.cildiff.diff.DiffSide;
import com.raditha.cildiff.diff.DiffTree;
import com.raditha.cildiff.diff.DiffTreeNode;

import java.io.IOException;
import java.io.Writer;
import java.util.Map;

/**
 * Renders changes as CIL source with comment headers.
 * <p>
 * Every change is a comment block naming the side, the content hash and the enclosing
 * statements on both sides, followed by the statement itself. The output is valid CIL, so
 * feeding all additions back in reproduces the added statements.
 */
public class AnnotatedCilRenderer implements DiffRenderer {

    private final CilWriter writer;
    private final ValueChangeDescriber describer;
    private final boolean rootHashes;

    /**
     * @param rootHashes print the hashes of both policy roots before the changes
     * @param describer  describes same-identity value changes, or null to skip descriptions
     */
    public AnnotatedCilRenderer(boolean rootHashes, ValueChangeDescriber describer) {
        this.writer = new CilWriter();
        this.rootHashes = rootHashes;
        this.describer = describer;
    }

    @Override
    public void render(DiffTree tree, Writer out) throws IOException {
        DiffTreeNode root = tree.getRoot();
        if (rootHashes) {
            printRootHash(out, "Left", root.getLeft());
            printRootHash(out, "Right", root.getRight());
        }
        render(root, out);
        out.flush();
    }

    private void printRootHash(Writer out, String label, ComparableNode node) throws IOException {
        if (node != null) {
            out.write("; " + label + " hash: " + node.getFullHash().toHex() + "\n");
        }
    }

    private void render(DiffTreeNode node, Writer out) throws IOException {
        for (DiffTreeNode child : node.getChildren()) {
            render(child, out);
        }
        Map<Diff, String> descriptions = describer != null ? describer.describe(node) : Map.of();
        for (Diff diff : node.getDiffs()) {
            String description = diff.description() != null ? diff.description() : descriptions.get(diff);
            renderDiff(node, diff, description, out);
        }
    }

    private void renderDiff(DiffTreeNode parent, Diff diff, String description, Writer out) throws IOException {
        DiffSide side = diff.side();
        out.write("; " + side.getChangeName() + " found (" + side.getLabel() + "): "
                + diff.node().getFullHash().toHex() + "\n");
        if (description != null) {
            out.write("; Description: " + description + "\n");
        }
        out.write("; Left context:\n");
        printContext(parent, DiffSide.LEFT, out);
        out.write("; Right context:\n");
        printContext(parent, DiffSide.RIGHT, out);
        out.write("; " + side.getMarker() + "\n");
        out.write(writer.write(diff.node().getNode()));
        out.write("; ===\n");
    }

    private void printContext(DiffTreeNode parent, DiffSide side, Writer out) throws IOException {
        for (ComparableNode ancestor : parent.getContext(side)) {
            out.write("; \t" + ancestor.getFlavor().getDisplayName() + " node on line "
                    + ancestor.getNode().getLine() + "\n");
        }
    }
}
