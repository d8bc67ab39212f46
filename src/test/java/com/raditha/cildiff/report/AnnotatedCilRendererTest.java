package com.raditha.cildiff.report;

import com.raditha.cildiff.compare.ComparableNode;
import com.raditha.cildiff.diff.DiffTree;
import com.raditha.cildiff.extraction.SemanticFieldExtractor;
import com.raditha.cildiff.parser.CilAstBuilder;
import com.raditha.cildiff.parser.CilParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

class AnnotatedCilRendererTest {

    private CilAstBuilder builder;
    private SemanticFieldExtractor extractor;

    @BeforeEach
    void setUp() {
        builder = new CilAstBuilder();
        extractor = new SemanticFieldExtractor();
    }

    private DiffTree diff(String left, String right) throws CilParseException {
        return DiffTree.compare(ComparableNode.create(builder.build(left), extractor),
                ComparableNode.create(builder.build(right), extractor));
    }

    private static String render(DiffRenderer renderer, DiffTree tree) throws IOException {
        StringWriter out = new StringWriter();
        renderer.render(tree, out);
        return out.toString();
    }

    @Test
    void testAdditionInsideBlock() throws CilParseException, IOException {
        DiffTree tree = diff("(block web\n    (type web_t)\n    (type web_log_t))", "(block web (type web_t))");
        String hash = tree.getAllDiffs().get(0).node().getFullHash().toHex();

        String expected = "; Addition found (left): " + hash + "\n"
                + "; Left context:\n"
                + "; \troot node on line 0\n"
                + "; \tblock node on line 1\n"
                + "; Right context:\n"
                + "; \troot node on line 0\n"
                + "; \tblock node on line 1\n"
                + "; +++\n"
                + "(type web_log_t)\n"
                + "; ===\n";

        assertEquals(expected, render(new AnnotatedCilRenderer(false, null), tree));
    }

    @Test
    void testRootHashesComeFirst() throws CilParseException, IOException {
        DiffTree tree = diff("(type a_t)", "(type b_t)");

        String output = render(new AnnotatedCilRenderer(true, null), tree);

        String[] lines = output.split("\n");
        assertEquals("; Left hash: " + tree.getRoot().getLeft().getFullHash().toHex(), lines[0]);
        assertEquals("; Right hash: " + tree.getRoot().getRight().getFullHash().toHex(), lines[1]);
        assertTrue(output.contains("; Deletion found (right): "));
        assertTrue(output.contains("; ---\n(type b_t)\n; ===\n"));
    }

    @Test
    void testIdenticalPoliciesPrintOnlyHashes() throws CilParseException, IOException {
        DiffTree tree = diff("(type a_t)", "(type a_t)");

        String output = render(new AnnotatedCilRenderer(true, null), tree);

        assertEquals(2, output.split("\n").length);
        assertEquals("", render(new AnnotatedCilRenderer(false, null), tree));
    }

    @Test
    void testDescriptionLine() throws CilParseException, IOException {
        DiffTree tree = diff("(allow a_t b_t (file (read)))", "(allow a_t b_t (file (read write)))");

        String output = render(new AnnotatedCilRenderer(false, new ValueChangeDescriber()), tree);

        assertEquals(2, output.split("; Description: value changed: -write\n", -1).length - 1);
    }

    @Test
    void testRenderedChangesParseBack() throws CilParseException, IOException {
        DiffTree tree = diff("(allow a_t b_t (file (read)))\n(block b (type c_t))", "");

        String output = render(new AnnotatedCilRenderer(true, null), tree);

        assertEquals(2, builder.build(output).getChildren().size());
    }
}
