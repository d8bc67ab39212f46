package com.raditha.cildiff.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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

class JsonDiffRendererTest {

    private final ObjectMapper mapper = new ObjectMapper();
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

    private JsonNode render(JsonDiffRenderer renderer, DiffTree tree) throws IOException {
        StringWriter out = new StringWriter();
        renderer.render(tree, out);
        return mapper.readTree(out.toString());
    }

    @Test
    void testTreeStructure() throws CilParseException, IOException {
        DiffTree tree = diff("(block web (type web_t))\n(type a_t)", "(block web (type web_t) (type web_log_t))");

        JsonNode root = render(new JsonDiffRenderer(false, null), tree);

        assertEquals("root", root.get("left").get("flavor").asText());
        assertEquals(tree.getRoot().getLeft().getFullHash().toHex(), root.get("left").get("hash").asText());
        assertEquals(1, root.get("diffs").size());
        JsonNode removed = root.get("diffs").get(0);
        assertEquals("LEFT", removed.get("side").asText());
        assertEquals("type", removed.get("node").get("flavor").asText());
        assertEquals("a_t", removed.get("node").get("name").asText());
        assertEquals(2, removed.get("node").get("line").asInt());

        JsonNode web = root.get("children").get(0);
        assertEquals("block", web.get("right").get("flavor").asText());
        assertEquals("RIGHT", web.get("diffs").get(0).get("side").asText());
        assertEquals(0, web.get("children").size());
    }

    @Test
    void testMissingSideIsOmitted() throws CilParseException, IOException {
        ComparableNode left = ComparableNode.create(builder.build("(type a_t)"), extractor);

        JsonNode root = render(new JsonDiffRenderer(false, null), DiffTree.compare(left, null));

        assertNotNull(root.get("left"));
        assertTrue(root.get("right") == null || root.get("right").isNull());
        assertEquals(1, root.get("diffs").size());
    }

    @Test
    void testInlineStructuresAreNested() throws CilParseException, IOException {
        DiffTree tree = diff("(allow a_t b_t (file (read write)))", "");

        JsonNode node = render(new JsonDiffRenderer(false, null), tree).get("diffs").get(0).get("node");

        assertEquals("allow", node.get("flavor").asText());
        assertEquals("a_t", node.get("source").asText());
        assertEquals("file", node.get("classPerms").get("className").asText());
        assertTrue(node.get("children") == null);
    }

    @Test
    void testContainerChildrenAreWritten() throws CilParseException, IOException {
        DiffTree tree = diff("(optional o (type a_t) (type b_t))", "");

        JsonNode node = render(new JsonDiffRenderer(false, null), tree).get("diffs").get(0).get("node");

        assertEquals("o", node.get("name").asText());
        assertEquals(2, node.get("children").size());
    }

    @Test
    void testDescriptions() throws CilParseException, IOException {
        DiffTree tree = diff("(allow a_t b_t (file (read)))", "(allow a_t b_t (file (read write)))");

        JsonNode root = render(new JsonDiffRenderer(true, new ValueChangeDescriber()), tree);

        assertEquals("value changed: -write", root.get("diffs").get(0).get("description").asText());
        assertTrue(render(new JsonDiffRenderer(false, null), tree).get("diffs").get(0).get("description").isNull());
    }

    @Test
    void testPrettyOutputIsIndented() throws CilParseException, IOException {
        DiffTree tree = diff("(type a_t)", "(type b_t)");
        StringWriter pretty = new StringWriter();
        StringWriter compact = new StringWriter();

        new JsonDiffRenderer(true, null).render(tree, pretty);
        new JsonDiffRenderer(false, null).render(tree, compact);

        assertTrue(pretty.toString().contains("\n  "));
        assertEquals(1, compact.toString().split("\n").length);
        assertEquals(mapper.readTree(pretty.toString()), mapper.readTree(compact.toString()));
    }
}
