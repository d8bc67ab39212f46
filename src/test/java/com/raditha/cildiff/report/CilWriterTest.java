package com.raditha.cildiff.report;

import com.raditha.cildiff.compare.ComparableNode;
import com.raditha.cildiff.extraction.SemanticFieldExtractor;
import com.raditha.cildiff.model.CilNode;
import com.raditha.cildiff.parser.CilAstBuilder;
import com.raditha.cildiff.parser.CilParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class CilWriterTest {

    private CilAstBuilder builder;
    private CilWriter writer;
    private SemanticFieldExtractor extractor;

    @BeforeEach
    void setUp() {
        builder = new CilAstBuilder();
        writer = new CilWriter();
        extractor = new SemanticFieldExtractor();
    }

    private String roundTrip(String text) throws CilParseException {
        return writer.write(builder.build(text));
    }

    private static String resource(String name) throws IOException {
        try (InputStream in = CilWriterTest.class.getResourceAsStream(name)) {
            assertNotNull(in, name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void testLeafStatement() throws CilParseException {
        assertEquals("(allow a_t b_t (file (read write)))\n", roundTrip("(allow  a_t b_t\n (file (read write)))"));
        assertEquals("(type a_t)\n", roundTrip("(type a_t) ; comment"));
    }

    @Test
    void testContainerIsIndented() throws CilParseException {
        String expected = "(block web\n"
                + "    (type web_t)\n"
                + "    (optional opt\n"
                + "        (type inner_t)\n"
                + "    )\n"
                + ")\n";

        assertEquals(expected, roundTrip("(block web (type web_t) (optional opt (type inner_t)))"));
    }

    @Test
    void testEmptyContainerStaysOnOneLine() throws CilParseException {
        assertEquals("(block empty)\n", roundTrip("(block empty)"));
    }

    @Test
    void testClassPermissionsInline() throws CilParseException {
        assertEquals("(class file (read write open))\n", roundTrip("(class file (read\n write open))"));
    }

    @Test
    void testPathsAreQuoted() throws CilParseException {
        assertEquals("(filecon \"/etc/passwd\" file etc_ctx)\n", roundTrip("(filecon \"/etc/passwd\" file etc_ctx)"));
    }

    @Test
    void testHeaderOmitsParentheses() throws CilParseException {
        CilNode node = builder.build("(typeattributeset domain (and a_t b_t))").getChildren().get(0);

        assertEquals("typeattributeset domain (and a_t b_t)", writer.header(node));
    }

    @Test
    void testAtomQuoting() {
        assertEquals("plain_t", CilWriter.atom("plain_t"));
        assertEquals("\"with space\"", CilWriter.atom("with space"));
        assertEquals("\"\"", CilWriter.atom(""));
        assertEquals("\"a(b)\"", CilWriter.atom("a(b)"));
    }

    @Test
    void testOutputHashesLikeInput() throws IOException, CilParseException {
        CilNode original = builder.build(resource("/policies/all.cil"));
        String written = writer.write(original);
        CilNode reparsed = builder.build(written);

        assertEquals(original.getChildren().size(), reparsed.getChildren().size());
        assertEquals(ComparableNode.create(original, extractor).getFullHash(),
                ComparableNode.create(reparsed, extractor).getFullHash());
    }

    @Test
    void testOutputIsStable() throws IOException, CilParseException {
        String once = writer.write(builder.build(resource("/policies/all.cil")));
        String twice = writer.write(builder.build(once));

        assertEquals(once, twice);
    }
}
