package com.raditha.cildiff.extraction;

import com.raditha.cildiff.hash.Digest;
import com.raditha.cildiff.model.CilNode;
import com.raditha.cildiff.model.PolicyModelException;
import com.raditha.cildiff.parser.CilAstBuilder;
import com.raditha.cildiff.parser.CilParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SemanticFieldExtractorTest {

    private CilAstBuilder builder;
    private SemanticFieldExtractor extractor;

    @BeforeEach
    void setUp() {
        builder = new CilAstBuilder();
        extractor = new SemanticFieldExtractor();
    }

    private CilNode statement(String text) throws CilParseException {
        return builder.build(text).getChildren().get(0);
    }

    private Digest full(String text) throws CilParseException {
        return extractor.extract(statement(text)).full().finish();
    }

    private Digest partial(String text) throws CilParseException {
        FieldHashes hashes = extractor.extract(statement(text));
        return hashes.isSplit() ? hashes.partial().finish() : hashes.full().finish();
    }

    @Test
    void testWhitespaceAndLayoutDoNotMatter() throws CilParseException {
        assertEquals(full("(allow a_t b_t (file (read)))"),
                full("(allow   a_t\n    b_t\n    (file (read)))"));
    }

    @Test
    void testRuleSplitsOnSourceAndTarget() throws CilParseException {
        assertTrue(extractor.extract(statement("(allow a_t b_t (file (read)))")).isSplit());
        assertEquals(partial("(allow a_t b_t (file (read)))"), partial("(allow a_t b_t (file (read write)))"));
        assertNotEquals(full("(allow a_t b_t (file (read)))"), full("(allow a_t b_t (file (read write)))"));
        assertNotEquals(partial("(allow a_t b_t (file (read)))"), partial("(allow a_t c_t (file (read)))"));
    }

    @Test
    void testFlavorIsPartOfTheDigest() throws CilParseException {
        assertNotEquals(full("(allow a_t b_t (file (read)))"), full("(auditallow a_t b_t (file (read)))"));
        assertNotEquals(full("(type a_t)"), full("(role a_t)"));
    }

    @Test
    void testDeclarationHasNoSplit() throws CilParseException {
        assertFalse(extractor.extract(statement("(type a_t)")).isSplit());
        assertNotEquals(full("(type a_t)"), full("(type b_t)"));
    }

    @Test
    void testPermissionOrderIsIrrelevant() throws CilParseException {
        assertEquals(full("(allow a_t b_t (file (read write open)))"),
                full("(allow a_t b_t (file (open read write)))"));
    }

    @Test
    void testCommutativeOperandsAreSorted() throws CilParseException {
        assertEquals(full("(constrain (file (write)) (eq u1 u2))"),
                full("(constrain (file (write)) (eq u2 u1))"));
        assertEquals(full("(booleanif (and b1 b2) (true (allow a_t b_t (file (read)))))"),
                full("(booleanif (and b2 b1) (true (allow a_t b_t (file (read)))))"));
    }

    @Test
    void testNonCommutativeOperandsArePositional() throws CilParseException {
        assertNotEquals(full("(mlsconstrain (file (read)) (dom l1 l2))"),
                full("(mlsconstrain (file (read)) (dom l2 l1))"));
        assertNotEquals(full("(mlsconstrain (file (read)) (dom l1 l2))"),
                full("(mlsconstrain (file (read)) (domby l1 l2))"));
    }

    @Test
    void testOrderStatementsArePositional() throws CilParseException {
        assertNotEquals(full("(sidorder (kernel security))"), full("(sidorder (security kernel))"));
        assertEquals(partial("(sidorder (kernel security))"), partial("(sidorder (security kernel))"));
    }

    @Test
    void testUnorderedClassOrder() throws CilParseException {
        assertEquals(full("(classorder (unordered dir file))"), full("(classorder (unordered file dir))"));
        assertNotEquals(full("(classorder (unordered dir file))"), full("(classorder (dir file))"));
    }

    @Test
    void testUnorderedMarkerRejectedOutsideClassOrder() throws CilParseException {
        CilNode node = statement("(sidorder (unordered kernel security))");

        PolicyModelException e = assertThrows(PolicyModelException.class, () -> extractor.extract(node));
        assertTrue(e.getMessage().contains("unordered"));
    }

    @Test
    void testNamedAndInlineReferencesDiffer() throws CilParseException {
        assertNotEquals(full("(allow a_t b_t rw_perms)"), full("(allow a_t b_t (file (read)))"));
        assertNotEquals(full("(portcon tcp 22 ssh_ctx)"),
                full("(portcon tcp 22 (system_u object_r ssh_t ((s0) (s0))))"));
    }

    @Test
    void testFileConSplitsOnPathAndType() throws CilParseException {
        assertEquals(partial("(filecon \"/etc\" dir etc_ctx)"), partial("(filecon \"/etc\" dir ())"));
        assertNotEquals(full("(filecon \"/etc\" dir etc_ctx)"), full("(filecon \"/etc\" dir ())"));
        assertNotEquals(partial("(filecon \"/etc\" dir etc_ctx)"), partial("(filecon \"/etc\" file etc_ctx)"));
    }

    @Test
    void testOmittedGenFsConTypeMeansAny() throws CilParseException {
        assertEquals(full("(genfscon proc \"/\" kernel_ctx)"), full("(genfscon proc \"/\" any kernel_ctx)"));
        assertNotEquals(full("(genfscon proc \"/\" kernel_ctx)"), full("(genfscon proc \"/\" dir kernel_ctx)"));
    }

    @Test
    void testIbPkeyConUsesBothBounds() throws CilParseException {
        assertNotEquals(full("(ibpkeycon fe80:: (1 2) ctx)"), full("(ibpkeycon fe80:: (1 3) ctx)"));
        assertNotEquals(partial("(ibpkeycon fe80:: (1 2) ctx)"), partial("(ibpkeycon fe80:: (1 3) ctx)"));
        assertEquals(partial("(ibpkeycon fe80:: (1 2) ctx)"), partial("(ibpkeycon fe80:: (1 2) other_ctx)"));
        assertNotEquals(full("(ibpkeycon fe80:: (1 2) ctx)"), full("(ibpkeycon fe80:: (1 2) other_ctx)"));
    }

    @Test
    void testCallArgumentsArePositional() throws CilParseException {
        assertNotEquals(full("(call m (a b))"), full("(call m (b a))"));
        assertEquals(full("(call m (a (b c)))"), full("(call m (a (b c)))"));
    }

    @Test
    void testDefaultObjectClassesAreUnordered() throws CilParseException {
        assertEquals(full("(defaultuser (file dir) source)"), full("(defaultuser (dir file) source)"));
        assertEquals(partial("(defaultuser (file) source)"), partial("(defaultuser (dir) source)"));
        assertNotEquals(partial("(defaultuser (file) source)"), partial("(defaultuser (file) target)"));
    }

    @Test
    void testOptionalIdentityIgnoresName() throws CilParseException {
        assertEquals(partial("(optional first)"), partial("(optional second)"));
        assertEquals(full("(optional first)"), full("(optional second)"));
    }

    @Test
    void testBooleanValueIsTheValueField() throws CilParseException {
        assertEquals(partial("(boolean secure true)"), partial("(boolean secure false)"));
        assertNotEquals(full("(boolean secure true)"), full("(boolean secure false)"));
    }

    @Test
    void testListHashOrdering() {
        assertEquals(extractor.listHash(List.of("a", "b"), false), extractor.listHash(List.of("b", "a"), false));
        assertNotEquals(extractor.listHash(List.of("a", "b"), true), extractor.listHash(List.of("b", "a"), true));
        assertNotEquals(extractor.listHash(List.of("a", "b"), true), extractor.listHash(List.of("a", "b"), false));
    }

    @Test
    void testExtractionIsDeterministic() throws CilParseException {
        CilNode node = statement("(typetransition a_t b_t process c_t)");
        assertEquals(extractor.extract(node).full().finish(), extractor.extract(node).full().finish());
    }
}
