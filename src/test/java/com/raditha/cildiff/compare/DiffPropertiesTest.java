package com.raditha.cildiff.compare;

import com.raditha.cildiff.diff.Diff;
import com.raditha.cildiff.diff.DiffSide;
import com.raditha.cildiff.diff.DiffTree;
import com.raditha.cildiff.extraction.SemanticFieldExtractor;
import com.raditha.cildiff.parser.CilAstBuilder;
import com.raditha.cildiff.parser.CilParseException;
import net.jqwik.api.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Properties of the comparison that must hold for any policy.
 */
class DiffPropertiesTest {

    private final CilAstBuilder builder = new CilAstBuilder();
    private final SemanticFieldExtractor extractor = new SemanticFieldExtractor();

    private ComparableNode policy(List<String> statements) throws CilParseException {
        return ComparableNode.create(builder.build(String.join("\n", statements)), extractor);
    }

    @Property(tries = 50)
    void hashingIsDeterministic(@ForAll("policies") List<String> statements) throws CilParseException {
        assertEquals(policy(statements).getFullHash(), policy(statements).getFullHash());
    }

    @Property(tries = 50)
    void comparingWithItselfFindsNothing(@ForAll("policies") List<String> statements) throws CilParseException {
        DiffTree tree = DiffTree.compare(policy(statements), policy(statements));

        assertTrue(tree.isEmpty());
        assertEquals(1, tree.getStats().getPrunedSets());
    }

    @Property(tries = 50)
    void statementOrderDoesNotMatter(@ForAll("policies") List<String> statements, @ForAll long seed)
            throws CilParseException {
        List<String> shuffled = new ArrayList<>(statements);
        Collections.shuffle(shuffled, new Random(seed));

        assertEquals(policy(statements).getFullHash(), policy(shuffled).getFullHash());
    }

    @Property(tries = 50)
    void duplicatesDoNotMatter(@ForAll("policies") List<String> statements) throws CilParseException {
        List<String> doubled = new ArrayList<>(statements);
        doubled.addAll(statements);

        assertEquals(policy(statements).getFullHash(), policy(doubled).getFullHash());
    }

    @Property(tries = 50)
    void swappingSidesSwapsChanges(@ForAll("flatPolicies") List<String> left, @ForAll("flatPolicies") List<String> right)
            throws CilParseException {
        List<Diff> forward = DiffTree.compare(policy(left), policy(right)).getAllDiffs();
        List<Diff> backward = DiffTree.compare(policy(right), policy(left)).getAllDiffs();

        assertEquals(count(forward, DiffSide.LEFT), count(backward, DiffSide.RIGHT));
        assertEquals(count(forward, DiffSide.RIGHT), count(backward, DiffSide.LEFT));
    }

    private static long count(List<Diff> diffs, DiffSide side) {
        return diffs.stream().filter(diff -> diff.side() == side).count();
    }

    @Provide
    Arbitrary<List<String>> flatPolicies() {
        return Arbitraries.oneOf(declarations(), rules()).list().ofMaxSize(8);
    }

    @Provide
    Arbitrary<List<String>> policies() {
        Arbitrary<String> declaration = declarations();
        Arbitrary<String> rule = rules();
        Arbitrary<String> block = Combinators.combine(Arbitraries.of("b1", "b2"), declaration.list().ofMaxSize(3))
                .as((name, body) -> "(block " + name + " " + String.join(" ", body) + ")");
        Arbitrary<String> optional = rule.list().ofMinSize(1).ofMaxSize(2)
                .map(body -> "(optional opt " + String.join(" ", body) + ")");
        return Arbitraries.oneOf(declaration, rule, block, optional).list().ofMaxSize(8);
    }

    private static Arbitrary<String> declarations() {
        return types().map(t -> "(type " + t + ")");
    }

    private static Arbitrary<String> rules() {
        Arbitrary<List<String>> perms = Arbitraries.of("read", "write", "open", "getattr")
                .list().uniqueElements().ofMinSize(1).ofMaxSize(3);
        return Combinators.combine(types(), types(), perms)
                .as((source, target, names) -> "(allow " + source + " " + target + " (file ("
                        + String.join(" ", names) + ")))");
    }

    private static Arbitrary<String> types() {
        return Arbitraries.of("a_t", "b_t", "c_t", "d_t");
    }
}
