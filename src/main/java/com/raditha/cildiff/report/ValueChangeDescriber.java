package com.raditha.cildiff.report;

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Patch;
import com.raditha.cildiff.compare.ComparableNode;
import com.raditha.cildiff.diff.Diff;
import com.raditha.cildiff.diff.DiffSide;
import com.raditha.cildiff.diff.DiffTreeNode;
import com.raditha.cildiff.hash.Digest;
import com.raditha.cildiff.model.MatchingPolicy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Describes flat statements that were reported as one deletion plus one addition although
 * both share the same identity, e.g. an allow rule whose permissions changed.
 * <p>
 * The description only annotates the two diffs. They stay separate changes.
 * Uses java-diff-utils on the statement tokens.
 */
public class ValueChangeDescriber {

    private final CilWriter writer;

    public ValueChangeDescriber() {
        this(new CilWriter());
    }

    public ValueChangeDescriber(CilWriter writer) {
        this.writer = writer;
    }

    /**
     * Descriptions for the diffs directly attached to a node.
     *
     * @param node the diff tree node
     * @return description per diff, by identity; diffs that are not a value change are absent
     */
    public Map<Diff, String> describe(DiffTreeNode node) {
        Map<Digest, List<Diff>> byIdentity = new LinkedHashMap<>();
        for (Diff diff : node.getDiffs()) {
            ComparableNode statement = diff.node();
            if (statement.getFlavor().getMatchingPolicy() == MatchingPolicy.FLAT && !statement.getFlavor().isContainer()) {
                byIdentity.computeIfAbsent(statement.getPartialHash(), k -> new ArrayList<>()).add(diff);
            }
        }

        Map<Diff, String> descriptions = new IdentityHashMap<>();
        for (List<Diff> group : byIdentity.values()) {
            if (group.size() != 2 || group.get(0).side() == group.get(1).side()) {
                continue;
            }
            Diff left = group.get(0).side() == DiffSide.LEFT ? group.get(0) : group.get(1);
            Diff right = left == group.get(0) ? group.get(1) : group.get(0);
            String description = describe(right.node(), left.node());
            if (description != null) {
                descriptions.put(left, description);
                descriptions.put(right, description);
            }
        }
        return descriptions;
    }

    /**
     * Token level change from the right statement to the left one.
     *
     * @return the description, or null when the token streams are identical
     */
    String describe(ComparableNode from, ComparableNode to) {
        List<String> original = tokens(writer.header(from.getNode()));
        List<String> revised = tokens(writer.header(to.getNode()));

        Patch<String> patch = DiffUtils.diff(original, revised);
        if (patch.getDeltas().isEmpty()) {
            return null;
        }

        StringBuilder result = new StringBuilder("value changed:");
        for (AbstractDelta<String> delta : patch.getDeltas()) {
            for (String removed : delta.getSource().getLines()) {
                result.append(" -").append(removed);
            }
            for (String added : delta.getTarget().getLines()) {
                result.append(" +").append(added);
            }
        }
        return result.toString();
    }

    static List<String> tokens(String statement) {
        String spaced = statement.replace("(", " ").replace(")", " ").trim();
        if (spaced.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(spaced.split("\\s+"));
    }
}
