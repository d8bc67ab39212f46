package com.raditha.cildiff.diff;

import com.raditha.cildiff.compare.ComparableNode;

import java.util.Objects;

/**
 * One reported change: a statement present on only one side.
 *
 * @param side        the side the statement is present on
 * @param node        the statement
 * @param description optional free text, or null
 */
public record Diff(DiffSide side, ComparableNode node, String description) {

    public Diff {
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(node, "node");
    }
}
