package com.raditha.cildiff.parser;

import java.util.List;

/**
 * A parsed S-expression: either an atom or a parenthesized list.
 */
public final class SExpression {

    private final String atom;
    private final boolean quoted;
    private final List<SExpression> items;
    private final int line;

    private SExpression(String atom, boolean quoted, List<SExpression> items, int line) {
        this.atom = atom;
        this.quoted = quoted;
        this.items = items;
        this.line = line;
    }

    public static SExpression atom(String value, boolean quoted, int line) {
        return new SExpression(value, quoted, List.of(), line);
    }

    public static SExpression list(List<SExpression> items, int line) {
        return new SExpression(null, false, List.copyOf(items), line);
    }

    public boolean isAtom() {
        return atom != null;
    }

    public boolean isList() {
        return atom == null;
    }

    public String getAtom() {
        return atom;
    }

    /**
     * Whether the atom was written as a double-quoted string.
     */
    public boolean isQuoted() {
        return quoted;
    }

    public List<SExpression> getItems() {
        return items;
    }

    public SExpression get(int index) {
        return items.get(index);
    }

    public int size() {
        return items.size();
    }

    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        if (isAtom()) {
            return quoted ? "\"" + atom + "\"" : atom;
        }
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(items.get(i));
        }
        return sb.append(')').toString();
    }
}
