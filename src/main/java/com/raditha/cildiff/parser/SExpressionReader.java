package com.raditha.cildiff.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Tokenizes CIL source text into nested S-expressions.
 * <p>
 * Supports {@code ;} line comments and double-quoted atoms. Every list remembers the line
 * of its opening parenthesis.
 */
public class SExpressionReader {

    /**
     * Read all top-level expressions.
     *
     * @param text CIL source
     * @return the top-level lists in source order
     * @throws CilParseException on unbalanced parentheses, unterminated strings or top-level atoms
     */
    public List<SExpression> read(String text) throws CilParseException {
        List<SExpression> topLevel = new ArrayList<>();
        Deque<List<SExpression>> open = new ArrayDeque<>();
        Deque<Integer> openLines = new ArrayDeque<>();
        int line = 1;
        int pos = 0;
        int length = text.length();

        while (pos < length) {
            char c = text.charAt(pos);
            if (c == '\n') {
                line++;
                pos++;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == ';') {
                while (pos < length && text.charAt(pos) != '\n') {
                    pos++;
                }
            } else if (c == '(') {
                open.push(new ArrayList<>());
                openLines.push(line);
                pos++;
            } else if (c == ')') {
                if (open.isEmpty()) {
                    throw new CilParseException("Unexpected ')'", line);
                }
                SExpression list = SExpression.list(open.pop(), openLines.pop());
                if (open.isEmpty()) {
                    topLevel.add(list);
                } else {
                    open.peek().add(list);
                }
                pos++;
            } else if (c == '"') {
                int end = text.indexOf('"', pos + 1);
                if (end < 0) {
                    throw new CilParseException("Unterminated string", line);
                }
                String value = text.substring(pos + 1, end);
                addAtom(open, SExpression.atom(value, true, line));
                line += countNewlines(value);
                pos = end + 1;
            } else {
                int start = pos;
                while (pos < length && !isDelimiter(text.charAt(pos))) {
                    pos++;
                }
                addAtom(open, SExpression.atom(text.substring(start, pos), false, line));
            }
        }
        if (!open.isEmpty()) {
            throw new CilParseException("Unbalanced '(' opened here", openLines.peek());
        }
        return topLevel;
    }

    private static void addAtom(Deque<List<SExpression>> open, SExpression atom) throws CilParseException {
        if (open.isEmpty()) {
            throw new CilParseException("Expected '(' before '" + atom.getAtom() + "'", atom.getLine());
        }
        open.peek().add(atom);
    }

    private static boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || c == '(' || c == ')' || c == '"' || c == ';';
    }

    private static int countNewlines(String value) {
        int count = 0;
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }
}
