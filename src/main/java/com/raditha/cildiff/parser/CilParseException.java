package com.raditha.cildiff.parser;

import com.raditha.cildiff.diff.DiffSide;

/**
 * Raised when policy text cannot be read as CIL.
 */
public class CilParseException extends Exception {

    private final int line;
    private final DiffSide side;

    public CilParseException(String message, int line) {
        super(message);
        this.line = line;
        this.side = null;
    }

    /**
     * Attribute a parse failure to one side of the comparison.
     */
    public CilParseException(DiffSide side, String source, CilParseException cause) {
        super(side.getLabel() + " policy " + source + " line " + cause.line + ": " + cause.getMessage(), cause);
        this.line = cause.line;
        this.side = side;
    }

    public int getLine() {
        return line;
    }

    /**
     * @return the side that failed, or null if the failure has not been attributed yet
     */
    public DiffSide getSide() {
        return side;
    }
}
