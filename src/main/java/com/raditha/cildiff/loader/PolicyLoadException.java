package com.raditha.cildiff.loader;

import com.raditha.cildiff.diff.DiffSide;

import java.io.IOException;

/**
 * A policy file could not be read.
 */
public class PolicyLoadException extends IOException {

    private final DiffSide side;
    private final String path;

    public PolicyLoadException(DiffSide side, String path, String message, Throwable cause) {
        super(side.getLabel() + " policy " + path + ": " + message, cause);
        this.side = side;
        this.path = path;
    }

    public DiffSide getSide() {
        return side;
    }

    public String getPath() {
        return path;
    }
}
