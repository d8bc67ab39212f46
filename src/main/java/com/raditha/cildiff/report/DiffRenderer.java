package com.raditha.cildiff.report;

import com.raditha.cildiff.diff.DiffTree;

import java.io.IOException;
import java.io.Writer;

/**
 * Renders a computed diff tree for output.
 */
public interface DiffRenderer {

    void render(DiffTree tree, Writer out) throws IOException;
}
