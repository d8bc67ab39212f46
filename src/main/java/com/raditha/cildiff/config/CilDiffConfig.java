package com.raditha.cildiff.config;

import java.util.Objects;

/**
 * Output settings for a comparison run.
 *
 * @param format          output format
 * @param pretty          indent JSON output
 * @param rootHashes      print the root hashes of both policies in CIL output
 * @param describeChanges describe same-identity changes of flat statements
 */
public record CilDiffConfig(
        OutputFormat format,
        boolean pretty,
        boolean rootHashes,
        boolean describeChanges) {

    public CilDiffConfig {
        Objects.requireNonNull(format, "format cannot be null");
    }

    public static CilDiffConfig defaults() {
        return new CilDiffConfig(OutputFormat.CIL, false, true, true);
    }
}
