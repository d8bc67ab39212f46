package com.raditha.cildiff.extraction;

import com.raditha.cildiff.hash.HashState;

/**
 * The running digests produced for one statement.
 *
 * @param full    identity and value fields; still open so container children can be absorbed
 * @param partial identity fields only, or null when the statement has no identity/value split
 */
public record FieldHashes(HashState full, HashState partial) {

    public boolean isSplit() {
        return partial != null;
    }
}
