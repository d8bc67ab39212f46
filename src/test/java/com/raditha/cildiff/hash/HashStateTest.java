package com.raditha.cildiff.hash;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HashStateTest {

    @Test
    void testFlavorTagSeparatesDigests() {
        Digest type = HashState.begin("type").updateString("foo_t").finish();
        Digest role = HashState.begin("role").updateString("foo_t").finish();

        assertNotEquals(type, role);
    }

    @Test
    void testTerminatorPreventsConcatenationCollision() {
        Digest first = HashState.begin(null).updateString("ab").updateString("c").finish();
        Digest second = HashState.begin(null).updateString("a").updateString("bc").finish();

        assertNotEquals(first, second);
    }

    @Test
    void testCopyForksIndependentStates() {
        HashState full = HashState.begin("allow").updateString("source_t").updateString("target_t");
        HashState partial = full.copy();
        full.updateString("read");

        Digest partialDigest = partial.finish();
        Digest fullDigest = full.finish();

        assertNotEquals(partialDigest, fullDigest);
        assertEquals(HashState.begin("allow").updateString("source_t").updateString("target_t").finish(), partialDigest);
    }

    @Test
    void testFinishedStateCannotBeReused() {
        HashState state = HashState.begin("type");
        state.finish();

        assertTrue(state.isFinished());
        assertThrows(IllegalStateException.class, () -> state.updateString("x"));
        assertThrows(IllegalStateException.class, state::finish);
        assertThrows(IllegalStateException.class, state::copy);
    }

    @Test
    void testNumbersAndBooleansAreFixedWidth() {
        Digest one = HashState.begin(null).updateLong(1).finish();
        Digest oneAgain = HashState.begin(null).updateLong(1L).finish();
        Digest trueValue = HashState.begin(null).updateBoolean(true).finish();
        Digest falseValue = HashState.begin(null).updateBoolean(false).finish();

        assertEquals(one, oneAgain);
        assertNotEquals(trueValue, falseValue);
        assertNotEquals(HashState.begin(null).updateLong(256).finish(), one);
    }

    @Test
    void testDigestUpdateMatchesRawBytes() {
        Digest inner = Digest.ofString("x");
        Digest viaDigest = HashState.begin(null).update(inner).finish();
        Digest viaBytes = HashState.begin(null).update(inner.toByteArray()).finish();

        assertEquals(viaDigest, viaBytes);
    }
}
