package com.raditha.cildiff.compare;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityTest {

    @Test
    void testRatio() {
        assertEquals(0.5, new Similarity(2, 1, 1).ratio(), 1e-9);
        assertEquals(1.0, Similarity.IDENTICAL.ratio(), 1e-9);
    }

    @Test
    void testEmptyRatioIsZero() {
        assertEquals(0.0, Similarity.NONE.ratio());
        assertEquals(0, Similarity.NONE.total());
    }

    @Test
    void testPlus() {
        assertEquals(new Similarity(3, 1, 2), new Similarity(1, 1, 0).plus(new Similarity(2, 0, 2)));
    }

    @Test
    void testNegativeCountsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Similarity(-1, 0, 0));
    }

    @Test
    void testFormatRatio() {
        assertEquals("50.0%", new Similarity(1, 1, 0).formatRatio().replace(',', '.'));
    }
}
