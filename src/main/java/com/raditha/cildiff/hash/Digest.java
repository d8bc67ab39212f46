package com.raditha.cildiff.hash;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * A fixed-size content fingerprint.
 * <p>
 * Digests are value objects: equal bytes mean equal digests. The natural order is
 * unsigned byte-lexicographic and is only used for sorting, never for semantics.
 */
public final class Digest implements Comparable<Digest> {

    public static final int SIZE = 32;

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final byte[] bytes;

    Digest(byte[] bytes) {
        if (bytes.length != SIZE) {
            throw new IllegalArgumentException("Digest must be " + SIZE + " bytes, got " + bytes.length);
        }
        this.bytes = bytes;
    }

    /**
     * Digest of raw bytes with no flavor tag.
     */
    public static Digest of(byte[] data) {
        HashState state = HashState.begin(null);
        state.update(data);
        return state.finish();
    }

    /**
     * Digest of a string including its terminator, as {@link HashState#updateString} absorbs it.
     */
    public static Digest ofString(String value) {
        HashState state = HashState.begin(null);
        state.updateString(value);
        return state.finish();
    }

    /**
     * Digest of the concatenation of the given digests after sorting them ascending.
     * This is the order-independent aggregate used for sets and subsets.
     */
    public static Digest ofSorted(Collection<Digest> digests) {
        List<Digest> sorted = new ArrayList<>(digests);
        sorted.sort(null);
        HashState state = HashState.begin(null);
        for (Digest digest : sorted) {
            state.update(digest);
        }
        return state.finish();
    }

    static Digest fromHex(String hex) {
        if (hex.length() != SIZE * 2) {
            throw new IllegalArgumentException("Expected " + SIZE * 2 + " hex digits, got " + hex.length());
        }
        byte[] data = new byte[SIZE];
        for (int i = 0; i < SIZE; i++) {
            data[i] = (byte) Integer.parseInt(hex.substring(i * 2, i * 2 + 2), 16);
        }
        return new Digest(data);
    }

    /**
     * Total order over possibly absent digests: absent sorts before present.
     */
    public static int compare(Digest a, Digest b) {
        if (a == null && b == null) {
            return 0;
        }
        if (a == null) {
            return -1;
        }
        if (b == null) {
            return 1;
        }
        return a.compareTo(b);
    }

    public byte[] toByteArray() {
        return bytes.clone();
    }

    byte[] rawBytes() {
        return bytes;
    }

    public String toHex() {
        StringBuilder sb = new StringBuilder(SIZE * 2);
        for (byte b : bytes) {
            sb.append(HEX[(b >> 4) & 0xf]).append(HEX[b & 0xf]);
        }
        return sb.toString();
    }

    @Override
    public int compareTo(Digest other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(bytes, ((Digest) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
