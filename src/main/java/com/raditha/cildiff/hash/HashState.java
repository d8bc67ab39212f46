package com.raditha.cildiff.hash;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * A running digest.
 * <p>
 * Content is absorbed incrementally and the state can be forked with {@link #copy()} so a
 * shared prefix (the identity fields of a statement) is hashed only once and then
 * finished into both a partial and a full digest.
 * <p>
 * Failures of the underlying primitive are environment errors and surface as
 * {@link IllegalStateException}; nothing in the comparison recovers from them.
 */
public final class HashState {

    static final String ALGORITHM = "SHA-512";

    private MessageDigest messageDigest;

    private HashState(MessageDigest messageDigest) {
        this.messageDigest = messageDigest;
    }

    /**
     * Open a running digest.
     *
     * @param flavor disambiguating tag absorbed first (with its terminator), or null
     * @return the new state
     */
    public static HashState begin(String flavor) {
        MessageDigest md;
        try {
            md = MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Failed to initialize hash state: " + ALGORITHM + " unavailable", e);
        }
        HashState state = new HashState(md);
        if (flavor != null) {
            state.updateString(flavor);
        }
        return state;
    }

    public HashState update(byte[] data) {
        open().update(data);
        return this;
    }

    /**
     * Absorb the UTF-8 bytes of a string followed by a zero terminator, so that
     * consecutive strings cannot run into each other.
     */
    public HashState updateString(String value) {
        MessageDigest md = open();
        md.update(value.getBytes(StandardCharsets.UTF_8));
        md.update((byte) 0);
        return this;
    }

    public HashState update(Digest digest) {
        open().update(digest.rawBytes());
        return this;
    }

    public HashState updateLong(long value) {
        open().update(ByteBuffer.allocate(Long.BYTES).putLong(value).array());
        return this;
    }

    public HashState updateBoolean(boolean value) {
        open().update(value ? (byte) 1 : (byte) 0);
        return this;
    }

    /**
     * Fork this state. Both states continue independently afterwards.
     */
    public HashState copy() {
        try {
            return new HashState((MessageDigest) open().clone());
        } catch (CloneNotSupportedException e) {
            throw new IllegalStateException("Failed to copy hash state", e);
        }
    }

    /**
     * Produce the final digest and release the state.
     */
    public Digest finish() {
        byte[] full = open().digest();
        messageDigest = null;
        byte[] truncated = new byte[Digest.SIZE];
        System.arraycopy(full, 0, truncated, 0, Digest.SIZE);
        return new Digest(truncated);
    }

    boolean isFinished() {
        return messageDigest == null;
    }

    private MessageDigest open() {
        if (messageDigest == null) {
            throw new IllegalStateException("Hash state already finished");
        }
        return messageDigest;
    }
}
