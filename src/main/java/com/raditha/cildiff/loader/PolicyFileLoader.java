package com.raditha.cildiff.loader;

import com.raditha.cildiff.diff.DiffSide;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads policy source from a file or standard input.
 * <p>
 * Input compressed with bzip2 is recognized by its signature and decompressed
 * transparently. Content is decoded as UTF-8.
 */
public class PolicyFileLoader {

    private static final Logger logger = LoggerFactory.getLogger(PolicyFileLoader.class);

    public static final String STDIN = "-";
    static final String STDIN_NAME = "<stdin>";

    private static final byte[] BZIP2_SIGNATURE = {'B', 'Z', 'h'};

    private final InputStream stdin;

    public PolicyFileLoader() {
        this(System.in);
    }

    public PolicyFileLoader(InputStream stdin) {
        this.stdin = stdin;
    }

    /**
     * Load the text of one side of the comparison.
     *
     * @param path file path, or {@code -} for standard input
     * @param side the side being loaded, used in error messages
     * @return the decoded policy text
     * @throws PolicyLoadException if the input cannot be read or decompressed
     */
    public String load(String path, DiffSide side) throws PolicyLoadException {
        String name = displayName(path);
        byte[] bytes = readBytes(path, name, side);
        if (isBzip2(bytes)) {
            logger.debug("{} policy {} is bzip2 compressed ({} bytes)", side.getLabel(), name, bytes.length);
            bytes = decompress(bytes, name, side);
        }
        logger.debug("Loaded {} policy {} ({} bytes)", side.getLabel(), name, bytes.length);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * The name used for a path in messages and output.
     */
    public static String displayName(String path) {
        return STDIN.equals(path) ? STDIN_NAME : path;
    }

    private byte[] readBytes(String path, String name, DiffSide side) throws PolicyLoadException {
        try {
            if (STDIN.equals(path)) {
                return stdin.readAllBytes();
            }
            return Files.readAllBytes(Path.of(path));
        } catch (NoSuchFileException e) {
            throw new PolicyLoadException(side, name, "No such file", e);
        } catch (AccessDeniedException e) {
            throw new PolicyLoadException(side, name, "Permission denied", e);
        } catch (IOException e) {
            throw new PolicyLoadException(side, name, "Failed to read: " + e.getMessage(), e);
        }
    }

    private static byte[] decompress(byte[] bytes, String name, DiffSide side) throws PolicyLoadException {
        try (InputStream in = new BZip2CompressorInputStream(new ByteArrayInputStream(bytes))) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new PolicyLoadException(side, name, "Corrupt bzip2 data: " + e.getMessage(), e);
        }
    }

    static boolean isBzip2(byte[] bytes) {
        if (bytes.length < BZIP2_SIGNATURE.length) {
            return false;
        }
        for (int i = 0; i < BZIP2_SIGNATURE.length; i++) {
            if (bytes[i] != BZIP2_SIGNATURE[i]) {
                return false;
            }
        }
        return true;
    }
}
