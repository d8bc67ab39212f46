package com.raditha.cildiff.loader;

import com.raditha.cildiff.diff.DiffSide;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PolicyFileLoaderTest {

    private static final String POLICY = "(type a_t)\n(allow a_t a_t (file (read)))\n";

    @TempDir
    Path tempDir;

    @Test
    void testPlainFile() throws IOException {
        Path file = tempDir.resolve("policy.cil");
        Files.writeString(file, POLICY);

        assertEquals(POLICY, new PolicyFileLoader().load(file.toString(), DiffSide.LEFT));
    }

    @Test
    void testBzip2File() throws IOException {
        Path file = tempDir.resolve("policy.cil.bz2");
        try (OutputStream out = new BZip2CompressorOutputStream(Files.newOutputStream(file))) {
            out.write(POLICY.getBytes(StandardCharsets.UTF_8));
        }

        assertEquals(POLICY, new PolicyFileLoader().load(file.toString(), DiffSide.RIGHT));
    }

    @Test
    void testStandardInput() throws PolicyLoadException {
        PolicyFileLoader loader = new PolicyFileLoader(new ByteArrayInputStream(POLICY.getBytes(StandardCharsets.UTF_8)));

        assertEquals(POLICY, loader.load(PolicyFileLoader.STDIN, DiffSide.LEFT));
    }

    @Test
    void testMissingFile() {
        String missing = tempDir.resolve("missing.cil").toString();

        PolicyLoadException e = assertThrows(PolicyLoadException.class,
                () -> new PolicyFileLoader().load(missing, DiffSide.RIGHT));

        assertEquals(DiffSide.RIGHT, e.getSide());
        assertEquals(missing, e.getPath());
        assertEquals("right policy " + missing + ": No such file", e.getMessage());
    }

    @Test
    void testCorruptBzip2() throws IOException {
        Path file = tempDir.resolve("broken.bz2");
        Files.write(file, new byte[]{'B', 'Z', 'h', '9', 1, 2, 3, 4, 5});

        PolicyLoadException e = assertThrows(PolicyLoadException.class,
                () -> new PolicyFileLoader().load(file.toString(), DiffSide.LEFT));

        assertTrue(e.getMessage().contains("Corrupt bzip2 data"));
    }

    @Test
    void testDirectoryCannotBeRead() {
        PolicyLoadException e = assertThrows(PolicyLoadException.class,
                () -> new PolicyFileLoader().load(tempDir.toString(), DiffSide.LEFT));

        assertEquals(DiffSide.LEFT, e.getSide());
    }

    @Test
    void testSignatureDetection() {
        assertTrue(PolicyFileLoader.isBzip2(new byte[]{'B', 'Z', 'h', '9'}));
        assertFalse(PolicyFileLoader.isBzip2(new byte[]{'B', 'Z'}));
        assertFalse(PolicyFileLoader.isBzip2("(type a_t)".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testDisplayName() {
        assertEquals("<stdin>", PolicyFileLoader.displayName("-"));
        assertEquals("a.cil", PolicyFileLoader.displayName("a.cil"));
    }
}
