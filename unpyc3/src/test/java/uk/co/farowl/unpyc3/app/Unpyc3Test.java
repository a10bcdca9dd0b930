// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** The command-line program, run in-process. */
class Unpyc3Test {

    /** A CPython 3.2 {@code .pyc} of the module {@code x = 1}. */
    static final byte[] PYC = {
            0x6c, 0x0c, 0x0d, 0x0a, 0, 0, 0, 0, //
            'c', 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, //
            1, 0, 0, 0, 0x40, 0, 0, 0, //
            's', 10, 0, 0, 0, 100, 0, 0, 90, 0, 0, 100, 1, 0, 83, //
            '(', 2, 0, 0, 0, 'i', 1, 0, 0, 0, 'N', //
            '(', 1, 0, 0, 0, 'u', 1, 0, 0, 0, 'x', //
            '(', 0, 0, 0, 0, '(', 0, 0, 0, 0, '(', 0, 0, 0, 0, //
            'u', 4, 0, 0, 0, 'm', '.', 'p', 'y', //
            'u', 8, 0, 0, 0, '<', 'm', 'o', 'd', 'u', 'l', 'e', '>', //
            1, 0, 0, 0, 's', 0, 0, 0, 0};

    ByteArrayOutputStream out, err;

    @BeforeEach
    void streams() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    int run(String... args) {
        return Unpyc3.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    String out() { return out.toString(StandardCharsets.UTF_8); }

    @Test
    void usage() {
        assertEquals(Unpyc3.USAGE, run());
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("usage"));
        assertEquals("", out());
    }

    @Test
    void oneFile(@TempDir Path dir) throws IOException {
        Path pyc = Files.write(dir.resolve("m.pyc"), PYC);
        assertEquals(0, run(pyc.toString()));
        assertEquals("x = 1", out().strip());
    }

    @Test
    void severalFilesAreHeaded(@TempDir Path dir) throws IOException {
        Path a = Files.write(dir.resolve("a.pyc"), PYC);
        Path b = Files.write(dir.resolve("b.pyc"), PYC);
        assertEquals(0, run(a.toString(), b.toString()));
        String text = out();
        assertTrue(text.contains("# " + a + System.lineSeparator()));
        assertTrue(text.contains("# " + b + System.lineSeparator()));
    }

    @Test
    void continuesAfterFailure(@TempDir Path dir) throws IOException {
        Path good = Files.write(dir.resolve("good.pyc"), PYC);
        Path bad = Files.write(dir.resolve("bad.pyc"), new byte[] {1, 2});
        String missing = dir.resolve("missing.pyc").toString();
        assertEquals(Unpyc3.FAILED,
                run(bad.toString(), missing, good.toString()));
        assertTrue(out().contains("x = 1"));
    }
}
