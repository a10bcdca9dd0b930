// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static uk.co.farowl.unpyc3.Opcode.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import uk.co.farowl.unpyc3.support.MalformedCodeError;

/** The public entry points, from code objects and from files. */
class DecompilerTest {

    /** A CPython 3.2 {@code .pyc} of the module {@code x = 1}. */
    static final byte[] PYC = {
            0x6c, 0x0c, 0x0d, 0x0a, 0, 0, 0, 0, // magic, mtime
            'c', 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, // argc, kwonly, nlocals
            1, 0, 0, 0, 0x40, 0, 0, 0, // stacksize, flags
            's', 10, 0, 0, 0, 100, 0, 0, 90, 0, 0, 100, 1, 0, 83,
            '(', 2, 0, 0, 0, 'i', 1, 0, 0, 0, 'N', // consts
            '(', 1, 0, 0, 0, 'u', 1, 0, 0, 0, 'x', // names
            '(', 0, 0, 0, 0, '(', 0, 0, 0, 0, '(', 0, 0, 0, 0,
            'u', 4, 0, 0, 0, 'm', '.', 'p', 'y', // filename
            'u', 8, 0, 0, 0, '<', 'm', 'o', 'd', 'u', 'l', 'e', '>',
            1, 0, 0, 0, 's', 0, 0, 0, 0}; // firstlineno, lnotab

    static String render(Suite suite) {
        SourceWriter out = new SourceWriter(4);
        suite.display(out);
        return out.toString();
    }

    @Test
    void fromStream() throws IOException {
        Suite suite = Decompiler.decompile(new ByteArrayInputStream(PYC));
        assertEquals("x = 1", render(suite));
    }

    @Test
    void fromFile(@TempDir Path dir) throws IOException {
        Path pyc = dir.resolve("m.pyc");
        Files.write(pyc, PYC);
        assertEquals("x = 1", render(Decompiler.decompile(pyc)));
    }

    @Test
    void missingFile(@TempDir Path dir) {
        assertThrows(IOException.class,
                () -> Decompiler.decompile(dir.resolve("absent.pyc")));
    }

    @Test
    void streamThatFails() {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("device unplugged");
            }
        };
        IOException e = assertThrows(IOException.class,
                () -> Decompiler.decompile(broken));
        assertEquals("device unplugged", e.getMessage());
    }

    @Test
    void truncatedFile() {
        byte[] b = new byte[20];
        System.arraycopy(PYC, 0, b, 0, b.length);
        assertThrows(MalformedCodeError.class,
                () -> Decompiler.decompile(new ByteArrayInputStream(b)));
    }

    @Test
    void moduleDocstring() {
        CodeObject code = CodeBuilder.module().loadConst("About m.")
                .storeName("__doc__").loadConst(1).storeName("x")
                .returnNone().build();
        assertEquals("'About m.'\nx = 1",
                render(Decompiler.decompileModule(code)));
        assertEquals("__doc__ = 'About m.'\nx = 1",
                render(Decompiler.decompile(code)));
    }

    @Test
    void functionCodeWithDeclarations() {
        CodeBuilder fb = CodeBuilder.function("f").loadConst(1);
        CodeObject f = fb.op(STORE_GLOBAL, fb.name("g")).returnNone()
                .build();
        assertEquals("global g\ng = 1", render(Decompiler.decompile(f)));
    }

    @Test
    void functionWithDefaults() {
        CodeObject f = CodeBuilder.function("f", "a", "b").kwonly("c")
                .loadFast("a").loadFast("b").op(BINARY_ADD)
                .loadFast("c").op(BINARY_MULTIPLY).op(RETURN_VALUE)
                .build();
        Stmt.Def def = Decompiler.decompileFunction(f, List.of(1),
                Map.of("c", "s"));
        assertEquals("def f(a, b=1, *, c='s'):\n    return (a + b)*c",
                def.toString());
    }
}
