// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.unpyc3.modules.marshal;
import uk.co.farowl.unpyc3.support.DecompileError;

/**
 * Entry points to the decompiler. Each call works on a fresh
 * {@link CompiledUnit}, so nothing is shared between calls.
 */
public class Decompiler {

    private static final Logger logger =
            LoggerFactory.getLogger(Decompiler.class);

    private Decompiler() {} // no instances

    /**
     * Decompile a code object as a block of statements, preceded by any
     * {@code global} or {@code nonlocal} declarations it needs.
     *
     * @param code to decompile
     * @return the statements
     * @throws DecompileError if the code cannot be reconstructed
     */
    public static Suite decompile(CodeObject code) throws DecompileError {
        return new CompiledUnit(code).getSuite(true, false);
    }

    /**
     * Decompile the code object of a module. An initial assignment to
     * {@code __doc__} becomes the module docstring.
     *
     * @param code of the module
     * @return the statements of the module
     * @throws DecompileError if the code cannot be reconstructed
     */
    public static Suite decompileModule(CodeObject code)
            throws DecompileError {
        return new CompiledUnit(code).getSuite(false, true);
    }

    /**
     * Decompile the code object of a function as a {@code def}
     * statement, given the values of its defaults (which are not part of
     * the code object).
     *
     * @param code of the function
     * @param defaults values of the last positional parameters
     * @param kwdefaults values of keyword-only parameters by name
     * @return the definition
     * @throws DecompileError if the code cannot be reconstructed
     */
    public static Stmt.Def decompileFunction(CodeObject code,
            List<Object> defaults, Map<String, Object> kwdefaults)
            throws DecompileError {
        List<Expr> d = new ArrayList<>();
        for (Object v : defaults) { d.add(new Expr.Constant(v)); }
        Map<String, Expr> kw = new LinkedHashMap<>();
        kwdefaults.forEach((k, v) -> kw.put(k, new Expr.Constant(v)));
        Stmt.Def def = new Stmt.Def(new FunctionDefinition(
                new CompiledUnit(code), d, kw, Map.of()));
        def.body();
        return def;
    }

    /**
     * Decompile a compiled module file.
     *
     * @param pyc path to the file
     * @return the statements of the module
     * @throws IOException if the file cannot be read
     * @throws DecompileError if the content cannot be reconstructed
     */
    public static Suite decompile(Path pyc)
            throws IOException, DecompileError {
        logger.atInfo().setMessage("decompiling {}").addArgument(pyc).log();
        try (InputStream in =
                new BufferedInputStream(Files.newInputStream(pyc))) {
            return decompile(in);
        }
    }

    /**
     * Decompile a compiled module from a stream positioned at the magic
     * number.
     *
     * @param in stream of {@code .pyc} data
     * @return the statements of the module
     * @throws IOException if the stream cannot be read
     * @throws DecompileError if the content cannot be reconstructed
     */
    public static Suite decompile(InputStream in)
            throws IOException, DecompileError {
        CodeObject code;
        try {
            code = marshal.readPyc(in);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        logger.atInfo().setMessage("read {}").addArgument(code).log();
        return decompileModule(code);
    }
}
