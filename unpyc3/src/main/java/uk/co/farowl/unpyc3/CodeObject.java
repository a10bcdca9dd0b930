// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

import java.util.List;

/**
 * The Java form of a CPython 3.2 {@code code} object, as it may be read
 * from a {@code .pyc} file by {@link uk.co.farowl.unpyc3.modules.marshal}
 * or built by other means. It is immutable.
 * <p>
 * Elements of {@link #consts} are represented as follows:
 * <table>
 * <caption>Java types of constants</caption>
 * <tr><th>Python</th><th>Java</th></tr>
 * <tr><td>{@code None}, {@code Ellipsis}</td><td>{@link Py#None},
 * {@link Py#Ellipsis}</td></tr>
 * <tr><td>{@code bool}</td><td>{@code Boolean}</td></tr>
 * <tr><td>{@code int}</td><td>{@code Integer}, {@code Long} or
 * {@code BigInteger}</td></tr>
 * <tr><td>{@code float}</td><td>{@code Double}</td></tr>
 * <tr><td>{@code complex}</td><td>{@link PyComplex}</td></tr>
 * <tr><td>{@code str}</td><td>{@code String}</td></tr>
 * <tr><td>{@code bytes}</td><td>{@link PyBytes}</td></tr>
 * <tr><td>{@code tuple}</td><td>unmodifiable {@code List}</td></tr>
 * <tr><td>{@code frozenset}</td><td>unmodifiable {@code Set}</td></tr>
 * <tr><td>{@code code}</td><td>{@code CodeObject}</td></tr>
 * </table>
 */
public final class CodeObject {

    /** Bit in {@link #flags} set when locals are in an array. */
    public static final int CO_OPTIMIZED = 0x1;
    /** Bit in {@link #flags} set when a new locals dict is made. */
    public static final int CO_NEWLOCALS = 0x2;
    /** Bit in {@link #flags} set when there is a {@code *args}. */
    public static final int CO_VARARGS = 0x4;
    /** Bit in {@link #flags} set when there is a {@code **kwargs}. */
    public static final int CO_VARKEYWORDS = 0x8;
    /** Bit in {@link #flags} set for a nested function. */
    public static final int CO_NESTED = 0x10;
    /** Bit in {@link #flags} set for a generator function. */
    public static final int CO_GENERATOR = 0x20;
    /** Bit in {@link #flags} set when there are no free or cell variables. */
    public static final int CO_NOFREE = 0x40;

    /** Number of positional parameters. */
    public final int argcount;
    /** Number of keyword-only parameters. */
    public final int kwonlyargcount;
    /** Number of local variables. */
    public final int nlocals;
    /** Depth of value stack needed. */
    public final int stacksize;
    /** {@code CO_*} flags. */
    public final int flags;
    /** Instruction bytes. */
    public final PyBytes code;
    /** Constant pool. */
    public final List<Object> consts;
    /** Names of globals, attributes and imports. */
    public final List<String> names;
    /** Names of parameters then other local variables. */
    public final List<String> varnames;
    /** Names of variables free in this code. */
    public final List<String> freevars;
    /** Names of local variables referenced by nested code. */
    public final List<String> cellvars;
    /** Source file name. */
    public final String filename;
    /** Name of the function, class or pseudo-name of the code. */
    public final String name;
    /** First source line number. */
    public final int firstlineno;
    /** Line number table. */
    public final PyBytes lnotab;

    /**
     * Full constructor.
     *
     * @param argcount value of {@code co_argcount}
     * @param kwonlyargcount value of {@code co_kwonlyargcount}
     * @param nlocals value of {@code co_nlocals}
     * @param stacksize value of {@code co_stacksize}
     * @param flags value of {@code co_flags}
     * @param code value of {@code co_code}
     * @param consts value of {@code co_consts}
     * @param names value of {@code co_names}
     * @param varnames value of {@code co_varnames}
     * @param freevars value of {@code co_freevars}
     * @param cellvars value of {@code co_cellvars}
     * @param filename value of {@code co_filename}
     * @param name value of {@code co_name}
     * @param firstlineno value of {@code co_firstlineno}
     * @param lnotab value of {@code co_lnotab}
     */
    public CodeObject(int argcount, int kwonlyargcount, int nlocals,
            int stacksize, int flags, PyBytes code, List<Object> consts,
            List<String> names, List<String> varnames,
            List<String> freevars, List<String> cellvars,
            String filename, String name, int firstlineno,
            PyBytes lnotab) {
        this.argcount = argcount;
        this.kwonlyargcount = kwonlyargcount;
        this.nlocals = nlocals;
        this.stacksize = stacksize;
        this.flags = flags;
        this.code = code;
        this.consts = List.copyOf(consts);
        this.names = List.copyOf(names);
        this.varnames = List.copyOf(varnames);
        this.freevars = List.copyOf(freevars);
        this.cellvars = List.copyOf(cellvars);
        this.filename = filename;
        this.name = name;
        this.firstlineno = firstlineno;
        this.lnotab = lnotab;
    }

    /**
     * Test a bit in the flags.
     *
     * @param flag one of the {@code CO_*} constants
     * @return whether that bit is set
     */
    public boolean has(int flag) { return (flags & flag) != 0; }

    @Override
    public String toString() {
        return String.format("<code object %s, file \"%s\", line %d>",
                name, filename, firstlineno);
    }
}
