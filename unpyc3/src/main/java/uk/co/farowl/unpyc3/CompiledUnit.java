// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.unpyc3.support.MalformedCodeError;

/**
 * The decompilation-time view of one {@link CodeObject}: its decoded
 * instructions, its name tables as expressions, its enclosing unit (if
 * any), the else-jumps found by the pre-pass, and the {@code global} and
 * {@code nonlocal} declarations discovered while decompiling it.
 * <p>
 * The instructions are fixed once decoded, except that the body of a
 * list, set or dict comprehension has its priming instructions replaced
 * by {@code NOP}, and local slot 0 of a comprehension may be bound to
 * the iterable it consumes.
 */
public final class CompiledUnit {

    private static final Logger logger =
            LoggerFactory.getLogger(CompiledUnit.class);

    private final CodeObject code;
    private final CompiledUnit parent;

    private final List<Instruction> instructions;
    private final Map<Integer, Integer> indexOf = new HashMap<>();

    final List<Expr.Constant> consts = new ArrayList<>();
    final List<Expr.Name> names = new ArrayList<>();
    /** Local variables. Slot 0 may be rebound to an iterable. */
    final List<Expr> varnames = new ArrayList<>();
    /** Cell variables then free variables. */
    final List<Expr.Name> derefnames = new ArrayList<>();

    private final List<Expr.Name> globals = new ArrayList<>();
    private final List<Expr.Name> nonlocals = new ArrayList<>();

    private final Set<Address> elseJumps;

    /**
     * Prepare a top-level code object for decompilation.
     *
     * @param code to decompile
     * @throws MalformedCodeError if the byte code cannot be decoded
     */
    public CompiledUnit(CodeObject code) throws MalformedCodeError {
        this(code, null);
    }

    /**
     * Prepare a code object nested in another unit.
     *
     * @param code to decompile
     * @param parent the unit that makes this one (or {@code null})
     * @throws MalformedCodeError if the byte code cannot be decoded
     */
    CompiledUnit(CodeObject code, CompiledUnit parent)
            throws MalformedCodeError {
        this.code = code;
        this.parent = parent;
        this.instructions =
                new ArrayList<>(Instruction.decode(code.code.asByteArray()));
        for (int i = 0; i < instructions.size(); i++) {
            indexOf.put(instructions.get(i).position(), i);
        }
        for (Object c : code.consts) { consts.add(new Expr.Constant(c)); }
        for (String n : code.names) { names.add(new Expr.Name(n)); }
        for (String n : code.varnames) { varnames.add(new Expr.Name(n)); }
        for (String n : code.cellvars) { derefnames.add(new Expr.Name(n)); }
        for (String n : code.freevars) { derefnames.add(new Expr.Name(n)); }
        // Last, since it navigates the instructions
        this.elseJumps = ElseJumps.find(this);
    }

    /** @return the name of the code object */
    public String name() { return code.name; }

    /** @return the code object */
    public CodeObject code() { return code; }

    /** @return the enclosing unit or {@code null} */
    public CompiledUnit parent() { return parent; }

    /** @return the number of instructions */
    public int size() { return instructions.size(); }

    /**
     * @param i index of an instruction
     * @return the instruction
     */
    Instruction instruction(int i) { return instructions.get(i); }

    /**
     * The address of the instruction with a given index.
     *
     * @param i index of the instruction
     * @return its address
     * @throws MalformedCodeError if there is no such instruction
     */
    public Address at(int i) throws MalformedCodeError {
        if (i < 0 || i >= instructions.size()) {
            throw new MalformedCodeError("no instruction %d in %s", i,
                    name());
        }
        return new Address(this, i);
    }

    /** @return address of the first instruction or {@code null} */
    public Address first() {
        return instructions.isEmpty() ? null : new Address(this, 0);
    }

    /**
     * The address of the instruction at a byte position.
     *
     * @param position in the byte code
     * @return address of the instruction there
     * @throws MalformedCodeError if no instruction starts there
     */
    public Address address(int position) throws MalformedCodeError {
        Integer i = indexOf.get(position);
        if (i == null) {
            throw new MalformedCodeError("no instruction at %d in %s",
                    position, name());
        }
        return new Address(this, i);
    }

    /**
     * @param addr conditional jump
     * @return whether it is an else-jump
     */
    boolean isElseJump(Address addr) {
        // The set is null while the pre-pass itself runs
        return elseJumps != null && elseJumps.contains(addr);
    }

    /** @return the else-jumps of this unit */
    public Set<Address> elseJumps() { return elseJumps; }

    /**
     * Whether the {@code i}th deref name is a cell of this unit rather
     * than a free variable from an enclosing one.
     *
     * @param i index into the deref names
     * @return whether it is a cell variable
     */
    boolean isCellVar(int i) { return i < code.cellvars.size(); }

    /**
     * Record that a name must be declared {@code global}.
     *
     * @param name to declare
     */
    void declareGlobal(Expr.Name name) {
        if (!globals.contains(name)) { globals.add(name); }
    }

    /**
     * Declare a name {@code global} only if it is a local variable of an
     * enclosing unit, where without the declaration it would not be
     * read as global.
     *
     * @param name read as a global
     */
    void ensureGlobal(Expr.Name name) {
        for (CompiledUnit u = parent; u != null; u = u.parent) {
            if (u.varnames.contains(name)) {
                declareGlobal(name);
                return;
            }
        }
    }

    /**
     * Record that a name must be declared {@code nonlocal}.
     *
     * @param name to declare
     */
    void declareNonlocal(Expr.Name name) {
        if (!nonlocals.contains(name)) { nonlocals.add(name); }
    }

    /** @return names declared {@code global}, in order of discovery */
    public List<Expr.Name> globals() {
        return Collections.unmodifiableList(globals);
    }

    /** @return names declared {@code nonlocal}, in order of discovery */
    public List<Expr.Name> nonlocals() {
        return Collections.unmodifiableList(nonlocals);
    }

    /**
     * Replace the first and last instructions by {@code NOP}. In the
     * body of a list, set or dict comprehension these build the empty
     * result and return it.
     */
    void neutraliseLoopPriming() {
        int last = instructions.size() - 1;
        if (last < 0) { return; }
        instructions.set(0, instructions.get(0).replaceOpcode(Opcode.NOP));
        instructions.set(last,
                instructions.get(last).replaceOpcode(Opcode.NOP));
    }

    /**
     * Bind local slot 0 (named {@code .0} in a comprehension) to the
     * iterable expression it receives.
     *
     * @param iterable consumed by the outermost loop
     */
    void bindIterable(Expr iterable) {
        if (varnames.isEmpty()) {
            throw new MalformedCodeError("%s has no local variables",
                    name());
        }
        varnames.set(0, iterable);
    }

    /**
     * Decompile the whole unit.
     *
     * @param includeDeclarations whether to begin with any
     *     {@code global} and {@code nonlocal} declarations found
     * @param lookForDocstring whether an initial assignment to
     *     {@code __doc__} should become a docstring
     * @return the statements of the unit
     */
    public Suite getSuite(boolean includeDeclarations,
            boolean lookForDocstring) {
        logger.atDebug().setMessage("decompiling {}").addArgument(this::name)
                .log();
        SuiteDecompiler dec = new SuiteDecompiler(this);
        dec.run();
        Suite suite = dec.suite();

        if (lookForDocstring && !suite.isEmpty()
                && suite.get(0) instanceof Stmt.Assign a) {
            List<Expr> chain = a.chain();
            if (chain.size() == 2
                    && chain.get(0) instanceof Expr.Name n
                    && n.name().equals("__doc__")
                    && chain.get(1) instanceof Expr.Constant c
                    && c.value() instanceof String s) {
                suite.set(0, new Stmt.DocString(s));
            }
        }

        if (includeDeclarations
                && !(globals.isEmpty() && nonlocals.isEmpty())) {
            Suite declared = new Suite();
            if (!globals.isEmpty()) {
                declared.add(new Stmt.Declaration("global", globals));
            }
            if (!nonlocals.isEmpty()) {
                declared.add(new Stmt.Declaration("nonlocal", nonlocals));
            }
            for (Stmt s : suite) { declared.add(s); }
            suite = declared;
        }

        logger.atDebug().setMessage("decompiled {}: {} statements")
                .addArgument(this::name).addArgument(suite.size()).log();
        return suite;
    }

    @Override
    public String toString() {
        return String.format("<unit %s, %d instructions>", name(),
                instructions.size());
    }
}
