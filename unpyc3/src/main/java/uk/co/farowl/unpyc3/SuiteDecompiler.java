// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

import static uk.co.farowl.unpyc3.Opcode.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.unpyc3.support.DecompileError;
import uk.co.farowl.unpyc3.support.InvariantError;
import uk.co.farowl.unpyc3.support.MalformedCodeError;
import uk.co.farowl.unpyc3.support.UnsupportedConstructError;

/**
 * Reconstruct the statements of a range of instructions in one unit by
 * symbolic execution. Each instruction is handled by popping and
 * pushing {@link StackItem}s and adding statements to a {@link Suite}.
 * Control structures are recognised at the instruction that opens them,
 * and their parts are decompiled by nested instances of this class over
 * sub-ranges, after which execution resumes beyond the structure.
 * <p>
 * A nested instance either has a stack of its own or shares the stack of
 * the instance that made it, as when it evaluates the right operand of a
 * short-circuit {@code and} or {@code or}.
 */
public final class SuiteDecompiler {

    private static final Logger logger =
            LoggerFactory.getLogger(SuiteDecompiler.class);

    /**
     * The marker pushed by {@code LOAD_BUILD_CLASS}, which turns the call
     * that consumes it into a class definition.
     */
    enum BuildClass implements StackItem {
        MARKER
    }

    /**
     * A conditional jump waiting to be combined into a condition.
     *
     * @param truthiness the jump is taken if the condition is this
     * @param target of the jump ({@code null} for the end of the unit)
     * @param cond the condition so far
     */
    private static record PendingJump(boolean truthiness, Address target,
            Expr cond) {}

    private final CompiledUnit unit;
    private final Address start;
    private final Address end;
    private final EvaluationStack stack;
    private final boolean ownsStack;
    private final Suite suite = new Suite();
    private final List<Expr> assignmentChain = new ArrayList<>();
    private final List<PendingJump> popjumps = new ArrayList<>();

    /** Set by a handler to make {@link #run()} return immediately. */
    private boolean endNow;

    /**
     * Decompile a whole unit.
     *
     * @param unit to decompile
     */
    public SuiteDecompiler(CompiledUnit unit) {
        this(unit, unit.first(), null, new EvaluationStack(), true);
    }

    /**
     * Decompile a range of instructions with a stack of its own.
     *
     * @param start first instruction
     * @param end instruction after the last ({@code null} for the end of
     *     the unit)
     */
    SuiteDecompiler(Address start, Address end) {
        this(start.unit(), start, end, new EvaluationStack(), true);
    }

    /**
     * Decompile a range of instructions on a stack shared with the
     * caller.
     *
     * @param start first instruction
     * @param end instruction after the last ({@code null} for the end of
     *     the unit)
     * @param stack to share
     */
    SuiteDecompiler(Address start, Address end, EvaluationStack stack) {
        this(start.unit(), start, end, stack, false);
    }

    private SuiteDecompiler(CompiledUnit unit, Address start, Address end,
            EvaluationStack stack, boolean ownsStack) {
        this.unit = unit;
        this.start = start;
        this.end = end;
        this.stack = stack;
        this.ownsStack = ownsStack;
    }

    /** @return the evaluation stack */
    EvaluationStack stack() { return stack; }

    /** @return the statements reconstructed so far */
    public Suite suite() { return suite; }

    /**
     * The targets (and finally the value) of an assignment under
     * construction. Expressions add to this when stored.
     *
     * @return the (mutable) chain
     */
    List<Expr> assignmentChain() { return assignmentChain; }

    /**
     * Add a statement to the suite.
     *
     * @param stmt to add
     */
    void addStatement(Stmt stmt) { suite.add(stmt); }

    /**
     * Pop the top of the stack and store it to a destination. What that
     * means is up to the item popped.
     *
     * @param dest target of the store
     */
    void store(Expr dest) { stack.pop().store(this, dest); }

    /**
     * Process instructions from the start address until the end address
     * or until a handler signals the end of the construct.
     *
     * @return address at which processing stopped ({@code null} at the
     *     end of the unit)
     * @throws DecompileError when the byte code cannot be reconstructed
     */
    public Address run() throws DecompileError {
        Address addr = start;
        while (addr != null && addr.isBefore(end)) {
            logger.atTrace().setMessage("{}: {}").addArgument(unit::name)
                    .addArgument(addr).log();
            Address next;
            try {
                next = dispatch(addr);
            } catch (DecompileError e) {
                throw e.at(unit.name(), addr);
            } catch (IndexOutOfBoundsException e) {
                throw new MalformedCodeError(e, "argument out of range")
                        .at(unit.name(), addr);
            }
            if (endNow) { return addr; }
            addr = next;
        }

        if (ownsStack) {
            for (StackItem item : stack.peek(stack.size())) {
                if (item instanceof Unpack u && u.isIncomplete()) {
                    throw new InvariantError("incomplete %s", u)
                            .at(unit.name(), addr == null ? "end" : addr);
                }
            }
        }
        if (!assignmentChain.isEmpty()) {
            throw new InvariantError("unfinished assignment to %s",
                    assignmentChain).at(unit.name(),
                            addr == null ? "end" : addr);
        }
        return addr;
    }

    /**
     * Carry out the action of one instruction.
     *
     * @param addr of the instruction
     * @return address of the next instruction to process
     */
    private Address dispatch(Address addr) {
        Address next = addr.offset(1);
        Opcode opcode = addr.opcode();
        int arg = addr.arg();

        return switch (opcode) {
            case NOP, SETUP_LOOP, POP_BLOCK, GET_ITER, JUMP_ABSOLUTE,
                    EXTENDED_ARG -> next;

            case STOP_CODE, WITH_CLEANUP -> throw new UnsupportedConstructError(
                    "%s outside the construct that owns it", opcode);

            // Blocks and exceptions

            case BREAK_LOOP -> {
                addStatement(new Stmt.Break());
                yield next;
            }
            case CONTINUE_LOOP -> {
                addStatement(new Stmt.Continue());
                yield next;
            }
            case SETUP_FINALLY -> setupFinally(addr);
            case SETUP_EXCEPT -> setupExcept(addr);
            case SETUP_WITH -> setupWith(addr);
            case END_FINALLY, POP_EXCEPT -> {
                endNow = true;
                yield addr;
            }
            case COMPARE_OP -> compare(addr);
            case RAISE_VARARGS -> {
                raise(arg);
                yield next;
            }

            // Stack manipulation

            case POP_TOP, PRINT_EXPR, LIST_APPEND, SET_ADD -> {
                popTop();
                yield next;
            }
            case ROT_TWO -> {
                rotTwo();
                yield next;
            }
            case ROT_THREE -> rotThree(addr);
            case DUP_TOP -> {
                stack.push(stack.peek());
                yield next;
            }
            case DUP_TOP_TWO -> {
                stack.push(stack.peek(2).toArray(new StackItem[2]));
                yield next;
            }

            // Names

            case LOAD_FAST -> {
                stack.push(unit.varnames.get(arg));
                yield next;
            }
            case STORE_FAST -> {
                store(unit.varnames.get(arg));
                yield next;
            }
            case DELETE_FAST -> {
                addStatement(new Stmt.Delete(unit.varnames.get(arg)));
                yield next;
            }
            case LOAD_DEREF, LOAD_CLOSURE -> {
                stack.push(unit.derefnames.get(arg));
                yield next;
            }
            case STORE_DEREF -> {
                store(derefForWrite(arg));
                yield next;
            }
            case DELETE_DEREF -> {
                addStatement(new Stmt.Delete(derefForWrite(arg)));
                yield next;
            }
            case LOAD_GLOBAL -> {
                Expr.Name name = unit.names.get(arg);
                unit.ensureGlobal(name);
                stack.push(name);
                yield next;
            }
            case STORE_GLOBAL -> {
                Expr.Name name = unit.names.get(arg);
                unit.declareGlobal(name);
                store(name);
                yield next;
            }
            case DELETE_GLOBAL -> {
                Expr.Name name = unit.names.get(arg);
                unit.declareGlobal(name);
                addStatement(new Stmt.Delete(name));
                yield next;
            }
            case LOAD_NAME -> {
                stack.push(unit.names.get(arg));
                yield next;
            }
            case STORE_NAME -> {
                store(unit.names.get(arg));
                yield next;
            }
            case DELETE_NAME -> {
                addStatement(new Stmt.Delete(unit.names.get(arg)));
                yield next;
            }
            case LOAD_ATTR -> {
                loadAttr(unit.names.get(arg).name());
                yield next;
            }
            case STORE_ATTR -> {
                Expr obj = stack.popExpr();
                store(new Expr.Attribute(obj, unit.names.get(arg).name()));
                yield next;
            }
            case DELETE_ATTR -> {
                Expr obj = stack.popExpr();
                addStatement(new Stmt.Delete(new Expr.Attribute(obj,
                        unit.names.get(arg).name())));
                yield next;
            }
            case STORE_SUBSCR -> {
                List<Expr> os = stack.popExprs(2);
                store(new Expr.BinaryOp(Operator.SUBSCRIPT, os.get(0),
                        os.get(1)));
                yield next;
            }
            case DELETE_SUBSCR -> {
                List<Expr> os = stack.popExprs(2);
                addStatement(new Stmt.Delete(new Expr.BinaryOp(
                        Operator.SUBSCRIPT, os.get(0), os.get(1))));
                yield next;
            }
            case LOAD_CONST -> {
                stack.push(unit.consts.get(arg));
                yield next;
            }

            // Imports

            case IMPORT_NAME -> {
                importName(unit.names.get(arg).name());
                yield next;
            }
            case IMPORT_FROM -> {
                stack.push(new ImportFrom(unit.names.get(arg).name()));
                yield next;
            }
            case IMPORT_STAR -> {
                popTop();
                yield next;
            }

            // Functions, classes and calls

            case STORE_LOCALS -> {
                // Skip the assignment to __module__ that follows
                stack.pop();
                yield addr.offset(3);
            }
            case LOAD_BUILD_CLASS -> {
                stack.push(BuildClass.MARKER);
                yield next;
            }
            case RETURN_VALUE -> {
                returnValue(addr);
                yield next;
            }
            case YIELD_VALUE -> {
                // In a generator expression the yield is implicit
                if (!"<genexpr>".equals(unit.name())) {
                    stack.push(new Expr.Yield(stack.popExpr()));
                }
                yield next;
            }
            case CALL_FUNCTION -> {
                callFunction(arg, false, false);
                yield next;
            }
            case CALL_FUNCTION_VAR -> {
                callFunction(arg, true, false);
                yield next;
            }
            case CALL_FUNCTION_KW -> {
                callFunction(arg, false, true);
                yield next;
            }
            case CALL_FUNCTION_VAR_KW -> {
                callFunction(arg, true, true);
                yield next;
            }
            case MAKE_FUNCTION -> {
                makeFunction(arg, false);
                yield next;
            }
            case MAKE_CLOSURE -> {
                makeFunction(arg, true);
                yield next;
            }

            // Unpacking

            case UNPACK_SEQUENCE -> {
                unpack(stack.pop(), arg, -1);
                yield next;
            }
            case UNPACK_EX -> {
                int before = arg & 0xff, after = arg >> 8;
                unpack(stack.pop(), before + after + 1, before);
                yield next;
            }

            // Displays

            case BUILD_SLICE -> {
                buildSlice(arg);
                yield next;
            }
            case BUILD_TUPLE -> {
                stack.push(new Expr.Tuple(stack.popExprs(arg)));
                yield next;
            }
            case BUILD_LIST -> {
                stack.push(new Expr.ListDisplay(stack.popExprs(arg)));
                yield next;
            }
            case BUILD_SET -> {
                stack.push(new Expr.SetDisplay(stack.popExprs(arg)));
                yield next;
            }
            case BUILD_MAP -> {
                stack.push(new Expr.DictDisplay());
                yield next;
            }
            case STORE_MAP -> {
                List<Expr> vk = stack.popExprs(2);
                if (stack.peek() instanceof Expr.DictDisplay d) {
                    d.setItem(vk.get(1), vk.get(0));
                } else {
                    throw new UnsupportedConstructError(
                            "STORE_MAP without a dict display");
                }
                yield next;
            }
            case MAP_ADD -> {
                List<Expr> vk = stack.popExprs(2);
                stack.push(new Expr.BinaryOp(Operator.KEY_VALUE, vk.get(1),
                        vk.get(0)));
                popTop();
                yield next;
            }

            // Operators

            case UNARY_POSITIVE -> unary(Expr.Unary.POSITIVE, next);
            case UNARY_NEGATIVE -> unary(Expr.Unary.NEGATIVE, next);
            case UNARY_NOT -> unary(Expr.Unary.NOT, next);
            case UNARY_INVERT -> unary(Expr.Unary.INVERT, next);

            case BINARY_POWER, BINARY_MULTIPLY, BINARY_MODULO, BINARY_ADD,
                    BINARY_SUBTRACT, BINARY_SUBSCR, BINARY_FLOOR_DIVIDE,
                    BINARY_TRUE_DIVIDE, BINARY_LSHIFT, BINARY_RSHIFT,
                    BINARY_AND, BINARY_XOR, BINARY_OR -> {
                List<Expr> lr = stack.popExprs(2);
                stack.push(new Expr.BinaryOp(Operator.binary(opcode),
                        lr.get(0), lr.get(1)));
                yield next;
            }

            case INPLACE_FLOOR_DIVIDE, INPLACE_TRUE_DIVIDE, INPLACE_ADD,
                    INPLACE_SUBTRACT, INPLACE_MULTIPLY, INPLACE_MODULO,
                    INPLACE_POWER, INPLACE_LSHIFT, INPLACE_RSHIFT,
                    INPLACE_AND, INPLACE_XOR, INPLACE_OR -> {
                List<Expr> lr = stack.popExprs(2);
                stack.push(new Stmt.AugmentedAssign(Operator.inPlace(opcode),
                        lr.get(0), lr.get(1)));
                yield next;
            }

            // Jumps, conditions and loops

            case JUMP_FORWARD -> addr.jump();
            case JUMP_IF_FALSE_OR_POP -> shortCircuit(addr, false);
            case JUMP_IF_TRUE_OR_POP -> shortCircuit(addr, true);
            case POP_JUMP_IF_FALSE -> popJumpIf(addr, false);
            case POP_JUMP_IF_TRUE -> popJumpIf(addr, true);
            case FOR_ITER -> forIter(addr);
        };
    }

    private Address unary(Expr.Unary op, Address next) {
        stack.push(new Expr.UnaryOp(op, stack.popExpr()));
        return next;
    }

    private void popTop() { stack.pop().onPop(this); }

    /**
     * A name in the deref table about to be written. Writing a free
     * variable (not a cell of this unit) requires a {@code nonlocal}
     * declaration.
     */
    private Expr.Name derefForWrite(int i) {
        Expr.Name name = unit.derefnames.get(i);
        if (!unit.isCellVar(i)) { unit.declareNonlocal(name); }
        return name;
    }

    private void loadAttr(String name) {
        StackItem obj = stack.pop();
        if (obj instanceof Stmt.Import) {
            // import a.b as c fetches b from a: the import stands
            stack.push(obj);
        } else if (obj instanceof Expr e) {
            stack.push(new Expr.Attribute(e, name));
        } else {
            throw new UnsupportedConstructError("attribute %s of %s", name,
                    obj.getClass().getSimpleName());
        }
    }

    /** Handle {@code ROT_TWO}, usually a swap {@code a, b = b, a}. */
    private void rotTwo() {
        if (stack.peek() instanceof Stmt.AugmentedAssign) {
            // As in x.a += 1, where the object goes back on top
            List<StackItem> two = stack.pop(2);
            stack.push(two.get(1), two.get(0));
        } else {
            Unpack u = new Unpack(new Expr.Tuple(stack.popExprs(2)), 2, -1);
            stack.push(u, u);
        }
    }

    /**
     * Handle {@code ROT_THREE}, which followed by {@code ROT_TWO} is a
     * three-way swap, and otherwise a rotation.
     */
    private Address rotThree(Address addr) {
        if (Address.opcodeAt(addr.offset(1)) == ROT_TWO) {
            Unpack u = new Unpack(new Expr.Tuple(stack.popExprs(3)), 3, -1);
            stack.push(u, u, u);
            return addr.offset(2);
        } else {
            List<StackItem> three = stack.pop(3);
            stack.push(three.get(2), three.get(0), three.get(1));
            return addr.offset(1);
        }
    }

    private void unpack(StackItem value, int count, int starIndex) {
        Unpack u = new Unpack(value, count, starIndex);
        for (int i = 0; i < count; i++) { stack.push(u); }
    }

    private void buildSlice(int argc) {
        if (argc != 2 && argc != 3) {
            throw new MalformedCodeError("BUILD_SLICE %d", argc);
        }
        List<Expr> p = stack.popExprs(argc);
        stack.push(new Expr.Slice(p.get(0), p.get(1),
                argc == 3 ? p.get(2) : null));
    }

    private void importName(String name) {
        List<Expr> lf = stack.popExprs(2);
        Object level = constantValue(lf.get(0));
        Object fromlist = constantValue(lf.get(1));
        if (!(level instanceof Integer n)) {
            throw new UnsupportedConstructError("import level %s", level);
        }
        stack.push(new Stmt.Import(name, n, fromlist));
    }

    private static Object constantValue(Expr e) {
        if (e instanceof Expr.Constant c) { return c.value(); }
        throw new UnsupportedConstructError("%s is not a constant", e);
    }

    private void returnValue(Address addr) {
        Expr value = stack.popExpr();
        if (Expr.isNone(value)) {
            // The implicit return at the end is not written
            if (addr.offset(1) != null) {
                addStatement(new Stmt.Return(null));
            }
        } else {
            addStatement(new Stmt.Return(value));
        }
    }

    private void raise(int argc) {
        switch (argc) {
            case 0 -> addStatement(new Stmt.Raise(null, null));
            case 1 -> addStatement(new Stmt.Raise(stack.popExpr(), null));
            case 2 -> {
                // The cause is on top
                List<Expr> ec = stack.popExprs(2);
                addStatement(new Stmt.Raise(ec.get(0), ec.get(1)));
            }
            default -> throw new UnsupportedConstructError(
                    "raise with %d arguments", argc);
        }
    }

    /**
     * Handle {@code MAKE_FUNCTION} and {@code MAKE_CLOSURE}. The argument
     * packs the counts of positional defaults (low byte), keyword-only
     * defaults (next byte) and annotations plus one (upper half).
     */
    private void makeFunction(int argc, boolean isClosure) {
        Object co = constantValue(stack.popExpr());
        if (!(co instanceof CodeObject code)) {
            throw new MalformedCodeError("function made from %s", co);
        }
        CompiledUnit nested = new CompiledUnit(code, unit);
        if (isClosure) {
            // The tuple of cells adds nothing to the source
            stack.pop();
        }

        Map<String, Expr> annotations = new LinkedHashMap<>();
        int numAnnotations = (argc >> 16) & 0x7fff;
        if (numAnnotations > 0) {
            Object names = constantValue(stack.popExpr());
            List<Expr> values = stack.popExprs(numAnnotations - 1);
            if (!(names instanceof List<?> ns) || ns.size() != values.size()) {
                throw new MalformedCodeError("annotation names %s", names);
            }
            for (int i = 0; i < values.size(); i++) {
                annotations.put(ns.get(i).toString(), values.get(i));
            }
        }

        List<Expr> defaults = stack.popExprs(argc & 0xff);

        Map<String, Expr> kwdefaults = new LinkedHashMap<>();
        for (int i = (argc >> 8) & 0xff; i > 0; --i) {
            List<Expr> kv = stack.popExprs(2);
            kwdefaults.put(constantValue(kv.get(0)).toString(), kv.get(1));
        }

        FunctionDefinition def = new FunctionDefinition(nested, defaults,
                kwdefaults, annotations);
        Expr.Comprehension.Kind kind =
                Expr.Comprehension.Kind.forUnitName(code.name);
        if ("<lambda>".equals(code.name)) {
            stack.push(new Expr.Lambda(def));
        } else if (kind != null) {
            stack.push(new Expr.Comprehension(kind, nested));
        } else {
            stack.push(new Stmt.Def(def));
        }
    }

    /**
     * Handle the {@code CALL_FUNCTION} family. The argument packs the
     * number of positional arguments (low byte) and of keyword pairs
     * (next byte).
     */
    private void callFunction(int argc, boolean hasVar, boolean hasKw) {
        Expr varkw = hasKw ? stack.popExpr() : null;
        Expr varargs = hasVar ? stack.popExpr() : null;

        List<Expr> kwItems = stack.popExprs(2 * ((argc >> 8) & 0xff));
        List<Expr.Keyword> kwargs = new ArrayList<>();
        for (int i = 0; i < kwItems.size(); i += 2) {
            String k = constantValue(kwItems.get(i)).toString();
            kwargs.add(new Expr.Keyword(k, kwItems.get(i + 1)));
        }

        List<StackItem> posargs = stack.pop(argc & 0xff);
        StackItem func = stack.pop();
        boolean plain = !hasVar && !hasKw;

        if (func == BuildClass.MARKER) {
            if (!plain || posargs.size() < 2
                    || !(posargs.get(0) instanceof Stmt.Def body)) {
                throw new UnsupportedConstructError(
                        "class construction with %d arguments",
                        posargs.size());
            }
            List<Expr> bases = new ArrayList<>();
            for (StackItem b : posargs.subList(2, posargs.size())) {
                bases.add(asExpr(b));
            }
            stack.push(new Stmt.Class(body.def, bases, kwargs));

        } else if (func instanceof Expr.Comprehension c) {
            if (!plain || posargs.size() != 1 || !kwargs.isEmpty()) {
                throw new UnsupportedConstructError(
                        "comprehension called with %d arguments",
                        posargs.size());
            }
            c.setIterable(asExpr(posargs.get(0)));
            stack.push(c);

        } else if (plain && posargs.size() == 1 && kwargs.isEmpty()
                && posargs.get(0) instanceof Stmt.Decorable d) {
            d.decorate(asExpr(func));
            stack.push(posargs.get(0));

        } else {
            List<Expr> args = new ArrayList<>();
            for (StackItem a : posargs) { args.add(asExpr(a)); }
            stack.push(new Expr.Call(asExpr(func), args, kwargs, varargs,
                    varkw));
        }
    }

    private static Expr asExpr(StackItem item) {
        if (item instanceof Expr e) { return e; }
        throw new UnsupportedConstructError("%s used as a value",
                item.getClass().getSimpleName());
    }

    /**
     * Handle {@code COMPARE_OP}. An exception match is the start of a
     * typed {@code except} clause, and the left operand is the
     * {@link Stmt.Try} it belongs to. The clause has the form:
     *
     * <pre>
     *      COMPARE_OP          exception match
     *      POP_JUMP_IF_FALSE   next clause
     *      POP_TOP
     *      POP_TOP | STORE_*   (bound name)
     *      POP_TOP
     *      SETUP_FINALLY       (only if a name is bound)
     * </pre>
     */
    private Address compare(Address addr) {
        List<StackItem> lr = stack.pop(2);
        if (addr.arg() != EXC_MATCH) {
            if (addr.arg() >= CMP_OP.length) {
                throw new MalformedCodeError("comparison %d", addr.arg());
            }
            stack.push(new Expr.Compare(asExpr(lr.get(0)),
                    CMP_OP[addr.arg()], asExpr(lr.get(1))));
            return addr.offset(1);
        }

        if (!(lr.get(0) instanceof Stmt.Try t)) {
            throw new UnsupportedConstructError(
                    "exception match outside an except clause");
        }
        expect(addr.get(1), POP_JUMP_IF_FALSE);
        expect(addr.get(2), POP_TOP);
        expect(addr.get(4), POP_TOP);
        t.nextHandler = addr.get(1).jump();

        Address bodyStart, bodyEnd;
        if (Address.opcodeAt(addr.offset(5)) == SETUP_FINALLY) {
            bodyStart = addr.get(6);
            bodyEnd = addr.get(5).jump();
        } else {
            bodyStart = addr.get(5);
            bodyEnd = t.nextHandler.get(-1);
        }
        SuiteDecompiler body = new SuiteDecompiler(bodyStart, bodyEnd);
        body.run();
        t.addHandler(asExpr(lr.get(1)), body.suite);

        if (addr.get(3).opcode() != POP_TOP) {
            // The store names the exception in the clause just added
            SuiteDecompiler name = new SuiteDecompiler(addr.get(3),
                    addr.get(4));
            name.stack.push(t);
            name.run();
        }
        endNow = true;
        return addr;
    }

    private static void expect(Address addr, Opcode opcode) {
        if (addr.opcode() != opcode) {
            throw new UnsupportedConstructError("expected %s at %s", opcode,
                    addr.position());
        }
    }

    /** Handle {@code SETUP_FINALLY} (a {@code try ... finally}). */
    private Address setupFinally(Address addr) {
        Address startFinally = addr.jump();
        SuiteDecompiler dTry = new SuiteDecompiler(addr.get(1), startFinally);
        dTry.run();
        SuiteDecompiler dFinally = new SuiteDecompiler(startFinally, null);
        Address endFinally = dFinally.run();
        if (endFinally == null) {
            throw new MalformedCodeError("finally clause has no end");
        }
        addStatement(new Stmt.Finally(dTry.suite, dFinally.suite));
        return endFinally.offset(1);
    }

    /**
     * Handle {@code SETUP_EXCEPT}. The guarded block ends with a jump
     * over the handlers. Each handler begins with {@code DUP_TOP} (a
     * typed clause) or {@code POP_TOP} (a bare clause), and the handlers
     * are followed by {@code END_FINALLY}. If the jump at the end of the
     * last handler goes beyond the instruction after the
     * {@code END_FINALLY}, the instructions in between are an
     * {@code else} clause.
     */
    private Address setupExcept(Address addr) {
        Address startExcept = addr.jump();
        Address endTry = startExcept.get(-1);
        if (endTry.opcode() != JUMP_FORWARD
                && endTry.opcode() != JUMP_ABSOLUTE) {
            throw new UnsupportedConstructError(
                    "try block ends with %s", endTry.opcode());
        }
        SuiteDecompiler dTry = new SuiteDecompiler(addr.get(1), endTry);
        dTry.run();
        Stmt.Try stmt = new Stmt.Try(dTry.suite);

        Address h = startExcept;
        while (h.opcode() != END_FINALLY) {
            if (h.opcode() == DUP_TOP) {
                SuiteDecompiler d = new SuiteDecompiler(h.get(1), null);
                d.stack.push(stmt);
                d.run();
                if (stmt.nextHandler == null) {
                    throw new UnsupportedConstructError(
                            "except clause without exception match");
                }
                h = stmt.nextHandler;
                stmt.nextHandler = null;
            } else if (h.opcode() == POP_TOP) {
                SuiteDecompiler d = new SuiteDecompiler(h.get(3), null);
                Address endExcept = d.run();
                if (endExcept == null) {
                    throw new MalformedCodeError("except clause has no end");
                }
                stmt.addHandler(null, d.suite);
                h = endExcept.get(2);
                expect(h, END_FINALLY);
            } else {
                throw new UnsupportedConstructError(
                        "except clause begins with %s", h.opcode());
            }
        }

        addStatement(stmt);
        Address afterHandlers = h.offset(1);
        Address lastJump = h.get(-1);
        if (lastJump.opcode() == JUMP_FORWARD && afterHandlers != null) {
            Address endElse = lastJump.jump();
            if (afterHandlers.isBefore(endElse)) {
                SuiteDecompiler dElse =
                        new SuiteDecompiler(afterHandlers, endElse);
                dElse.run();
                stmt.elseSuite = dElse.suite;
                return endElse;
            }
        }
        return afterHandlers;
    }

    /** Handle {@code SETUP_WITH}. */
    private Address setupWith(Address addr) {
        Address endWith = addr.jump();
        Stmt.With with = new Stmt.With(stack.popExpr());
        SuiteDecompiler d = new SuiteDecompiler(addr.get(1), endWith);
        d.stack.push(with);
        d.run();
        with.body = d.suite;
        addStatement(with);
        expect(endWith, WITH_CLEANUP);
        expect(endWith.get(1), END_FINALLY);
        return endWith.offset(2);
    }

    /** Handle {@code FOR_ITER}, which opens a {@code for} loop. */
    private Address forIter(Address addr) {
        Expr iterable = stack.popExpr();
        Address exit = addr.jump();
        Stmt.For loop = new Stmt.For(iterable);
        SuiteDecompiler d = new SuiteDecompiler(addr.get(1), exit.get(-1));
        d.stack.push(loop);
        d.run();
        loop.body = d.suite;
        addStatement(loop);
        return exit;
    }

    /**
     * Handle {@code JUMP_IF_FALSE_OR_POP} and {@code JUMP_IF_TRUE_OR_POP}
     * which evaluate a short-circuit {@code and} or {@code or} for its
     * value. The right operand is decompiled on the shared stack.
     */
    private Address shortCircuit(Address addr, boolean isOr) {
        Address endAddr = addr.jump();
        pushPopJump(true, endAddr, stack.popExpr());
        Expr left = popPopJump();
        if (!isOr && endAddr.opcode() == ROT_TWO) {
            // In a chained comparison, skip the clean-up of the failed case
            Address prev = endAddr.get(-1);
            if (prev.opcode() == JUMP_FORWARD && prev.arg() == 2) {
                endAddr = endAddr.get(2);
            }
        }
        SuiteDecompiler d = new SuiteDecompiler(addr.get(1), endAddr, stack);
        d.run();
        Expr right = stack.popExpr();
        stack.push(isOr ? Expr.or(left, right) : Expr.and(left, right));
        return endAddr;
    }

    /**
     * Push a conditional jump onto the pending jumps, first combining
     * into its condition any pending jumps that target an address before
     * this one's. A jump that targets the start of a true branch is
     * treated as targeting the start of the corresponding false branch.
     */
    private void pushPopJump(boolean truthiness, Address target,
            Expr cond) {
        if (target != null) {
            Address prev = target.offset(-1);
            if (prev != null && prev.isElseJump()) { target = prev.jump(); }
        }
        while (!popjumps.isEmpty()) {
            PendingJump top = popjumps.get(popjumps.size() - 1);
            if (Address.atOrBefore(target, top.target())) { break; }
            popjumps.remove(popjumps.size() - 1);
            cond = top.truthiness() ? Expr.or(top.cond(), cond)
                    : Expr.and(top.cond(), cond);
        }
        popjumps.add(new PendingJump(truthiness, target, cond));
    }

    private Expr popPopJump() {
        return popjumps.remove(popjumps.size() - 1).cond();
    }

    /**
     * Handle {@code POP_JUMP_IF_FALSE} and {@code POP_JUMP_IF_TRUE}. A
     * jump that is not an else-jump is an operand of {@code and} or
     * {@code or} and joins the pending jumps. An else-jump completes the
     * condition and opens an {@code if} statement, a conditional
     * expression or a {@code while} loop.
     */
    private Address popJumpIf(Address addr, boolean truthiness) {
        Address jumpAddr = addr.jump();
        if (jumpAddr.opcode() == FOR_ITER) {
            // The if is the last thing in a for loop (or comprehension)
            jumpAddr = jumpAddr.jump();
            if (jumpAddr.opcode() == POP_BLOCK) {
                jumpAddr = jumpAddr.get(-1);
            }
        } else if (Address.opcodeAt(jumpAddr.offset(-1)) == SETUP_LOOP) {
            // The if is the last thing in a while loop
            jumpAddr = jumpAddr.get(-1).jump().get(-2);
        }

        Expr cond = stack.popExpr();
        if (!addr.isElseJump()) {
            pushPopJump(truthiness, jumpAddr, cond);
            return addr.offset(1);
        }

        pushPopJump(truthiness, jumpAddr.offset(1), cond);
        cond = popPopJump();
        if (truthiness) { cond = new Expr.UnaryOp(Expr.Unary.NOT, cond); }

        Address endTrue = jumpAddr.get(-1);
        if (endTrue.opcode() == RETURN_VALUE
                || endTrue.opcode() == RAISE_VARARGS) {
            SuiteDecompiler dTrue =
                    new SuiteDecompiler(addr.get(1), endTrue.offset(1));
            dTrue.run();
            addStatement(new Stmt.If(cond, dTrue.suite, new Suite()));
            return jumpAddr;
        }

        SuiteDecompiler dTrue = new SuiteDecompiler(addr.get(1), endTrue);
        dTrue.run();
        if (jumpAddr.opcode() == POP_BLOCK) {
            addStatement(new Stmt.While(cond, dTrue.suite));
            return jumpAddr.offset(1);
        }

        Address endFalse;
        if (endTrue.opcode() == JUMP_FORWARD) {
            endFalse = endTrue.jump();
        } else if (endTrue.opcode() == JUMP_ABSOLUTE) {
            endFalse = endTrue.jump();
            if (endFalse.opcode() == FOR_ITER) {
                // The else clause is the last thing in a for loop
                endFalse = endFalse.jump().get(-1);
            } else if (Address.opcodeAt(endFalse.offset(-1)) == SETUP_LOOP) {
                // The else clause is the last thing in a while loop
                endFalse = endFalse.get(-1).jump().get(-2);
            }
        } else {
            throw new UnsupportedConstructError("if branch ends with %s",
                    endTrue.opcode());
        }

        SuiteDecompiler dFalse = new SuiteDecompiler(jumpAddr, endFalse);
        dFalse.run();
        if (dTrue.stack.isEmpty() && dFalse.stack.isEmpty()) {
            addStatement(new Stmt.If(cond, dTrue.suite, dFalse.suite));
        } else if (dTrue.stack.size() == 1 && dFalse.stack.size() == 1
                && dTrue.suite.isEmpty() && dFalse.suite.isEmpty()) {
            stack.push(new Expr.IfElse(cond, dTrue.stack.popExpr(),
                    dFalse.stack.popExpr()));
        } else {
            throw new InvariantError(
                    "branches leave %d and %d values on the stack",
                    dTrue.stack.size(), dFalse.stack.size());
        }
        return endFalse;
    }
}
