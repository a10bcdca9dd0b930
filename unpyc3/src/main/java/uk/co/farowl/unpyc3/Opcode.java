// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

import uk.co.farowl.unpyc3.support.MalformedCodeError;

/**
 * The instruction set of the CPython 3.2 virtual machine. Opcodes with
 * a numeric value of at least {@link #HAVE_ARGUMENT} are followed in
 * the byte stream by a 16-bit little-endian argument.
 */
public enum Opcode {

    STOP_CODE(0),
    POP_TOP(1),
    ROT_TWO(2),
    ROT_THREE(3),
    DUP_TOP(4),
    DUP_TOP_TWO(5),
    NOP(9),
    UNARY_POSITIVE(10),
    UNARY_NEGATIVE(11),
    UNARY_NOT(12),
    UNARY_INVERT(15),
    BINARY_POWER(19),
    BINARY_MULTIPLY(20),
    BINARY_MODULO(22),
    BINARY_ADD(23),
    BINARY_SUBTRACT(24),
    BINARY_SUBSCR(25),
    BINARY_FLOOR_DIVIDE(26),
    BINARY_TRUE_DIVIDE(27),
    INPLACE_FLOOR_DIVIDE(28),
    INPLACE_TRUE_DIVIDE(29),
    STORE_MAP(54),
    INPLACE_ADD(55),
    INPLACE_SUBTRACT(56),
    INPLACE_MULTIPLY(57),
    INPLACE_MODULO(59),
    STORE_SUBSCR(60),
    DELETE_SUBSCR(61),
    BINARY_LSHIFT(62),
    BINARY_RSHIFT(63),
    BINARY_AND(64),
    BINARY_XOR(65),
    BINARY_OR(66),
    INPLACE_POWER(67),
    GET_ITER(68),
    STORE_LOCALS(69),
    PRINT_EXPR(70),
    LOAD_BUILD_CLASS(71),
    INPLACE_LSHIFT(75),
    INPLACE_RSHIFT(76),
    INPLACE_AND(77),
    INPLACE_XOR(78),
    INPLACE_OR(79),
    BREAK_LOOP(80),
    WITH_CLEANUP(81),
    RETURN_VALUE(83),
    IMPORT_STAR(84),
    YIELD_VALUE(86),
    POP_BLOCK(87),
    END_FINALLY(88),
    POP_EXCEPT(89),
    STORE_NAME(90),
    DELETE_NAME(91),
    UNPACK_SEQUENCE(92),
    FOR_ITER(93, Jump.RELATIVE),
    UNPACK_EX(94),
    STORE_ATTR(95),
    DELETE_ATTR(96),
    STORE_GLOBAL(97),
    DELETE_GLOBAL(98),
    LOAD_CONST(100),
    LOAD_NAME(101),
    BUILD_TUPLE(102),
    BUILD_LIST(103),
    BUILD_SET(104),
    BUILD_MAP(105),
    LOAD_ATTR(106),
    COMPARE_OP(107),
    IMPORT_NAME(108),
    IMPORT_FROM(109),
    JUMP_FORWARD(110, Jump.RELATIVE),
    JUMP_IF_FALSE_OR_POP(111, Jump.ABSOLUTE),
    JUMP_IF_TRUE_OR_POP(112, Jump.ABSOLUTE),
    JUMP_ABSOLUTE(113, Jump.ABSOLUTE),
    POP_JUMP_IF_FALSE(114, Jump.ABSOLUTE),
    POP_JUMP_IF_TRUE(115, Jump.ABSOLUTE),
    LOAD_GLOBAL(116),
    CONTINUE_LOOP(119, Jump.ABSOLUTE),
    SETUP_LOOP(120, Jump.RELATIVE),
    SETUP_EXCEPT(121, Jump.RELATIVE),
    SETUP_FINALLY(122, Jump.RELATIVE),
    LOAD_FAST(124),
    STORE_FAST(125),
    DELETE_FAST(126),
    RAISE_VARARGS(130),
    CALL_FUNCTION(131),
    MAKE_FUNCTION(132),
    BUILD_SLICE(133),
    MAKE_CLOSURE(134),
    LOAD_CLOSURE(135),
    LOAD_DEREF(136),
    STORE_DEREF(137),
    DELETE_DEREF(138),
    CALL_FUNCTION_VAR(140),
    CALL_FUNCTION_KW(141),
    CALL_FUNCTION_VAR_KW(142),
    SETUP_WITH(143, Jump.RELATIVE),
    EXTENDED_ARG(144),
    LIST_APPEND(145),
    SET_ADD(146),
    MAP_ADD(147);

    /** Opcodes at or above this value take an argument. */
    public static final int HAVE_ARGUMENT = 90;

    /** The arguments of {@link #COMPARE_OP}, indexed by argument. */
    public static final String[] CMP_OP = {"<", "<=", "==", "!=", ">",
            ">=", "in", "not in", "is", "is not", "exception match",
            "BAD"};

    /** Argument of {@link #COMPARE_OP} for an exception match. */
    public static final int EXC_MATCH = 10;

    /** How the argument of an opcode designates a jump target. */
    public enum Jump {
        /** The opcode does not jump. */
        NONE,
        /** Target is an offset from the next instruction. */
        RELATIVE,
        /** Target is a position in the byte code. */
        ABSOLUTE
    }

    /** Numeric value in the byte code. */
    public final int code;

    /** How this opcode designates a target (if at all). */
    public final Jump jump;

    /** Look-up from numeric value to opcode. */
    private static final Opcode[] fromCode = new Opcode[256];
    static {
        for (Opcode op : values()) { fromCode[op.code] = op; }
    }

    Opcode(int code) { this(code, Jump.NONE); }

    Opcode(int code, Jump jump) {
        this.code = code;
        this.jump = jump;
    }

    /** @return whether an argument follows this opcode */
    public boolean hasArgument() { return code >= HAVE_ARGUMENT; }

    /** @return number of bytes occupied by the instruction */
    public int size() { return hasArgument() ? 3 : 1; }

    /** @return whether this opcode designates a jump target */
    public boolean isJump() { return jump != Jump.NONE; }

    /**
     * Find the opcode with a given numeric value.
     *
     * @param code numeric value from the byte code
     * @return the opcode
     * @throws MalformedCodeError if no opcode has that value
     */
    public static Opcode of(int code) throws MalformedCodeError {
        Opcode op = code >= 0 && code < 256 ? fromCode[code] : null;
        if (op == null) {
            throw new MalformedCodeError("unknown opcode %d", code);
        }
        return op;
    }
}
