// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

/**
 * Binary operators, as they are written in source, their precedence and
 * (where they have one) the form of the augmented assignment.
 */
public enum Operator {

    POWER("%s**%s", Precedence.POWER, "%s **= %s"),
    MULTIPLY("%s*%s", Precedence.TERM, "%s *= %s"),
    FLOOR_DIVIDE("%s//%s", Precedence.TERM, "%s //= %s"),
    TRUE_DIVIDE("%s/%s", Precedence.TERM, "%s /= %s"),
    MODULO("%s %% %s", Precedence.TERM, "%s %%= %s"),
    ADD("%s + %s", Precedence.ARITH, "%s += %s"),
    SUBTRACT("%s - %s", Precedence.ARITH, "%s -= %s"),
    SUBSCRIPT("%s[%s]", Precedence.TRAILER, null),
    LSHIFT("%s << %s", Precedence.SHIFT, "%s <<= %s"),
    RSHIFT("%s >> %s", Precedence.SHIFT, "%s >>= %s"),
    AND("%s & %s", Precedence.BIT_AND, "%s &= %s"),
    XOR("%s ^ %s", Precedence.BIT_XOR, "%s ^= %s"),
    OR("%s | %s", Precedence.BIT_OR, "%s |= %s"),
    BOOL_AND("%s and %s", Precedence.AND, null),
    BOOL_OR("%s or %s", Precedence.OR, null),
    /** Only found as the element of a dict comprehension. */
    KEY_VALUE("%s: %s", Precedence.LAMBDA, null);

    /** Format of the expression with operands as {@code %s}. */
    final String pattern;
    /** Binding strength. */
    final Precedence precedence;
    /** Format of the augmented assignment or {@code null}. */
    final String inPlacePattern;

    Operator(String pattern, Precedence precedence,
            String inPlacePattern) {
        this.pattern = pattern;
        this.precedence = precedence;
        this.inPlacePattern = inPlacePattern;
    }

    /**
     * The operator of a {@code BINARY_*} opcode.
     *
     * @param op the opcode
     * @return the operator
     */
    static Operator binary(Opcode op) {
        return switch (op) {
            case BINARY_POWER -> POWER;
            case BINARY_MULTIPLY -> MULTIPLY;
            case BINARY_FLOOR_DIVIDE -> FLOOR_DIVIDE;
            case BINARY_TRUE_DIVIDE -> TRUE_DIVIDE;
            case BINARY_MODULO -> MODULO;
            case BINARY_ADD -> ADD;
            case BINARY_SUBTRACT -> SUBTRACT;
            case BINARY_SUBSCR -> SUBSCRIPT;
            case BINARY_LSHIFT -> LSHIFT;
            case BINARY_RSHIFT -> RSHIFT;
            case BINARY_AND -> AND;
            case BINARY_XOR -> XOR;
            case BINARY_OR -> OR;
            default -> throw new IllegalArgumentException(op.name());
        };
    }

    /**
     * The operator of an {@code INPLACE_*} opcode.
     *
     * @param op the opcode
     * @return the operator
     */
    static Operator inPlace(Opcode op) {
        return switch (op) {
            case INPLACE_POWER -> POWER;
            case INPLACE_MULTIPLY -> MULTIPLY;
            case INPLACE_FLOOR_DIVIDE -> FLOOR_DIVIDE;
            case INPLACE_TRUE_DIVIDE -> TRUE_DIVIDE;
            case INPLACE_MODULO -> MODULO;
            case INPLACE_ADD -> ADD;
            case INPLACE_SUBTRACT -> SUBTRACT;
            case INPLACE_LSHIFT -> LSHIFT;
            case INPLACE_RSHIFT -> RSHIFT;
            case INPLACE_AND -> AND;
            case INPLACE_XOR -> XOR;
            case INPLACE_OR -> OR;
            default -> throw new IllegalArgumentException(op.name());
        };
    }
}
