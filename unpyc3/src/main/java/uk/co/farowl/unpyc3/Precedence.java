// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

/**
 * Binding strength of expressions, from loosest to tightest, following
 * the Python grammar. Only the order of the values matters.
 */
public enum Precedence {
    /** A bare tuple {@code a, b}. */
    TUPLE(0),
    /** {@code lambda}, a slice or a key-value pair. */
    LAMBDA(1),
    /** Conditional expression {@code a if c else b}. */
    TERNARY(2),
    /** Boolean {@code or}. */
    OR(3),
    /** Boolean {@code and}. */
    AND(4),
    /** Boolean {@code not}. */
    NOT(5),
    /** Comparisons, including {@code in} and {@code is}. */
    COMPARE(6),
    /** Bitwise {@code |}. */
    BIT_OR(7),
    /** Bitwise {@code ^}. */
    BIT_XOR(8),
    /** Bitwise {@code &}. */
    BIT_AND(9),
    /** Shifts {@code <<} and {@code >>}. */
    SHIFT(10),
    /** Addition and subtraction. */
    ARITH(11),
    /** Multiplication, division and remainder. */
    TERM(12),
    /** Unary {@code + - ~}. */
    UNARY(13),
    /** Exponentiation. */
    POWER(14),
    /** Subscript, attribute reference, call and starred. */
    TRAILER(15),
    /** List, set and dict displays and comprehensions. */
    DISPLAY(16),
    /** Names and constants. */
    ATOM(100);

    /** Numeric binding strength. */
    public final int value;

    Precedence(int value) { this.value = value; }

    /**
     * Whether this binds less tightly than another.
     *
     * @param other to compare
     * @return {@code this < other}
     */
    public boolean below(Precedence other) { return value < other.value; }

    /**
     * Whether this binds no more tightly than another.
     *
     * @param other to compare
     * @return {@code this <= other}
     */
    public boolean atMost(Precedence other) {
        return value <= other.value;
    }
}
