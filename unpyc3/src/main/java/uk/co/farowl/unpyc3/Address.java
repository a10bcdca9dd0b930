// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

import java.util.Objects;

import uk.co.farowl.unpyc3.support.InvariantError;
import uk.co.farowl.unpyc3.support.MalformedCodeError;

/**
 * A cursor on one instruction of a {@link CompiledUnit}, identified by
 * its index in the decoded sequence (not its byte position). Addresses
 * are values: two addresses are equal when they designate the same
 * instruction of the same unit.
 * <p>
 * Where an address may legitimately fall off the end of the unit, we
 * use {@code null}, and in comparisons {@code null} means "the end of
 * the unit", after every instruction.
 */
public final class Address {

    private final CompiledUnit unit;
    private final int index;

    /**
     * Create an address. The caller guarantees {@code index} is in range.
     *
     * @param unit in which the address lies
     * @param index of the instruction in the unit
     */
    Address(CompiledUnit unit, int index) {
        this.unit = unit;
        this.index = index;
    }

    /** @return the unit in which this address lies */
    public CompiledUnit unit() { return unit; }

    /** @return index of the instruction in the unit */
    public int index() { return index; }

    /** @return the instruction at this address */
    public Instruction instruction() { return unit.instruction(index); }

    /** @return the opcode at this address */
    public Opcode opcode() { return instruction().opcode(); }

    /** @return the argument at this address */
    public int arg() { return instruction().arg(); }

    /** @return the byte position of this address */
    public int position() { return instruction().position(); }

    /**
     * The address {@code k} instructions from this one (written
     * {@code addr[k]} in discussion).
     *
     * @param k number of instructions to move (may be negative)
     * @return the address
     * @throws MalformedCodeError if the result is not an instruction
     */
    public Address get(int k) throws MalformedCodeError {
        Address a = offset(k);
        if (a == null) {
            throw new MalformedCodeError(
                    "no instruction at offset %d from %d in %s", k,
                    position(), unit.name());
        }
        return a;
    }

    /**
     * The address {@code k} instructions from this one, or {@code null}
     * if that lies outside the unit.
     *
     * @param k number of instructions to move (may be negative)
     * @return the address or {@code null}
     */
    public Address offset(int k) {
        int i = index + k;
        return i >= 0 && i < unit.size() ? new Address(unit, i) : null;
    }

    /**
     * The address {@code delta} bytes from the position of this one.
     *
     * @param delta byte offset
     * @return the address at that position
     * @throws MalformedCodeError if no instruction starts there
     */
    public Address plus(int delta) throws MalformedCodeError {
        return unit.address(position() + delta);
    }

    /**
     * The target of the jump at this address. A relative target is an
     * offset from the position of the following instruction, and an
     * absolute one is a position.
     *
     * @return the target address
     * @throws MalformedCodeError if no instruction starts at the target
     */
    public Address jump() throws MalformedCodeError {
        Instruction instr = instruction();
        return switch (instr.opcode().jump) {
            case RELATIVE -> unit.address(instr.next() + instr.arg());
            case ABSOLUTE -> unit.address(instr.arg());
            case NONE -> throw new InvariantError("%s is not a jump",
                    instr);
        };
    }

    /**
     * Whether this address precedes {@code end}, where {@code null}
     * means the end of the unit.
     *
     * @param end to compare with (or {@code null})
     * @return {@code this < end}
     */
    public boolean isBefore(Address end) {
        if (end == null) {
            return true;
        } else if (end.unit != unit) {
            throw new InvariantError("comparing addresses in %s and %s",
                    unit.name(), end.unit.name());
        }
        return index < end.index;
    }

    /**
     * Whether address {@code a} is at or before address {@code b},
     * where {@code null} means the end of the unit (in either place).
     *
     * @param a to compare (or {@code null})
     * @param b to compare (or {@code null})
     * @return {@code a <= b}
     */
    static boolean atOrBefore(Address a, Address b) {
        if (a == null) {
            return b == null;
        } else {
            return b == null || !b.isBefore(a);
        }
    }

    /**
     * The opcode at a possibly {@code null} address.
     *
     * @param a address or {@code null}
     * @return opcode at {@code a} or {@code null}
     */
    static Opcode opcodeAt(Address a) {
        return a == null ? null : a.opcode();
    }

    /** @return whether this is a jump to an else clause */
    public boolean isElseJump() { return unit.isElseJump(this); }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Address a && a.unit == unit
                && a.index == index;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(unit), index);
    }

    @Override
    public String toString() {
        String mark = isElseJump() ? "*" : " ";
        return mark + " " + instruction();
    }
}
