// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

import java.util.ArrayList;
import java.util.List;

import uk.co.farowl.unpyc3.support.MalformedCodeError;

/**
 * One decoded instruction: its position in the byte code, its opcode
 * and its argument. The argument is zero for an opcode that takes none.
 *
 * @param position of the opcode byte in the byte code
 * @param opcode of the instruction
 * @param arg argument (including any {@code EXTENDED_ARG} prefix)
 */
public record Instruction(int position, Opcode opcode, int arg) {

    /** @return position of the instruction that follows this one. */
    public int next() { return position + opcode.size(); }

    /**
     * The same instruction with a different opcode and no argument. This
     * is how we neutralise an instruction by making it a {@code NOP}.
     *
     * @param op replacement opcode
     * @return replacement instruction
     */
    Instruction replaceOpcode(Opcode op) {
        return new Instruction(position, op, 0);
    }

    @Override
    public String toString() {
        if (opcode.hasArgument()) {
            return String.format("%d %s %d", position, opcode, arg);
        } else {
            return String.format("%d %s", position, opcode);
        }
    }

    /**
     * Decode an array of byte code into a list of instructions. The
     * argument of an {@code EXTENDED_ARG} contributes the high 16 bits
     * to the argument of the instruction that follows it. The
     * {@code EXTENDED_ARG} itself remains in the sequence, so that every
     * position is accounted for.
     *
     * @param code the byte code
     * @return the instructions in order
     * @throws MalformedCodeError on an unknown opcode, a truncated
     *     argument or an extended argument out of range
     */
    public static List<Instruction> decode(byte[] code)
            throws MalformedCodeError {
        List<Instruction> seq = new ArrayList<>();
        int i = 0, extended = 0;
        while (i < code.length) {
            Opcode op = Opcode.of(code[i] & 0xff);
            if (op.hasArgument()) {
                if (i + 2 >= code.length) {
                    throw new MalformedCodeError(
                            "argument of %s at %d is truncated", op, i);
                }
                int arg = (code[i + 1] & 0xff) | (code[i + 2] & 0xff) << 8;
                if (op == Opcode.EXTENDED_ARG) {
                    if (arg > 0x7fff) {
                        // The folded argument would not be a positive int
                        throw new MalformedCodeError(
                                "%s %d at %d is too large", op, arg, i);
                    }
                    seq.add(new Instruction(i, op, arg));
                    extended = arg << 16;
                } else {
                    seq.add(new Instruction(i, op, arg | extended));
                    extended = 0;
                }
            } else {
                seq.add(new Instruction(i, op, 0));
                extended = 0;
            }
            i += op.size();
        }
        return seq;
    }
}
