// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import uk.co.farowl.unpyc3.support.MalformedCodeError;

/** Opcodes and the decoding of byte code into instructions. */
class InstructionTest {

    @Nested
    @DisplayName("Opcode")
    class Opcodes {

        @ParameterizedTest(name = "{0}")
        @EnumSource(Opcode.class)
        void lookUpByCode(Opcode op) {
            assertSame(op, Opcode.of(op.code));
            assertEquals(op.hasArgument() ? 3 : 1, op.size());
        }

        @Test
        void knownValues() {
            assertSame(Opcode.LOAD_CONST, Opcode.of(100));
            assertSame(Opcode.RETURN_VALUE, Opcode.of(83));
            assertTrue(Opcode.LOAD_CONST.hasArgument());
            assertFalse(Opcode.POP_TOP.hasArgument());
        }

        @Test
        void jumpKinds() {
            assertEquals(Opcode.Jump.RELATIVE, Opcode.JUMP_FORWARD.jump);
            assertEquals(Opcode.Jump.RELATIVE, Opcode.FOR_ITER.jump);
            assertEquals(Opcode.Jump.ABSOLUTE, Opcode.JUMP_ABSOLUTE.jump);
            assertEquals(Opcode.Jump.ABSOLUTE,
                    Opcode.POP_JUMP_IF_FALSE.jump);
            assertFalse(Opcode.LOAD_NAME.isJump());
        }

        @Test
        void unknownCodes() {
            assertThrows(MalformedCodeError.class, () -> Opcode.of(6));
            assertThrows(MalformedCodeError.class, () -> Opcode.of(-1));
            assertThrows(MalformedCodeError.class, () -> Opcode.of(256));
        }
    }

    @Nested
    @DisplayName("decode")
    class Decode {

        @Test
        void positionsAndArguments() {
            byte[] code = {100, 1, 0, 90, 0, 1, 83};
            List<Instruction> seq = Instruction.decode(code);
            assertEquals(List.of(
                    new Instruction(0, Opcode.LOAD_CONST, 1),
                    new Instruction(3, Opcode.STORE_NAME, 256),
                    new Instruction(6, Opcode.RETURN_VALUE, 0)), seq);
            assertEquals(6, seq.get(1).next());
        }

        @Test
        void extendedArgument() {
            byte[] code = {(byte)144, 3, 0, (byte)132, 2, 0};
            List<Instruction> seq = Instruction.decode(code);
            assertEquals(2, seq.size());
            assertEquals(Opcode.EXTENDED_ARG, seq.get(0).opcode());
            assertEquals((3 << 16) | 2, seq.get(1).arg());
        }

        @Test
        void largestExtendedArgument() {
            byte[] code = {(byte)144, -1, 0x7f, (byte)132, -1, -1};
            List<Instruction> seq = Instruction.decode(code);
            assertEquals(Integer.MAX_VALUE, seq.get(1).arg());
        }

        @Test
        void extendedArgumentOutOfRange() {
            // 0x8000 << 16 would make the argument negative
            byte[] code = {(byte)144, 0, (byte)0x80, (byte)132, 2, 0};
            assertThrows(MalformedCodeError.class,
                    () -> Instruction.decode(code));
        }

        @Test
        void truncatedArgument() {
            byte[] code = {100, 1};
            assertThrows(MalformedCodeError.class,
                    () -> Instruction.decode(code));
        }

        @Test
        void unknownOpcode() {
            byte[] code = {9, 7};
            assertThrows(MalformedCodeError.class,
                    () -> Instruction.decode(code));
        }

        @Test
        void text() {
            assertEquals("3 STORE_NAME 0",
                    new Instruction(3, Opcode.STORE_NAME, 0).toString());
            assertEquals("6 RETURN_VALUE",
                    new Instruction(6, Opcode.RETURN_VALUE, 0).toString());
        }
    }
}
