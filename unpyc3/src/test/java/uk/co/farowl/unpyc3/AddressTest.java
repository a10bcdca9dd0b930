// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static uk.co.farowl.unpyc3.Opcode.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import uk.co.farowl.unpyc3.support.InvariantError;
import uk.co.farowl.unpyc3.support.MalformedCodeError;

/** Navigation by instruction and by byte position within a unit. */
class AddressTest {

    /*
     *  0 LOAD_NAME a
     *  3 POP_JUMP_IF_FALSE 15
     *  6 LOAD_CONST 1
     *  9 STORE_NAME b
     * 12 JUMP_FORWARD 0 (to 15)
     * 15 LOAD_CONST None
     * 18 RETURN_VALUE
     */
    CompiledUnit unit;

    @BeforeEach
    void assemble() {
        unit = new CompiledUnit(CodeBuilder.module().loadName("a")
                .jump(POP_JUMP_IF_FALSE, "end").loadConst(1)
                .storeName("b").jump(JUMP_FORWARD, "end").label("end")
                .returnNone().build());
    }

    @Test
    void byIndexAndPosition() {
        assertEquals(7, unit.size());
        assertEquals(unit.at(2), unit.address(6));
        assertEquals(LOAD_CONST, unit.at(2).opcode());
        assertEquals(9, unit.first().get(3).position());
        assertEquals(unit.address(9), unit.address(3).plus(6));
    }

    @Test
    void relativeAndAbsoluteJumps() {
        assertEquals(unit.address(15), unit.address(3).jump());
        assertEquals(unit.address(15), unit.address(12).jump());
        assertThrows(InvariantError.class, () -> unit.address(6).jump());
    }

    @Test
    void outsideTheUnit() {
        Address last = unit.address(18);
        assertNull(last.offset(1));
        assertNull(unit.first().offset(-1));
        assertThrows(MalformedCodeError.class, () -> last.get(1));
        assertThrows(MalformedCodeError.class, () -> unit.address(4));
        assertThrows(MalformedCodeError.class, () -> unit.at(7));
    }

    @Test
    void ordering() {
        Address a = unit.address(3), b = unit.address(9);
        assertTrue(a.isBefore(b));
        assertFalse(b.isBefore(a));
        assertFalse(a.isBefore(a));
        assertTrue(a.isBefore(null));
        assertTrue(Address.atOrBefore(a, a));
        assertTrue(Address.atOrBefore(a, null));
        assertFalse(Address.atOrBefore(null, a));
        assertTrue(Address.atOrBefore(null, null));
    }

    @Test
    void differentUnits() {
        CompiledUnit other = new CompiledUnit(
                CodeBuilder.module().returnNone().build());
        assertNotEquals(unit.first(), other.first());
        assertThrows(InvariantError.class,
                () -> unit.first().isBefore(other.first()));
    }

    @Test
    void opcodeAtEnd() {
        assertNull(Address.opcodeAt(null));
        assertEquals(RETURN_VALUE, Address.opcodeAt(unit.address(18)));
    }
}
