// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3.modules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import uk.co.farowl.unpyc3.CodeObject;
import uk.co.farowl.unpyc3.Py;
import uk.co.farowl.unpyc3.PyBytes;
import uk.co.farowl.unpyc3.PyComplex;
import uk.co.farowl.unpyc3.support.MalformedCodeError;

/**
 * Reading marshalled objects, from byte arrays and from streams, and
 * whole compiled modules.
 */
class marshalTest {

    /** Assemble marshal data by hand, little-endian. */
    static class Data {

        private final ByteArrayOutputStream out =
                new ByteArrayOutputStream();

        Data type(char tc) {
            out.write(tc);
            return this;
        }

        Data bytes(int... b) {
            for (int x : b) { out.write(x); }
            return this;
        }

        Data bytes(byte[] b) {
            out.write(b, 0, b.length);
            return this;
        }

        Data int32(int v) {
            return bytes(v, v >> 8, v >> 16, v >> 24);
        }

        Data int64(long v) {
            return int32((int)v).int32((int)(v >> 32));
        }

        Data integer(int v) { return type('i').int32(v); }

        Data str(String s) {
            byte[] b = s.getBytes(StandardCharsets.UTF_8);
            type('u').int32(b.length);
            out.write(b, 0, b.length);
            return this;
        }

        Data blob(int... b) {
            type('s').int32(b.length);
            return bytes(b);
        }

        Data tuple(int n) { return type('(').int32(n); }

        byte[] toByteArray() { return out.toByteArray(); }
    }

    static Data data() { return new Data(); }

    static Stream<Arguments> simpleObjects() {
        return Stream.of( //
                arguments("None", data().type('N'), Py.None), //
                arguments("True", data().type('T'), true), //
                arguments("False", data().type('F'), false), //
                arguments("Ellipsis", data().type('.'), Py.Ellipsis),
                arguments("StopIteration", data().type('S'),
                        Py.StopIteration),
                arguments("int 1", data().integer(1), 1), //
                arguments("int -1", data().integer(-1), -1), //
                arguments("int64 small", data().type('I').int64(7L), 7),
                arguments("int64 large", data().type('I').int64(1L << 40),
                        1L << 40),
                arguments("long", data().type('l').int32(3)
                        .bytes(0x01, 0x60, 0xff, 0x02, 0xe0, 0x3f),
                        17557851463681L),
                arguments("negative long", data().type('l').int32(-1)
                        .bytes(0x05, 0x00), -5),
                arguments("binary float", data().type('g')
                        .int64(Double.doubleToLongBits(1.5)), 1.5),
                arguments("text float", data().type('f').bytes(3, '0',
                        '.', '5'), 0.5),
                arguments("binary complex", data().type('y')
                        .int64(Double.doubleToLongBits(1.0))
                        .int64(Double.doubleToLongBits(-2.0)),
                        new PyComplex(1.0, -2.0)),
                arguments("str", data().str("café"), "café"),
                arguments("bytes", data().blob(0x41, 0x00),
                        new PyBytes(new byte[] {0x41, 0})));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("simpleObjects")
    void loadsSimpleObjects(String name, Data data, Object expected) {
        assertEquals(expected, marshal.loads(data.toByteArray()));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("simpleObjects")
    void loadSimpleObjects(String name, Data data, Object expected) {
        Object v = marshal.load(
                new ByteArrayInputStream(data.toByteArray()));
        assertEquals(expected, v);
    }

    @Nested
    @DisplayName("containers")
    class Containers {

        @Test
        void tuple() {
            byte[] b = data().tuple(2).integer(1).str("a").toByteArray();
            assertEquals(List.of(1, "a"), marshal.loads(b));
        }

        @Test
        void nestedTuple() {
            byte[] b = data().tuple(2).tuple(0).tuple(1).type('N')
                    .toByteArray();
            assertEquals(List.of(List.of(), List.of(Py.None)),
                    marshal.loads(b));
        }

        @Test
        void frozenset() {
            byte[] b = data().type('>').int32(2).integer(3).integer(4)
                    .toByteArray();
            assertEquals(Set.of(3, 4), marshal.loads(b));
        }

        @Test
        void dict() {
            byte[] b = data().type('{').str("k").integer(1).integer(2)
                    .type('N').type('0').toByteArray();
            assertEquals(Map.of("k", 1, 2, Py.None), marshal.loads(b));
        }
    }

    @Nested
    @DisplayName("rejects")
    class Rejects {

        @Test
        void unknownType() {
            MalformedCodeError e = assertThrows(MalformedCodeError.class,
                    () -> marshal.loads(new byte[] {'?'}));
            assertTrue(e.getMessage().startsWith("bad marshal data"));
        }

        @Test
        void shortData() {
            byte[] b = data().type('i').bytes(1, 0).toByteArray();
            MalformedCodeError e = assertThrows(MalformedCodeError.class,
                    () -> marshal.loads(b));
            assertEquals("marshal data too short", e.getMessage());
            assertThrows(MalformedCodeError.class,
                    () -> marshal.load(new ByteArrayInputStream(b)));
        }

        @Test
        void shortString() {
            byte[] b = data().type('u').int32(10).bytes('a')
                    .toByteArray();
            assertThrows(MalformedCodeError.class, () -> marshal.loads(b));
            assertThrows(MalformedCodeError.class,
                    () -> marshal.load(new ByteArrayInputStream(b)));
        }

        @Test
        void negativeSize() {
            byte[] b = data().tuple(-1).toByteArray();
            assertThrows(MalformedCodeError.class, () -> marshal.loads(b));
        }

        @Test
        void bigIntDigitOutOfRange() {
            byte[] b = data().type('l').int32(1).bytes(0x00, 0x80)
                    .toByteArray();
            assertThrows(MalformedCodeError.class, () -> marshal.loads(b));
        }

        @Test
        void nullObject() {
            assertThrows(MalformedCodeError.class,
                    () -> marshal.loads(new byte[] {'0'}));
        }
    }

    /**
     * The marshalled code object of a module {@code x = 1}.
     *
     * @return marshal data
     */
    static Data moduleCode() {
        return data().type('c').int32(0).int32(0).int32(0).int32(1)
                .int32(CodeObject.CO_NOFREE)
                // LOAD_CONST 0, STORE_NAME 0, LOAD_CONST 1, RETURN_VALUE
                .blob(100, 0, 0, 90, 0, 0, 100, 1, 0, 83)
                .tuple(2).integer(1).type('N') // consts
                .tuple(1).str("x") // names
                .tuple(0).tuple(0).tuple(0) // varnames, free, cell
                .str("m.py").str("<module>").int32(1).blob();
    }

    @Nested
    @DisplayName("code")
    class Code {

        @Test
        void fields() {
            Object o = marshal.loads(moduleCode().toByteArray());
            CodeObject code = assertInstanceOf(CodeObject.class, o);
            assertEquals("<module>", code.name);
            assertEquals("m.py", code.filename);
            assertEquals(List.of(1, Py.None), code.consts);
            assertEquals(List.of("x"), code.names);
            assertEquals(10, code.code.size());
            assertTrue(code.has(CodeObject.CO_NOFREE));
        }

        @Test
        void pyc() {
            byte[] b = data().bytes(0x6c, 0x0c, 0x0d, 0x0a).int32(0)
                    .bytes(moduleCode().toByteArray()).toByteArray();
            CodeObject code = marshal.readPyc(new ByteArrayInputStream(b));
            assertEquals(1, code.firstlineno);
        }

        @Test
        void pycOfAnotherVersion() {
            // The magic number of CPython 3.3 draws only a warning
            byte[] b = data().bytes(0x9e, 0x0c, 0x0d, 0x0a).int32(0)
                    .bytes(moduleCode().toByteArray()).toByteArray();
            CodeObject code = marshal.readPyc(new ByteArrayInputStream(b));
            assertEquals("<module>", code.name);
        }

        @Test
        void pycWithoutCode() {
            byte[] b = data().bytes(0x6c, 0x0c, 0x0d, 0x0a).int32(0)
                    .type('N').toByteArray();
            assertThrows(MalformedCodeError.class,
                    () -> marshal.readPyc(new ByteArrayInputStream(b)));
        }

        @Test
        void badField() {
            byte[] b = data().type('c').int32(0).int32(0).int32(0)
                    .int32(1).int32(0).type('N').toByteArray();
            MalformedCodeError e = assertThrows(MalformedCodeError.class,
                    () -> marshal.loads(b));
            assertTrue(e.getMessage().contains("code"));
        }
    }

    @Test
    void normalise() {
        assertEquals(5, marshal.normalise(BigInteger.valueOf(5)));
        assertEquals(1L << 40,
                marshal.normalise(BigInteger.valueOf(1L << 40)));
        BigInteger big = BigInteger.ONE.shiftLeft(70);
        assertEquals(big, marshal.normalise(big));
    }
}
