// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3.modules;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.unpyc3.CodeObject;
import uk.co.farowl.unpyc3.Py;
import uk.co.farowl.unpyc3.PyBytes;
import uk.co.farowl.unpyc3.PyComplex;
import uk.co.farowl.unpyc3.support.MalformedCodeError;

/**
 * Read Python objects in the marshal format of CPython 3.2, and compiled
 * modules ({@code .pyc} files) that contain them. Objects are returned
 * in the Java representation used by {@link CodeObject} for constants.
 * <p>
 * Only reading is supported, and only the type codes CPython 3.2 writes
 * (or accepts): there are no back-references in this version of the
 * format.
 */
public class marshal {

    private static final Logger logger =
            LoggerFactory.getLogger(marshal.class);

    private marshal() {} // no instances

    /** The magic number of CPython 3.2 (3180) and {@code \r\n}. */
    static final byte[] MAGIC = {0x6c, 0x0c, 0x0d, 0x0a};

    /*
     * High water mark to determine when the marshalled object is
     * dangerously deep. When the nesting gets this deep, we give up
     * rather than exhaust the Java stack.
     */
    private final static int MAX_MARSHAL_STACK_DEPTH = 2000;

    /*
     * Enumerate the record types of version 2 of the format. Each
     * corresponds to a type of data, or a specific value, except
     * {@code NULL}, which ends a dict.
     */
    private final static int TYPE_NULL = '0';
    private final static int TYPE_NONE = 'N';
    private final static int TYPE_FALSE = 'F';
    private final static int TYPE_TRUE = 'T';
    private final static int TYPE_STOPITER = 'S';
    private final static int TYPE_ELLIPSIS = '.';
    private final static int TYPE_INT = 'i';
    private final static int TYPE_INT64 = 'I';
    private final static int TYPE_FLOAT = 'f';
    private final static int TYPE_BINARY_FLOAT = 'g';
    private final static int TYPE_COMPLEX = 'x';
    private final static int TYPE_BINARY_COMPLEX = 'y';
    private final static int TYPE_LONG = 'l';
    private final static int TYPE_STRING = 's';
    private final static int TYPE_INTERNED = 't';
    private final static int TYPE_UNICODE = 'u';
    private final static int TYPE_TUPLE = '(';
    private final static int TYPE_LIST = '[';
    private final static int TYPE_DICT = '{';
    private final static int TYPE_SET = '<';
    private final static int TYPE_FROZENSET = '>';
    private final static int TYPE_CODE = 'c';

    /** A mask for the low 15 bits. */
    private final static int MASK15 = 0x7fff;

    /**
     * We apply a particular {@code Decoder} to the input after we read a
     * type code byte that tells us which one to use, to decode the data
     * following. If that code has no data following, then the
     * corresponding {@link Decoder#read(Reader)} returns a constant.
     */
    @FunctionalInterface
    private interface Decoder {
        /**
         * Read an object value from the input managed by a given
         * {@link Reader}, the matching type code having been read from
         * it already.
         *
         * @param r from which to read
         * @return the object value read
         */
        Object read(Reader r);
    }

    /**
     * A mapping from the type code to the {@link Decoder} able to
     * render the record as a Java object.
     */
    private static final Map<Integer, Decoder> decoderForCode =
            new HashMap<>();

    static {
        Map<Integer, Decoder> m = decoderForCode;
        m.put(TYPE_NONE, r -> Py.None);
        m.put(TYPE_FALSE, r -> Boolean.FALSE);
        m.put(TYPE_TRUE, r -> Boolean.TRUE);
        m.put(TYPE_STOPITER, r -> Py.StopIteration);
        m.put(TYPE_ELLIPSIS, r -> Py.Ellipsis);
        m.put(TYPE_INT, r -> r.readInt());
        m.put(TYPE_INT64, r -> normalise(BigInteger.valueOf(r.readLong())));
        m.put(TYPE_LONG, r -> normalise(r.readBigInteger()));
        m.put(TYPE_FLOAT, r -> r.readFloatText());
        m.put(TYPE_BINARY_FLOAT,
                r -> Double.longBitsToDouble(r.readLong()));
        m.put(TYPE_COMPLEX,
                r -> new PyComplex(r.readFloatText(), r.readFloatText()));
        m.put(TYPE_BINARY_COMPLEX,
                r -> new PyComplex(Double.longBitsToDouble(r.readLong()),
                        Double.longBitsToDouble(r.readLong())));
        m.put(TYPE_STRING, r -> new PyBytes(r.readBytes(r.readSize())));
        m.put(TYPE_UNICODE, r -> r.readUnicode());
        m.put(TYPE_INTERNED, r -> r.readUnicode());
        m.put(TYPE_TUPLE, r -> Collections.unmodifiableList(r.readItems()));
        m.put(TYPE_LIST, r -> r.readItems());
        m.put(TYPE_SET, r -> Collections.unmodifiableSet(
                new LinkedHashSet<>(r.readItems())));
        m.put(TYPE_FROZENSET, r -> Collections.unmodifiableSet(
                new LinkedHashSet<>(r.readItems())));
        m.put(TYPE_DICT, r -> r.readDict());
        m.put(TYPE_CODE, r -> r.readCode());
    }

    /**
     * Return an integer value as the narrowest of {@code Integer},
     * {@code Long} and {@code BigInteger} that holds it.
     *
     * @param v value
     * @return normalised value
     */
    static Object normalise(BigInteger v) {
        if (v.bitLength() < 32) {
            return v.intValue();
        } else if (v.bitLength() < 64) {
            return v.longValue();
        } else {
            return v;
        }
    }

    /**
     * {@code marshal.loads(bytes)}: read one object from a byte array.
     * Bytes after the object are ignored.
     *
     * @param bytes containing the object
     * @return the object read
     * @throws MalformedCodeError if the data are not a valid object
     */
    public static Object loads(byte[] bytes) throws MalformedCodeError {
        return new BytesReader(bytes).load();
    }

    /**
     * {@code marshal.load(file)}: read one object from a stream.
     *
     * @param file from which to read
     * @return the object read
     * @throws MalformedCodeError if the data are not a valid object
     * @throws UncheckedIOException on a read error
     */
    public static Object load(InputStream file)
            throws MalformedCodeError, UncheckedIOException {
        return new StreamReader(file).load();
    }

    /**
     * Read a compiled module ({@code .pyc} file) from a stream. The file
     * has a 4-byte magic number and a 4-byte modification time, then the
     * marshalled code object of the module. A magic number that is not
     * the one for CPython 3.2 draws a warning, but we try anyway.
     *
     * @param file from which to read
     * @return the code object of the module
     * @throws MalformedCodeError if the data are not a code object
     * @throws UncheckedIOException on a read error
     */
    public static CodeObject readPyc(InputStream file)
            throws MalformedCodeError, UncheckedIOException {
        StreamReader r = new StreamReader(file);
        byte[] magic = r.readBytes(MAGIC.length);
        if (!Arrays.equals(magic, MAGIC)) {
            logger.atWarn()
                    .setMessage("magic number {} is not CPython 3.2")
                    .addArgument(() -> hex(magic)).log();
        }
        int mtime = r.readInt();
        logger.atDebug().setMessage("module compiled at {}")
                .addArgument(() -> Integer.toUnsignedLong(mtime)).log();
        Object o = r.load();
        if (o instanceof CodeObject code) {
            return code;
        } else {
            throw Reader.badData("not a code object");
        }
    }

    private static String hex(byte[] b) {
        StringBuilder sb = new StringBuilder();
        for (byte x : b) { sb.append(String.format("%02x", x & 0xff)); }
        return sb.toString();
    }

    /**
     * A source of marshalled data. Concrete readers supply the primitive
     * reads and this class composes them into objects.
     */
    abstract static class Reader {

        /** Nesting depth of the object being read. */
        private int depth = 0;

        /**
         * Decode a complete object from the source.
         *
         * @return the object read
         */
        // Compare CPython r_object in marshal.c
        Object load() {
            if (++depth > MAX_MARSHAL_STACK_DEPTH) {
                throw badData("recursion limit exceeded");
            }
            try {
                int tc = readByte();
                Decoder d = decoderForCode.get(tc);
                if (d == null) {
                    throw badData(tc == TYPE_NULL ? "NULL object"
                            : String.format("unknown type code 0x%02x", tc));
                }
                return d.read(this);
            } finally {
                --depth;
            }
        }

        /**
         * Read one {@code byte} from the source (as an unsigned
         * integer), advancing the stream one byte.
         *
         * @return byte read unsigned
         */
        abstract int readByte();

        /**
         * Read one {@code short} value from the source, advancing the
         * stream 2 bytes.
         *
         * @return value read
         */
        abstract int readShort();

        /**
         * Read one {@code int} value from the source, advancing the
         * stream 4 bytes.
         *
         * @return value read
         */
        abstract int readInt();

        /**
         * Read one {@code long} value from the source, advancing the
         * stream 8 bytes.
         *
         * @return value read
         */
        abstract long readLong();

        /**
         * Read a given number of bytes from the source.
         *
         * @param n number of bytes
         * @return the bytes
         */
        abstract byte[] readBytes(int n);

        /**
         * Read a size field, which must not be negative.
         *
         * @return the size
         */
        int readSize() {
            int n = readInt();
            if (n < 0) { throw badData("negative size"); }
            return n;
        }

        /**
         * Read one {@code BigInteger} value from the source, encoded as
         * a signed count of 15-bit digits, then the digits, least
         * significant first.
         *
         * @return value read
         */
        // Compare CPython r_PyLong in marshal.c
        BigInteger readBigInteger() {
            int size = readInt();
            if (size == Integer.MIN_VALUE) {
                throw badData("size out of range in big int");
            }

            // Size carries the sign
            boolean negative = size < 0;
            size = Math.abs(size);

            BigInteger v = BigInteger.ZERO;
            for (int i = 0, shift = 0; i < size; i++, shift += 15) {
                int digit = readShort();
                if ((digit & ~MASK15) != 0) {
                    throw badData("digit out of range in big int");
                }
                v = v.or(BigInteger.valueOf(digit).shiftLeft(shift));
            }
            return negative ? v.negate() : v;
        }

        /**
         * Read a {@code float} in text form: a length byte and that
         * many ASCII characters.
         *
         * @return the value
         */
        double readFloatText() {
            String s = new String(readBytes(readByte()),
                    StandardCharsets.US_ASCII);
            try {
                return switch (s) {
                    case "inf" -> Double.POSITIVE_INFINITY;
                    case "-inf" -> Double.NEGATIVE_INFINITY;
                    case "nan", "-nan" -> Double.NaN;
                    default -> Double.parseDouble(s);
                };
            } catch (NumberFormatException nfe) {
                throw badData("float " + s);
            }
        }

        /** @return a {@code str} encoded as a size and UTF-8 bytes */
        String readUnicode() {
            return new String(readBytes(readSize()), StandardCharsets.UTF_8);
        }

        /** @return the items of a sequence, preceded by their number */
        List<Object> readItems() {
            int n = readSize();
            List<Object> items = new ArrayList<>(Math.min(n, 1024));
            for (int i = 0; i < n; i++) { items.add(load()); }
            return items;
        }

        /** @return a dict, as key-value pairs ended by a NULL */
        Map<Object, Object> readDict() {
            Map<Object, Object> m = new LinkedHashMap<>();
            while (true) {
                int tc = readByte();
                if (tc == TYPE_NULL) { return m; }
                Decoder d = decoderForCode.get(tc);
                if (d == null) { throw badData("dict key"); }
                Object key = d.read(this);
                m.put(key, load());
            }
        }

        /** @return a code object, with the fields of CPython 3.2 */
        // Compare CPython r_object case TYPE_CODE in marshal.c
        CodeObject readCode() {
            int argcount = readInt();
            int kwonlyargcount = readInt();
            int nlocals = readInt();
            int stacksize = readInt();
            int flags = readInt();
            PyBytes code = as(PyBytes.class, load(), "code");
            List<Object> consts = asList(load(), "consts");
            List<String> names = asStrings(load(), "names");
            List<String> varnames = asStrings(load(), "varnames");
            List<String> freevars = asStrings(load(), "freevars");
            List<String> cellvars = asStrings(load(), "cellvars");
            String filename = as(String.class, load(), "filename");
            String name = as(String.class, load(), "name");
            int firstlineno = readInt();
            PyBytes lnotab = as(PyBytes.class, load(), "lnotab");
            return new CodeObject(argcount, kwonlyargcount, nlocals,
                    stacksize, flags, code, consts, names, varnames,
                    freevars, cellvars, filename, name, firstlineno,
                    lnotab);
        }

        private static <T> T as(Class<T> c, Object o, String field) {
            if (c.isInstance(o)) { return c.cast(o); }
            throw badData("code " + field + " is not "
                    + c.getSimpleName());
        }

        private static List<Object> asList(Object o, String field) {
            if (o instanceof List<?> list) {
                return new ArrayList<>(list);
            }
            throw badData("code " + field + " is not a tuple");
        }

        private static List<String> asStrings(Object o, String field) {
            List<String> strings = new ArrayList<>();
            for (Object s : asList(o, field)) {
                strings.add(as(String.class, s, field));
            }
            return strings;
        }

        /**
         * Create a {@link MalformedCodeError} to throw when we meet the
         * end of the data where more of the object was expected.
         *
         * @return to throw
         */
        protected static MalformedCodeError endOfData() {
            return new MalformedCodeError("marshal data too short");
        }

        /**
         * Create a {@link MalformedCodeError} to throw, with a message
         * along the lines "bad marshal data (REASON)".
         *
         * @param reason to insert
         * @return to throw
         */
        protected static MalformedCodeError badData(String reason) {
            return new MalformedCodeError("bad marshal data (%s)", reason);
        }
    }

    /**
     * A {@link Reader} that has a {@code java.io.InputStream} as its
     * source. When the underlying source is a file, it is preferable
     * for efficiency that this be a {@code java.io.BufferedInputStream}.
     */
    static class StreamReader extends Reader {

        /**
         * The source wrapped in a {@code DataInputStream}. A marshal
         * stream is little-endian, while Java will read big-endian data,
         * so we reverse the bytes of each value.
         */
        private final DataInputStream file;

        /**
         * Form a {@link Reader} on a {@code java.io.InputStream}.
         *
         * @param file input
         */
        StreamReader(InputStream file) {
            this.file = new DataInputStream(file);
        }

        @Override
        int readByte() {
            try {
                return file.readByte() & 0xff;
            } catch (IOException ioe) {
                throw translate(ioe);
            }
        }

        @Override
        int readShort() {
            try {
                return Short.reverseBytes(file.readShort());
            } catch (IOException ioe) {
                throw translate(ioe);
            }
        }

        @Override
        int readInt() {
            try {
                return Integer.reverseBytes(file.readInt());
            } catch (IOException ioe) {
                throw translate(ioe);
            }
        }

        @Override
        long readLong() {
            try {
                return Long.reverseBytes(file.readLong());
            } catch (IOException ioe) {
                throw translate(ioe);
            }
        }

        @Override
        byte[] readBytes(int n) {
            try {
                byte[] b = file.readNBytes(n);
                if (b.length < n) { throw endOfData(); }
                return b;
            } catch (IOException ioe) {
                throw translate(ioe);
            }
        }

        /**
         * Convert an {@code IOException} to the exception we throw. The
         * end of the input is a short object, and any other failure is
         * passed on unchecked.
         */
        private static RuntimeException translate(IOException ioe) {
            if (ioe instanceof EOFException) {
                return endOfData();
            } else {
                return new UncheckedIOException(ioe);
            }
        }
    }

    /**
     * A {@link Reader} that has a {@code ByteBuffer} as its source.
     */
    static class BytesReader extends Reader {

        /**
         * The source as a little-endian {@code ByteBuffer}, on which we
         * shall call {@code getInt()} etc. to read items.
         */
        final ByteBuffer buf;

        /**
         * Form a {@link Reader} on a byte array.
         *
         * @param bytes input
         */
        BytesReader(byte[] bytes) {
            this.buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        }

        @Override
        int readByte() {
            try {
                return buf.get() & 0xff;
            } catch (BufferUnderflowException boe) {
                throw endOfData();
            }
        }

        @Override
        int readShort() {
            try {
                return buf.getShort();
            } catch (BufferUnderflowException boe) {
                throw endOfData();
            }
        }

        @Override
        int readInt() {
            try {
                return buf.getInt();
            } catch (BufferUnderflowException boe) {
                throw endOfData();
            }
        }

        @Override
        long readLong() {
            try {
                return buf.getLong();
            } catch (BufferUnderflowException boe) {
                throw endOfData();
            }
        }

        @Override
        byte[] readBytes(int n) {
            if (n > buf.remaining()) { throw endOfData(); }
            byte[] b = new byte[n];
            buf.get(b);
            return b;
        }
    }
}
