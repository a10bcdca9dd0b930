// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

import java.util.Arrays;

import uk.co.farowl.unpyc3.stringlib.Literal;

/**
 * A Python {@code bytes} constant. This is also the representation of
 * the instruction array and line number table of a {@link CodeObject}
 * as they come from {@code marshal}.
 */
public final class PyBytes {

    private final byte[] value;

    /**
     * Construct from a copy of an array of bytes.
     *
     * @param value the bytes
     */
    public PyBytes(byte[] value) { this.value = value.clone(); }

    /** @return a copy of the bytes */
    public byte[] asByteArray() { return value.clone(); }

    /** @return number of bytes */
    public int size() { return value.length; }

    /**
     * The byte at a given index, as an unsigned integer.
     *
     * @param i index of byte
     * @return value {@code 0..255}
     */
    public int get(int i) { return value[i] & 0xff; }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof PyBytes b && Arrays.equals(value, b.value);
    }

    @Override
    public int hashCode() { return Arrays.hashCode(value); }

    @Override
    public String toString() { return Literal.repr(this); }
}
