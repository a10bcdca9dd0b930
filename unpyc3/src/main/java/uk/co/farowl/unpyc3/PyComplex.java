// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

import uk.co.farowl.unpyc3.stringlib.Literal;

/** A Python {@code complex} constant. */
public final class PyComplex {

    /** Real part. */
    public final double real;
    /** Imaginary part. */
    public final double imag;

    /**
     * Construct from real and imaginary parts.
     *
     * @param real part
     * @param imag part
     */
    public PyComplex(double real, double imag) {
        this.real = real;
        this.imag = imag;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof PyComplex c) {
            return Double.compare(real, c.real) == 0
                    && Double.compare(imag, c.imag) == 0;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(real) * 31 + Double.hashCode(imag);
    }

    @Override
    public String toString() { return Literal.repr(this); }
}
