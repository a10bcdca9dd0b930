// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

import java.util.ArrayList;
import java.util.List;

/**
 * The accumulator for an unpacking assignment {@code a, *b, c = value}.
 * The same accumulator occupies one stack slot per target, and each
 * store collects one target. The last store completes the assignment by
 * storing the value to the tuple of targets.
 */
public final class Unpack implements StackItem {

    private final StackItem value;
    private final int length;
    private final int starIndex;
    private final List<Expr> dests = new ArrayList<>();

    /**
     * @param value being unpacked
     * @param length number of targets
     * @param starIndex index of the starred target or -1
     */
    Unpack(StackItem value, int length, int starIndex) {
        this.value = value;
        this.length = length;
        this.starIndex = starIndex;
    }

    /** @return whether not every target has been stored */
    boolean isIncomplete() { return dests.size() < length; }

    @Override
    public void store(SuiteDecompiler dec, Expr dest) {
        dests.add(dests.size() == starIndex ? new Expr.Starred(dest) : dest);
        if (dests.size() == length) {
            dec.stack().push(value);
            dec.store(new Expr.Tuple(dests));
        }
    }

    @Override
    public String toString() {
        return String.format("Unpack[%d of %d]", dests.size(), length);
    }
}
