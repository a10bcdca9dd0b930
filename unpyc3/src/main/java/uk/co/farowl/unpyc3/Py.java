// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

/**
 * Java stand-ins for the Python singletons that may appear as constants
 * in a code object. Everything else in a constant pool is represented
 * by a natural Java type (see {@link CodeObject}).
 */
public final class Py {

    private Py() {} // no instances

    /** Python {@code None}. */
    public static final Singleton None = new Singleton("None");

    /** Python {@code Ellipsis} (written {@code ...} in a subscript). */
    public static final Singleton Ellipsis = new Singleton("Ellipsis");

    /** Python {@code StopIteration} (the class, as marshal writes it). */
    public static final Singleton StopIteration =
            new Singleton("StopIteration");

    /**
     * A Python object of which there is only one instance. Its
     * {@code toString()} is the name by which source code refers to it.
     */
    public static final class Singleton {

        private final String name;

        private Singleton(String name) { this.name = name; }

        @Override
        public String toString() { return name; }
    }
}
