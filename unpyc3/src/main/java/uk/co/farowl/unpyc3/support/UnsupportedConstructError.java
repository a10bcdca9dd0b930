// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3.support;

/**
 * The byte code is well-formed but follows a pattern the decompiler
 * does not model, for example an unknown arity of {@code RAISE_VARARGS}
 * or an expression found where a statement builder was expected.
 */
public class UnsupportedConstructError extends DecompileError {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public UnsupportedConstructError(String msg, Object... args) {
        super(msg, args);
    }

    /**
     * Constructor specifying a cause and a message.
     *
     * @param cause a Java exception behind the error
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public UnsupportedConstructError(Throwable cause, String msg,
            Object... args) {
        super(cause, msg, args);
    }
}
