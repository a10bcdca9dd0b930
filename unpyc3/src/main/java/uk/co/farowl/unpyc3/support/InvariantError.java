// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3.support;

/**
 * The decompiler has found itself in a state that should be
 * impossible, for example an incomplete unpacking left on the stack
 * when a suite is finished. This is a bug, in the decompiler or in the
 * assumptions it makes about the compiler.
 */
public class InvariantError extends DecompileError {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public InvariantError(String msg, Object... args) {
        super(msg, args);
    }

    /**
     * Constructor specifying a cause and a message.
     *
     * @param cause a Java exception behind the error
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public InvariantError(Throwable cause, String msg,
            Object... args) {
        super(cause, msg, args);
    }
}
