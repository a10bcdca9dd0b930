// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3.support;

/**
 * The input is not well-formed: for example a jump
 * target that is not the position of any instruction, an address that
 * moves off the end of the instructions, or truncated marshal data.
 */
public class MalformedCodeError extends DecompileError {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public MalformedCodeError(String msg, Object... args) {
        super(msg, args);
    }

    /**
     * Constructor specifying a cause and a message.
     *
     * @param cause a Java exception behind the error
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public MalformedCodeError(Throwable cause, String msg,
            Object... args) {
        super(cause, msg, args);
    }
}
