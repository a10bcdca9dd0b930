// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base of the errors raised when a compiled unit cannot be turned into
 * source. A {@code DecompileError} aborts the reconstruction of the
 * unit in which it occurs: we never produce partial output. The
 * subclasses distinguish bad input ({@link MalformedCodeError}), byte
 * code outside the patterns we recognise
 * ({@link UnsupportedConstructError}) and internal inconsistency
 * ({@link InvariantError}).
 * <p>
 * An error raised while an instruction is being processed acquires a
 * location (the name of the unit and the instruction) as it passes
 * out of the decompiler. Only the innermost location is kept.
 */
public class DecompileError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /** Logger for decompile errors. These are logged as they are made
     * because a driver may choose to catch and continue. */
    static final Logger logger =
            LoggerFactory.getLogger(DecompileError.class);

    /** Name of the compiled unit where the error arose or null. */
    private String unitName;

    /** Description of the instruction where the error arose or null. */
    private String where;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public DecompileError(String msg, Object... args) {
        super(String.format(msg, args));
        logger.atDebug().log(getMessage());
    }

    /**
     * Constructor specifying a cause and a message.
     *
     * @param cause a Java exception behind the error
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public DecompileError(Throwable cause, String msg, Object... args) {
        super(String.format(msg, args), cause);
        logger.atDebug().log(getMessage());
    }

    /**
     * Attach the location of the error, if none has been attached
     * already.
     *
     * @param unitName name of the compiled unit
     * @param where description of the offending instruction
     * @return {@code this}
     */
    public DecompileError at(String unitName, Object where) {
        if (this.where == null) {
            this.unitName = unitName;
            this.where = String.valueOf(where).strip();
        }
        return this;
    }

    /** @return whether a location has been attached. */
    public boolean hasLocation() { return where != null; }

    /** @return the name of the unit where the error arose or null. */
    public String getUnitName() { return unitName; }

    /** @return the offending instruction (as text) or null. */
    public String getWhere() { return where; }

    @Override
    public String getMessage() {
        String msg = super.getMessage();
        if (where == null) {
            return msg;
        } else {
            return String.format("%s (in %s at %s)", msg, unitName,
                    where);
        }
    }
}
