// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

import uk.co.farowl.unpyc3.support.UnsupportedConstructError;

/**
 * Anything that may occupy a slot of the {@link EvaluationStack}: an
 * ordinary expression or one of the builders that stand in for a value
 * while a statement is under construction. What happens when the value
 * in a slot is stored to a name, or discarded, depends on what kind of
 * item it is. An item that does not expect to be stored or discarded
 * treats that as byte code it cannot make sense of.
 */
public sealed interface StackItem permits Expr, Unpack, ImportFrom,
        SuiteDecompiler.BuildClass, Stmt.Import, Stmt.Def, Stmt.Class,
        Stmt.For, Stmt.With, Stmt.Try, Stmt.AugmentedAssign {

    /**
     * Respond to a store of this item to {@code dest}.
     *
     * @param dec decompiler in which the store occurs
     * @param dest target of the store
     */
    default void store(SuiteDecompiler dec, Expr dest) {
        throw new UnsupportedConstructError("cannot store %s in %s",
                getClass().getSimpleName(), dest);
    }

    /**
     * Respond to this item being popped and discarded.
     *
     * @param dec decompiler in which the discard occurs
     */
    default void onPop(SuiteDecompiler dec) {
        throw new UnsupportedConstructError("cannot discard %s",
                getClass().getSimpleName());
    }
}
