// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

import uk.co.farowl.unpyc3.support.UnsupportedConstructError;

/**
 * One name fetched by {@code IMPORT_FROM}. When it is stored, the local
 * name is recorded as the alias in the {@code from} import beneath it
 * on the stack.
 *
 * @param name imported from the module
 */
public record ImportFrom(String name) implements StackItem {

    @Override
    public void store(SuiteDecompiler dec, Expr dest) {
        if (dec.stack().peek() instanceof Stmt.Import imp
                && dest instanceof Expr.Name n) {
            imp.addAlias(n.name());
        } else {
            throw new UnsupportedConstructError(
                    "import of %s stored to %s", name, dest);
        }
    }
}
