// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import uk.co.farowl.unpyc3.support.InvariantError;

/**
 * An ordered block of statements, owned by the construct that contains
 * it. An empty suite renders as {@code pass}.
 */
public final class Suite implements Iterable<Stmt> {

    private final List<Stmt> statements = new ArrayList<>();

    /** @param stmt to append */
    public void add(Stmt stmt) { statements.add(stmt); }

    /**
     * @param i index of statement
     * @return statement at {@code i}
     */
    public Stmt get(int i) { return statements.get(i); }

    /**
     * @param i index of statement
     * @param stmt to replace the statement at {@code i}
     */
    void set(int i, Stmt stmt) { statements.set(i, stmt); }

    /** @return the last statement, removed from the suite */
    Stmt removeLast() { return statements.remove(statements.size() - 1); }

    /** @return number of statements */
    public int size() { return statements.size(); }

    /** @return whether there are no statements */
    public boolean isEmpty() { return statements.isEmpty(); }

    @Override
    public Iterator<Stmt> iterator() {
        return Collections.unmodifiableList(statements).iterator();
    }

    /**
     * Write the statements (or {@code pass}) at the indentation of the
     * writer.
     *
     * @param out destination
     */
    public void display(SourceWriter out) {
        if (statements.isEmpty()) {
            out.line("pass");
        } else {
            for (Stmt s : statements) { s.display(out); }
        }
    }

    /**
     * Render the suite as the body of a comprehension. It must consist
     * of exactly one statement.
     *
     * @return the comprehension body, without brackets
     */
    String genDisplay() { return genDisplay(List.of()); }

    /**
     * Render the suite as the body of a comprehension, after the given
     * {@code for} and {@code if} clauses.
     *
     * @param clauses written so far, outermost first
     * @return the comprehension body, without brackets
     */
    String genDisplay(List<String> clauses) {
        if (statements.size() != 1) {
            throw new InvariantError(
                    "comprehension body has %d statements",
                    statements.size());
        }
        return statements.get(0).genDisplay(clauses);
    }

    @Override
    public String toString() {
        SourceWriter out = new SourceWriter();
        display(out);
        return out.toString();
    }
}
