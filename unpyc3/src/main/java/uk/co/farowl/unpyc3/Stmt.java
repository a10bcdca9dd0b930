// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

import uk.co.farowl.unpyc3.stringlib.Literal;
import uk.co.farowl.unpyc3.support.UnsupportedConstructError;

/**
 * A statement reconstructed from byte code. A statement renders itself
 * onto a {@link SourceWriter}, and compound statements render the
 * suites they own one level further in.
 * <p>
 * Some statements are built in stages while a placeholder for them sits
 * on the evaluation stack: these implement {@link StackItem} and
 * complete themselves when stored or discarded.
 */
public abstract class Stmt {

    /**
     * Write this statement at the indentation of the writer.
     *
     * @param out destination
     */
    public abstract void display(SourceWriter out);

    /**
     * Render this statement as the innermost part of a comprehension,
     * after the given clauses. Only statements that arise in the body of
     * a comprehension support this.
     *
     * @param clauses {@code for} and {@code if} clauses so far
     * @return comprehension body without brackets
     */
    String genDisplay(List<String> clauses) {
        throw new UnsupportedConstructError(
                "%s cannot be part of a comprehension",
                getClass().getSimpleName());
    }

    /**
     * Append a clause to a list of clauses.
     *
     * @param clauses so far
     * @param clause to append
     * @return new list
     */
    static List<String> append(List<String> clauses, String clause) {
        List<String> c = new ArrayList<>(clauses);
        c.add(clause);
        return c;
    }

    @Override
    public String toString() {
        SourceWriter out = new SourceWriter();
        display(out);
        return out.toString();
    }

    /** An expression evaluated for its effect. */
    public static final class ExpressionStatement extends Stmt {

        final Expr expr;

        /** @param expr evaluated */
        public ExpressionStatement(Expr expr) { this.expr = expr; }

        @Override
        public void display(SourceWriter out) { out.line(expr.bare()); }

        @Override
        String genDisplay(List<String> clauses) {
            StringJoiner sj = new StringJoiner(" ");
            sj.add(expr.wrapAtMost(Precedence.TUPLE));
            for (String c : clauses) { sj.add(c); }
            return sj.toString();
        }
    }

    /**
     * An assignment {@code t1 = t2 = ... = value}. The chain holds the
     * targets in order, then the value.
     */
    public static final class Assign extends Stmt {

        final List<Expr> chain;

        /** @param chain targets then value */
        public Assign(List<Expr> chain) { this.chain = List.copyOf(chain); }

        /** @return targets then value */
        public List<Expr> chain() { return chain; }

        @Override
        public void display(SourceWriter out) {
            StringJoiner sj = new StringJoiner(" = ");
            int last = chain.size() - 1;
            for (Expr e : chain.subList(0, last)) { sj.add(e.toString()); }
            sj.add(chain.get(last).bare());
            out.line(sj.toString());
        }
    }

    /**
     * An augmented assignment {@code target op= value}. It is pushed by
     * {@code INPLACE_*} and becomes a statement when stored.
     */
    public static final class AugmentedAssign extends Stmt
            implements StackItem {

        final Operator op;
        final Expr target;
        final Expr value;

        /**
         * @param op the operation
         * @param target of the assignment (also the left operand)
         * @param value right operand
         */
        AugmentedAssign(Operator op, Expr target, Expr value) {
            this.op = op;
            this.target = target;
            this.value = value;
        }

        @Override
        public void store(SuiteDecompiler dec, Expr dest) {
            dec.addStatement(this);
        }

        @Override
        public void display(SourceWriter out) {
            out.line(op.inPlacePattern, target, value.bare());
        }
    }

    /** A {@code del} statement. */
    public static final class Delete extends Stmt {

        final Expr target;

        /** @param target deleted */
        public Delete(Expr target) { this.target = target; }

        @Override
        public void display(SourceWriter out) { out.line("del %s", target); }
    }

    /**
     * An {@code if} statement. A false suite consisting only of another
     * {@code if} is written as {@code elif}.
     */
    public static final class If extends Stmt {

        final Expr cond;
        final Suite trueSuite;
        final Suite falseSuite;

        /**
         * @param cond condition
         * @param trueSuite executed if the condition holds
         * @param falseSuite executed otherwise (may be empty)
         */
        public If(Expr cond, Suite trueSuite, Suite falseSuite) {
            this.cond = cond;
            this.trueSuite = trueSuite;
            this.falseSuite = falseSuite;
        }

        @Override
        public void display(SourceWriter out) { display(out, false); }

        private void display(SourceWriter out, boolean elif) {
            out.header(elif ? "elif %s:" : "if %s:", cond);
            trueSuite.display(out.indent());
            if (falseSuite.isEmpty()) {
                return;
            } else if (falseSuite.size() == 1
                    && falseSuite.get(0) instanceof If nested) {
                nested.display(out, true);
            } else {
                out.header("else:");
                falseSuite.display(out.indent());
            }
        }

        @Override
        String genDisplay(List<String> clauses) {
            if (!falseSuite.isEmpty()) {
                throw new UnsupportedConstructError(
                        "if-else in a comprehension");
            }
            // The condition of a comprehension if is an or_test
            String clause = "if " + cond.wrapBelow(Precedence.OR);
            return trueSuite.genDisplay(append(clauses, clause));
        }
    }

    /**
     * A {@code for} loop. It is pushed by {@code FOR_ITER} into the
     * decompiler of the body, where the first store gives its target.
     */
    public static final class For extends Stmt implements StackItem {

        final Expr iterable;
        Expr target;
        Suite body;

        /** @param iterable the loop consumes */
        For(Expr iterable) { this.iterable = iterable; }

        @Override
        public void store(SuiteDecompiler dec, Expr dest) { target = dest; }

        @Override
        public void display(SourceWriter out) {
            out.header("for %s in %s:", target, iterable);
            body.display(out.indent());
        }

        @Override
        String genDisplay(List<String> clauses) {
            String clause = String.format("for %s in %s", target,
                    iterable.wrapAtMost(Precedence.TERNARY));
            return body.genDisplay(append(clauses, clause));
        }
    }

    /** A {@code while} loop. */
    public static final class While extends Stmt {

        final Expr cond;
        final Suite body;

        /**
         * @param cond loop condition
         * @param body of the loop
         */
        public While(Expr cond, Suite body) {
            this.cond = cond;
            this.body = body;
        }

        @Override
        public void display(SourceWriter out) {
            out.header("while %s:", cond);
            body.display(out.indent());
        }
    }

    /** A {@code break} statement. */
    public static final class Break extends Stmt {
        @Override
        public void display(SourceWriter out) { out.line("break"); }
    }

    /** A {@code continue} statement. */
    public static final class Continue extends Stmt {
        @Override
        public void display(SourceWriter out) { out.line("continue"); }
    }

    /** A {@code return} statement. */
    public static final class Return extends Stmt {

        final Expr value;

        /** @param value returned or {@code null} */
        public Return(Expr value) { this.value = value; }

        @Override
        public void display(SourceWriter out) {
            out.line(value == null ? "return" : "return " + value);
        }
    }

    /** A {@code raise} statement with zero, one or two operands. */
    public static final class Raise extends Stmt {

        final Expr exc;
        final Expr cause;

        /**
         * @param exc raised or {@code null} to re-raise
         * @param cause given after {@code from} or {@code null}
         */
        public Raise(Expr exc, Expr cause) {
            this.exc = exc;
            this.cause = cause;
        }

        @Override
        public void display(SourceWriter out) {
            if (exc == null) {
                out.line("raise");
            } else if (cause == null) {
                out.line("raise %s", exc);
            } else {
                out.line("raise %s from %s", exc, cause);
            }
        }
    }

    /**
     * An {@code import} or {@code from ... import} statement. It is
     * pushed by {@code IMPORT_NAME}, and completed when it is stored (a
     * plain import) or discarded (after the names of a {@code from}
     * import have been stored).
     */
    public static final class Import extends Stmt implements StackItem {

        final String module;
        final int level;
        final Object fromlist;
        Expr alias;
        final List<String> aslist = new ArrayList<>();

        /**
         * @param module dotted name imported
         * @param level number of leading dots (relative import)
         * @param fromlist names imported from the module, or
         *     {@link Py#None} for a plain import
         */
        Import(String module, int level, Object fromlist) {
            this.module = module;
            this.level = level;
            this.fromlist = fromlist;
        }

        @Override
        public void store(SuiteDecompiler dec, Expr dest) {
            alias = dest;
            dec.addStatement(this);
        }

        @Override
        public void onPop(SuiteDecompiler dec) { dec.addStatement(this); }

        /**
         * Record the local name for the next name imported with
         * {@code from}.
         *
         * @param name bound
         */
        void addAlias(String name) { aslist.add(name); }

        @Override
        public void display(SourceWriter out) {
            String source = ".".repeat(Math.max(level, 0)) + module;
            if (fromlist == Py.None) {
                String as = alias.toString();
                if (module.equals(as) || module.startsWith(as + ".")) {
                    out.line("import %s", source);
                } else {
                    out.line("import %s as %s", source, as);
                }
            } else if (fromlist instanceof List<?> names) {
                if (names.equals(List.of("*"))) {
                    out.line("from %s import *", source);
                    return;
                }
                StringJoiner sj = new StringJoiner(", ");
                for (int i = 0; i < names.size(); i++) {
                    String name = names.get(i).toString();
                    String as = i < aslist.size() ? aslist.get(i) : name;
                    sj.add(name.equals(as) ? name : name + " as " + as);
                }
                out.line("from %s import %s", source, sj);
            } else {
                throw new UnsupportedConstructError(
                        "import of %s with fromlist %s", module, fromlist);
            }
        }
    }

    /** One {@code except} clause of a {@link Try}. */
    static final class Handler {
        final Expr type;
        Expr name;
        final Suite body;

        Handler(Expr type, Suite body) {
            this.type = type;
            this.body = body;
        }
    }

    /**
     * A {@code try} statement with {@code except} clauses and optionally
     * {@code else}. It is pushed into the decompiler of each typed
     * handler, where {@code COMPARE_OP} finds it as the left operand of
     * an exception match, and where a store gives the handler its bound
     * name.
     */
    public static final class Try extends Stmt implements StackItem {

        final Suite trySuite;
        final List<Handler> handlers = new ArrayList<>();
        Suite elseSuite;
        /** Where the handler after the current one begins. */
        Address nextHandler;

        /** @param trySuite the guarded block */
        Try(Suite trySuite) { this.trySuite = trySuite; }

        /**
         * @param type matched or {@code null} for a bare {@code except}
         * @param body of the handler
         */
        void addHandler(Expr type, Suite body) {
            handlers.add(new Handler(type, body));
        }

        @Override
        public void store(SuiteDecompiler dec, Expr dest) {
            handlers.get(handlers.size() - 1).name = dest;
        }

        @Override
        public void display(SourceWriter out) {
            out.header("try:");
            trySuite.display(out.indent());
            for (Handler h : handlers) {
                if (h.type == null) {
                    out.header("except:");
                } else if (h.name == null) {
                    out.header("except %s:", h.type);
                } else {
                    out.header("except %s as %s:", h.type, h.name);
                }
                h.body.display(out.indent());
            }
            if (elseSuite != null) {
                out.header("else:");
                elseSuite.display(out.indent());
            }
        }
    }

    /**
     * A {@code try} statement with a {@code finally} clause. If the
     * guarded block is a single {@link Try}, its {@code except} clauses
     * are written with the {@code finally}.
     */
    public static final class Finally extends Stmt {

        final Suite trySuite;
        final Suite finallySuite;

        /**
         * @param trySuite the guarded block
         * @param finallySuite the cleanup block
         */
        public Finally(Suite trySuite, Suite finallySuite) {
            this.trySuite = trySuite;
            this.finallySuite = finallySuite;
        }

        @Override
        public void display(SourceWriter out) {
            if (trySuite.size() == 1 && trySuite.get(0) instanceof Try t) {
                t.display(out);
            } else {
                new Try(trySuite).display(out);
            }
            out.header("finally:");
            finallySuite.display(out.indent());
        }
    }

    /**
     * A {@code with} statement. It is pushed by {@code SETUP_WITH} into
     * the decompiler of the body, where a store gives the name bound by
     * {@code as}, or a discard shows there is none. Nested {@code with}
     * statements that are each the entire body of the one enclosing
     * them are written as one.
     */
    public static final class With extends Stmt implements StackItem {

        final Expr expr;
        Expr name;
        Suite body;

        /** @param expr the context manager */
        With(Expr expr) { this.expr = expr; }

        @Override
        public void store(SuiteDecompiler dec, Expr dest) { name = dest; }

        @Override
        public void onPop(SuiteDecompiler dec) {}

        @Override
        public void display(SourceWriter out) {
            List<String> items = new ArrayList<>();
            With w = this;
            while (true) {
                items.add(w.name == null ? w.expr.toString()
                        : w.expr + " as " + w.name);
                if (w.body.size() == 1 && w.body.get(0) instanceof With n) {
                    w = n;
                } else {
                    break;
                }
            }
            out.header("with %s:", String.join(", ", items));
            w.body.display(out.indent());
        }
    }

    /**
     * A definition that may be decorated. Decorators are attached from
     * the innermost outwards, and written in the reverse of that order.
     */
    public abstract static class Decorable extends Stmt {

        private final List<Expr> decorators = new ArrayList<>();

        /** @param f decorator applied to the definition */
        void decorate(Expr f) { decorators.add(f); }

        @Override
        public void display(SourceWriter out) {
            out.separate();
            List<Expr> d = new ArrayList<>(decorators);
            Collections.reverse(d);
            for (Expr f : d) { out.line("@%s", f); }
            displayUndecorated(out);
            out.separate();
        }

        /**
         * Write the definition itself.
         *
         * @param out destination
         */
        abstract void displayUndecorated(SourceWriter out);
    }

    /**
     * A {@code def} statement. It is pushed by {@code MAKE_FUNCTION}, may
     * be decorated, and is complete when stored. The body is decompiled
     * at most once, on demand.
     */
    public static final class Def extends Decorable implements StackItem {

        final FunctionDefinition def;
        private Suite body;

        /** @param def what was gathered to make the function */
        Def(FunctionDefinition def) { this.def = def; }

        /** @return the body of the function, decompiled */
        public Suite body() {
            if (body == null) { body = def.unit.getSuite(true, false); }
            return body;
        }

        @Override
        public void store(SuiteDecompiler dec, Expr dest) {
            body();
            dec.addStatement(this);
        }

        @Override
        void displayUndecorated(SourceWriter out) {
            String params = String.join(", ", def.parameters(true));
            Expr ret = def.returnAnnotation();
            String arrow = ret == null ? "" : " -> " + ret;
            out.header("def %s(%s)%s:", def.name(), params, arrow);
            SourceWriter inner = out.indent();
            String doc = def.docString();
            if (doc != null) {
                new DocString(doc).display(inner);
                if (!body().isEmpty()) { body().display(inner); }
            } else {
                body().display(inner);
            }
        }
    }

    /**
     * A {@code class} statement. It is pushed by a call to the marker
     * left by {@code LOAD_BUILD_CLASS}, may be decorated, and is complete
     * when stored.
     */
    public static final class Class extends Decorable
            implements StackItem {

        final List<Expr> bases;
        final List<Expr.Keyword> kwargs;
        final Suite body;
        Expr name;

        /**
         * @param func the function that executes the class body
         * @param bases of the class
         * @param kwargs keyword arguments (such as {@code metaclass})
         */
        Class(FunctionDefinition func, List<Expr> bases,
                List<Expr.Keyword> kwargs) {
            this.bases = List.copyOf(bases);
            this.kwargs = List.copyOf(kwargs);
            this.body = func.unit.getSuite(true, true);
            // A class using super() ends by returning its __class__ cell
            if (!body.isEmpty() && body.get(body.size() - 1) instanceof Return r
                    && r.value != null) {
                body.removeLast();
            }
        }

        @Override
        public void store(SuiteDecompiler dec, Expr dest) {
            name = dest;
            dec.addStatement(this);
        }

        @Override
        void displayUndecorated(SourceWriter out) {
            if (bases.isEmpty() && kwargs.isEmpty()) {
                out.header("class %s:", name);
            } else {
                StringJoiner sj = new StringJoiner(", ");
                sj.add(Expr.commaList(bases));
                for (Expr.Keyword k : kwargs) { sj.add(k.toString()); }
                String args = bases.isEmpty() ? sj.toString().substring(2)
                        : sj.toString();
                out.header("class %s(%s):", name, args);
            }
            body.display(out.indent());
        }
    }

    /** A {@code global} or {@code nonlocal} declaration. */
    public static final class Declaration extends Stmt {

        final String keyword;
        final List<Expr.Name> names;

        /**
         * @param keyword {@code "global"} or {@code "nonlocal"}
         * @param names declared
         */
        public Declaration(String keyword, List<Expr.Name> names) {
            this.keyword = keyword;
            this.names = List.copyOf(names);
        }

        @Override
        public void display(SourceWriter out) {
            out.line("%s %s", keyword, Expr.commaList(names));
        }
    }

    /**
     * A docstring. One line is written as its {@code repr}. Several are
     * written between triple quotes of a kind the text does not
     * contain.
     */
    public static final class DocString extends Stmt {

        final String text;

        /** @param text of the docstring */
        public DocString(String text) { this.text = text; }

        @Override
        public void display(SourceWriter out) {
            out.line(Literal.docString(text));
        }
    }
}
