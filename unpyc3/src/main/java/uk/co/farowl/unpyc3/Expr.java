// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

import uk.co.farowl.unpyc3.stringlib.Literal;
import uk.co.farowl.unpyc3.support.InvariantError;

/**
 * An expression reconstructed from byte code. Expressions are trees of
 * immutable nodes, each with a {@link Precedence} that decides where
 * parentheses are needed when it is rendered (by {@code toString()}) as
 * an operand of another.
 * <p>
 * On the evaluation stack, an expression that is stored becomes (part
 * of) an assignment, and one that is discarded becomes an expression
 * statement.
 */
public abstract non-sealed class Expr implements StackItem {

    /** @return binding strength of this expression */
    public abstract Precedence precedence();

    /**
     * Render this expression, in parentheses if required.
     *
     * @param parenthesise whether parentheses are required
     * @return source text
     */
    String wrap(boolean parenthesise) {
        return parenthesise ? "(" + this + ")" : toString();
    }

    /**
     * Render in parentheses if this binds less tightly than {@code p}.
     *
     * @param p precedence demanded by the context
     * @return source text
     */
    String wrapBelow(Precedence p) { return wrap(precedence().below(p)); }

    /**
     * Render in parentheses if this binds no more tightly than
     * {@code p}.
     *
     * @param p precedence demanded by the context
     * @return source text
     */
    String wrapAtMost(Precedence p) {
        return wrap(precedence().atMost(p));
    }

    /**
     * Render this expression where the grammar allows any expression,
     * including a bare {@code yield}: as an expression statement or the
     * value of an assignment.
     *
     * @return source text
     */
    String bare() { return toString(); }

    /**
     * {@inheritDoc}
     * <p>
     * The destination joins the assignment chain of the decompiler.
     * While another reference to this value remains on the stack (as
     * after {@code DUP_TOP}), the chain stays open for more targets.
     * When this was the last reference, the chain is complete.
     */
    @Override
    public void store(SuiteDecompiler dec, Expr dest) {
        List<Expr> chain = dec.assignmentChain();
        chain.add(dest);
        if (!dec.stack().contains(this)) {
            chain.add(this);
            dec.addStatement(new Stmt.Assign(chain));
            chain.clear();
        }
    }

    @Override
    public void onPop(SuiteDecompiler dec) {
        dec.addStatement(new Stmt.ExpressionStatement(this));
    }

    /**
     * Render a list of expressions separated by commas, each wrapped if
     * it is a bare tuple (or looser).
     *
     * @param items to render
     * @return source text
     */
    static String commaList(List<? extends Expr> items) {
        StringJoiner sj = new StringJoiner(", ");
        for (Expr e : items) { sj.add(e.wrapAtMost(Precedence.TUPLE)); }
        return sj.toString();
    }

    /**
     * Combine two expressions with {@code and}. If {@code right} is a
     * comparison beginning where {@code left} ends, the result is the
     * chained comparison. If {@code right} is itself an {@code and},
     * the result leans left so that it renders without parentheses.
     *
     * @param left operand
     * @param right operand
     * @return {@code left and right} or equivalent
     */
    static Expr and(Expr left, Expr right) {
        if (right instanceof Compare c && c.extends_(left)) {
            return ((Compare)left).chain(c);
        }
        return combine(Operator.BOOL_AND, left, right);
    }

    /**
     * Combine two expressions with {@code or}. If {@code right} is itself
     * an {@code or}, the result leans left.
     *
     * @param left operand
     * @param right operand
     * @return {@code left or right}
     */
    static Expr or(Expr left, Expr right) {
        return combine(Operator.BOOL_OR, left, right);
    }

    /**
     * Form {@code left op right} for a boolean operator, using its
     * associativity to avoid parentheses around {@code right}.
     *
     * @param op {@link Operator#BOOL_AND} or {@link Operator#BOOL_OR}
     * @param left operand
     * @param right operand
     * @return combined expression
     */
    static Expr combine(Operator op, Expr left, Expr right) {
        if (right instanceof BinaryOp b && b.op == op) {
            return new BinaryOp(op, combine(op, left, b.left), b.right);
        }
        return new BinaryOp(op, left, right);
    }

    /** A constant from the pool of the unit, or one we have made. */
    public static final class Constant extends Expr {

        final Object value;

        /** @param value of the constant (Java representation) */
        public Constant(Object value) {
            this.value = Objects.requireNonNull(value);
        }

        /** @return the Java representation of the value */
        public Object value() { return value; }

        /** @return whether this is {@code None} */
        public boolean isNone() { return value == Py.None; }

        @Override
        public Precedence precedence() { return Precedence.ATOM; }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Constant c && c.value.equals(value);
        }

        @Override
        public int hashCode() { return value.hashCode(); }

        @Override
        public String toString() { return Literal.repr(value); }
    }

    /** A reference to a variable by name. */
    public static final class Name extends Expr {

        final String name;

        /** @param name of the variable */
        public Name(String name) { this.name = name; }

        /** @return the name */
        public String name() { return name; }

        @Override
        public Precedence precedence() { return Precedence.ATOM; }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Name n && n.name.equals(name);
        }

        @Override
        public int hashCode() { return name.hashCode(); }

        @Override
        public String toString() { return name; }
    }

    /** Attribute reference {@code expr.name}. */
    public static final class Attribute extends Expr {

        final Expr expr;
        final String name;

        /**
         * @param expr object of the reference
         * @param name of the attribute
         */
        public Attribute(Expr expr, String name) {
            this.expr = expr;
            this.name = name;
        }

        @Override
        public Precedence precedence() { return Precedence.TRAILER; }

        @Override
        public String toString() {
            // 1.real would be read as a float followed by a name
            boolean integer = expr instanceof Constant c
                    && (c.value instanceof Integer || c.value instanceof Long
                            || c.value instanceof BigInteger);
            return expr.wrap(integer || expr.precedence()
                    .below(Precedence.TRAILER)) + "." + name;
        }
    }

    /**
     * A binary operation, including subscript, the boolean operators and
     * the key-value pair of a dict comprehension.
     */
    public static final class BinaryOp extends Expr {

        final Operator op;
        final Expr left;
        final Expr right;

        /**
         * @param op the operator
         * @param left operand
         * @param right operand
         */
        public BinaryOp(Operator op, Expr left, Expr right) {
            this.op = op;
            this.left = left;
            this.right = right;
        }

        /** @return the operator */
        public Operator op() { return op; }

        @Override
        public Precedence precedence() { return op.precedence; }

        @Override
        public String toString() {
            String l, r;
            if (op == Operator.SUBSCRIPT) {
                l = left.wrapBelow(op.precedence);
                r = right.toString();
            } else if (op == Operator.POWER) {
                // Right associative, and the exponent may be unary
                l = left.wrapAtMost(op.precedence);
                r = right.wrapBelow(Precedence.UNARY);
            } else {
                l = left.wrapBelow(op.precedence);
                r = right.wrapAtMost(op.precedence);
            }
            return String.format(op.pattern, l, r);
        }
    }

    /** A slice {@code start:stop:step} as found in a subscript. */
    public static final class Slice extends Expr {

        final Expr start;
        final Expr stop;
        final Expr step;

        /**
         * @param start of slice ({@code None} to omit)
         * @param stop of slice ({@code None} to omit)
         * @param step of slice ({@code None} or {@code null} to omit)
         */
        public Slice(Expr start, Expr stop, Expr step) {
            this.start = start;
            this.stop = stop;
            this.step = step;
        }

        @Override
        public Precedence precedence() { return Precedence.LAMBDA; }

        private static String part(Expr e) {
            return e == null || isNone(e) ? ""
                    : e.wrapAtMost(Precedence.LAMBDA);
        }

        @Override
        public String toString() {
            String s = part(start) + ":" + part(stop);
            return step == null || isNone(step) ? s : s + ":" + part(step);
        }
    }

    /** Unary operators. */
    public enum Unary {
        POSITIVE("+%s", Precedence.UNARY),
        NEGATIVE("-%s", Precedence.UNARY),
        NOT("not %s", Precedence.NOT),
        INVERT("~%s", Precedence.UNARY);

        final String pattern;
        final Precedence precedence;

        Unary(String pattern, Precedence precedence) {
            this.pattern = pattern;
            this.precedence = precedence;
        }
    }

    /** A unary operation. */
    public static final class UnaryOp extends Expr {

        final Unary op;
        final Expr operand;

        /**
         * @param op the operator
         * @param operand of the operation
         */
        public UnaryOp(Unary op, Expr operand) {
            this.op = op;
            this.operand = operand;
        }

        @Override
        public Precedence precedence() { return op.precedence; }

        @Override
        public String toString() {
            return String.format(op.pattern,
                    operand.wrapBelow(op.precedence));
        }
    }

    /**
     * A comparison, possibly chained as in {@code a < b <= c}. There is
     * one more operand than there are operators.
     */
    public static final class Compare extends Expr {

        final List<Expr> operands;
        final List<String> ops;

        /**
         * A simple comparison.
         *
         * @param left operand
         * @param op operator as written
         * @param right operand
         */
        public Compare(Expr left, String op, Expr right) {
            this(List.of(left, right), List.of(op));
        }

        private Compare(List<Expr> operands, List<String> ops) {
            this.operands = operands;
            this.ops = ops;
        }

        /**
         * Whether this comparison begins with the operand that ends
         * {@code other} (which must be a comparison).
         *
         * @param other candidate to extend
         * @return whether this extends {@code other}
         */
        boolean extends_(Expr other) {
            return other instanceof Compare c && operands.get(0)
                    .equals(c.operands.get(c.operands.size() - 1));
        }

        /**
         * The chain formed by this comparison followed by another that
         * extends it.
         *
         * @param other comparison such that {@code other.extends_(this)}
         * @return chained comparison
         */
        Compare chain(Compare other) {
            List<Expr> e = new ArrayList<>(operands);
            e.addAll(other.operands.subList(1, other.operands.size()));
            List<String> o = new ArrayList<>(ops);
            o.addAll(other.ops);
            return new Compare(Collections.unmodifiableList(e),
                    Collections.unmodifiableList(o));
        }

        @Override
        public Precedence precedence() { return Precedence.COMPARE; }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(
                    operands.get(0).wrapAtMost(Precedence.COMPARE));
            for (int i = 0; i < ops.size(); i++) {
                sb.append(' ').append(ops.get(i)).append(' ').append(
                        operands.get(i + 1).wrapAtMost(Precedence.COMPARE));
            }
            return sb.toString();
        }
    }

    /** Conditional expression {@code t if c else f}. */
    public static final class IfElse extends Expr {

        final Expr cond;
        final Expr trueExpr;
        final Expr falseExpr;

        /**
         * @param cond condition
         * @param trueExpr value when the condition is true
         * @param falseExpr value when the condition is false
         */
        public IfElse(Expr cond, Expr trueExpr, Expr falseExpr) {
            this.cond = cond;
            this.trueExpr = trueExpr;
            this.falseExpr = falseExpr;
        }

        @Override
        public Precedence precedence() { return Precedence.TERNARY; }

        @Override
        public String toString() {
            Precedence p = Precedence.TERNARY;
            return String.format("%s if %s else %s",
                    trueExpr.wrapAtMost(p), cond.wrapAtMost(p),
                    falseExpr.wrapBelow(p));
        }
    }

    /**
     * A keyword argument of a call.
     *
     * @param name of the keyword
     * @param value of the argument
     */
    public static record Keyword(String name, Expr value) {

        @Override
        public String toString() {
            return name + "=" + value.wrapAtMost(Precedence.TUPLE);
        }
    }

    /** A call {@code f(args, kw=v, *varargs, **varkw)}. */
    public static final class Call extends Expr {

        final Expr func;
        final List<Expr> args;
        final List<Keyword> kwargs;
        final Expr varargs;
        final Expr varkw;

        /**
         * @param func the callable
         * @param args positional arguments
         * @param kwargs keyword arguments
         * @param varargs the {@code *} argument or {@code null}
         * @param varkw the {@code **} argument or {@code null}
         */
        public Call(Expr func, List<Expr> args, List<Keyword> kwargs,
                Expr varargs, Expr varkw) {
            this.func = func;
            this.args = List.copyOf(args);
            this.kwargs = List.copyOf(kwargs);
            this.varargs = varargs;
            this.varkw = varkw;
        }

        @Override
        public Precedence precedence() { return Precedence.TRAILER; }

        @Override
        public String toString() {
            String f = func.wrapBelow(Precedence.TRAILER);
            if (args.size() == 1 && kwargs.isEmpty() && varargs == null
                    && varkw == null && args.get(0) instanceof Comprehension c
                    && c.kind == Comprehension.Kind.GENERATOR) {
                // A lone generator expression needs only one pair
                return f + c;
            }
            StringJoiner sj = new StringJoiner(", ", "(", ")");
            for (Expr a : args) { sj.add(a.wrapAtMost(Precedence.TUPLE)); }
            for (Keyword k : kwargs) { sj.add(k.toString()); }
            if (varargs != null) { sj.add("*" + varargs); }
            if (varkw != null) { sj.add("**" + varkw); }
            return f + sj;
        }
    }

    /** A tuple display without parentheses: {@code a, b}. */
    public static final class Tuple extends Expr {

        final List<Expr> items;

        /** @param items of the tuple */
        public Tuple(List<? extends Expr> items) {
            this.items = List.copyOf(items);
        }

        /** @return the items of the tuple */
        public List<Expr> items() { return items; }

        @Override
        public Precedence precedence() { return Precedence.TUPLE; }

        @Override
        public String toString() {
            if (items.isEmpty()) {
                return "()";
            } else if (items.size() == 1) {
                return items.get(0).wrapAtMost(Precedence.TUPLE) + ",";
            } else {
                return commaList(items);
            }
        }
    }

    /** A list display {@code [a, b]}. */
    public static final class ListDisplay extends Expr {

        final List<Expr> items;

        /** @param items of the list */
        public ListDisplay(List<Expr> items) {
            this.items = List.copyOf(items);
        }

        @Override
        public Precedence precedence() { return Precedence.DISPLAY; }

        @Override
        public String toString() { return "[" + commaList(items) + "]"; }
    }

    /** A set display {@code {a, b}}. */
    public static final class SetDisplay extends Expr {

        final List<Expr> items;

        /** @param items of the set */
        public SetDisplay(List<Expr> items) {
            this.items = List.copyOf(items);
        }

        @Override
        public Precedence precedence() { return Precedence.DISPLAY; }

        @Override
        public String toString() { return "{" + commaList(items) + "}"; }
    }

    /**
     * A dict display {@code {k: v}}. Items are added by
     * {@code STORE_MAP} after the display has been pushed, so this is
     * the one expression that changes after construction.
     */
    public static final class DictDisplay extends Expr {

        private final List<Expr[]> items = new ArrayList<>();

        /**
         * Add an item to the display.
         *
         * @param key of the item
         * @param value of the item
         */
        void setItem(Expr key, Expr value) {
            items.add(new Expr[] {key, value});
        }

        @Override
        public Precedence precedence() { return Precedence.DISPLAY; }

        @Override
        public String toString() {
            StringJoiner sj = new StringJoiner(", ", "{", "}");
            for (Expr[] kv : items) {
                sj.add(kv[0].wrapAtMost(Precedence.TUPLE) + ": "
                        + kv[1].wrapAtMost(Precedence.TUPLE));
            }
            return sj.toString();
        }
    }

    /**
     * A {@code yield} expression. It is parenthesised except where
     * rendered {@link #bare()}.
     */
    public static final class Yield extends Expr {

        final Expr value;

        /** @param value yielded */
        public Yield(Expr value) { this.value = value; }

        @Override
        public Precedence precedence() { return Precedence.ATOM; }

        @Override
        String bare() {
            return isNone(value) ? "yield" : "yield " + value;
        }

        @Override
        public String toString() { return "(" + bare() + ")"; }
    }

    /** A starred target {@code *x} in an unpacking assignment. */
    public static final class Starred extends Expr {

        final Expr expr;

        /** @param expr the target */
        public Starred(Expr expr) { this.expr = expr; }

        @Override
        public Precedence precedence() { return Precedence.TRAILER; }

        @Override
        public String toString() {
            return "*" + expr.wrapBelow(Precedence.TRAILER);
        }
    }

    /**
     * A {@code lambda} expression. Its body is decompiled when the
     * lambda is made.
     */
    public static final class Lambda extends Expr {

        final FunctionDefinition def;
        private final String body;

        /** @param def the function the lambda creates */
        Lambda(FunctionDefinition def) {
            this.def = def;
            Suite suite = def.unit.getSuite(false, false);
            if (suite.isEmpty()) {
                // The implicit return None is not a statement
                this.body = "None";
            } else if (suite.size() == 1
                    && suite.get(0) instanceof Stmt.Return r) {
                this.body = r.value == null ? "None"
                        : r.value.wrapBelow(Precedence.LAMBDA);
            } else {
                throw new InvariantError(
                        "lambda body is not one expression: %s", suite);
            }
        }

        @Override
        public Precedence precedence() { return Precedence.LAMBDA; }

        @Override
        public String toString() {
            String params = String.join(", ", def.parameters(false));
            return params.isEmpty() ? "lambda: " + body
                    : "lambda " + params + ": " + body;
        }
    }

    /**
     * A list, set or dict comprehension or a generator expression. The
     * body is a nested unit, which is decompiled once the iterable it
     * consumes is known.
     */
    public static final class Comprehension extends Expr {

        /** The kind of comprehension and how it is bracketed. */
        public enum Kind {
            LIST("[%s]"), SET("{%s}"), DICT("{%s}"), GENERATOR("(%s)");

            final String pattern;

            Kind(String pattern) { this.pattern = pattern; }

            /**
             * The kind of comprehension a nested unit implements, judged
             * by its name, or {@code null} if it is not one.
             *
             * @param name of the unit
             * @return kind or {@code null}
             */
            static Kind forUnitName(String name) {
                return switch (name) {
                    case "<listcomp>" -> LIST;
                    case "<setcomp>" -> SET;
                    case "<dictcomp>" -> DICT;
                    case "<genexpr>" -> GENERATOR;
                    default -> null;
                };
            }
        }

        final Kind kind;
        private final CompiledUnit unit;
        private String body;

        /**
         * @param kind of comprehension
         * @param unit implementing the body
         */
        Comprehension(Kind kind, CompiledUnit unit) {
            this.kind = kind;
            this.unit = unit;
            if (kind != Kind.GENERATOR) { unit.neutraliseLoopPriming(); }
        }

        /**
         * Supply the iterable the comprehension consumes, and decompile
         * the body.
         *
         * @param iterable of the outermost {@code for}
         */
        void setIterable(Expr iterable) {
            unit.bindIterable(iterable);
            body = unit.getSuite(false, false).genDisplay();
        }

        @Override
        public Precedence precedence() { return Precedence.DISPLAY; }

        @Override
        public String toString() {
            if (body == null) {
                throw new InvariantError("%s has no iterable", unit.name());
            }
            return String.format(kind.pattern, body);
        }
    }

    /**
     * Test whether an expression is the constant {@code None}.
     *
     * @param e to test
     * @return whether {@code e} is {@code None}
     */
    static boolean isNone(Expr e) {
        return e instanceof Constant c && c.isNone();
    }
}
