// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Rendering of expression trees, chiefly where parentheses are needed.
 */
class ExprTest {

    static final Expr A = new Expr.Name("a");
    static final Expr B = new Expr.Name("b");
    static final Expr C = new Expr.Name("c");
    static final Expr D = new Expr.Name("d");

    static Expr bin(Operator op, Expr l, Expr r) {
        return new Expr.BinaryOp(op, l, r);
    }

    @Nested
    @DisplayName("parenthesises")
    class Parentheses {

        @Test
        void looserLeftOperand() {
            assertEquals("(a + b)*c",
                    bin(Operator.MULTIPLY, bin(Operator.ADD, A, B), C)
                            .toString());
        }

        @Test
        void rightOperandOfEqualPrecedence() {
            assertEquals("a - (b - c)", bin(Operator.SUBTRACT, A,
                    bin(Operator.SUBTRACT, B, C)).toString());
            assertEquals("a - b - c", bin(Operator.SUBTRACT,
                    bin(Operator.SUBTRACT, A, B), C).toString());
        }

        @Test
        void tighterOperands() {
            assertEquals("a + b*c", bin(Operator.ADD, A,
                    bin(Operator.MULTIPLY, B, C)).toString());
        }

        @Test
        void attributeOfSum() {
            assertEquals("(a + b).x",
                    new Expr.Attribute(bin(Operator.ADD, A, B), "x")
                            .toString());
        }

        @Test
        void subscriptNeverWrapsIndex() {
            Expr t = new Expr.Tuple(List.of(B, C));
            assertEquals("a[b, c]",
                    bin(Operator.SUBSCRIPT, A, t).toString());
        }

        @Test
        void unaryOperands() {
            Expr neg = new Expr.UnaryOp(Expr.Unary.NEGATIVE,
                    bin(Operator.ADD, A, B));
            assertEquals("-(a + b)", neg.toString());
            assertEquals("not -a", new Expr.UnaryOp(Expr.Unary.NOT,
                    new Expr.UnaryOp(Expr.Unary.NEGATIVE, A)).toString());
        }

        @Test
        void conditionalInsideConditional() {
            Expr inner = new Expr.IfElse(C, A, B);
            assertEquals("(a if c else b) if d else a",
                    new Expr.IfElse(D, inner, A).toString());
            assertEquals("a if d else a if c else b",
                    new Expr.IfElse(D, A, inner).toString());
        }

        @Test
        @DisplayName("** groups from the right")
        void powerIsRightAssociative() {
            assertEquals("(a**b)**c", bin(Operator.POWER,
                    bin(Operator.POWER, A, B), C).toString());
            assertEquals("a**b**c", bin(Operator.POWER, A,
                    bin(Operator.POWER, B, C)).toString());
        }

        @Test
        void powerWithUnaryOperands() {
            Expr negA = new Expr.UnaryOp(Expr.Unary.NEGATIVE, A);
            Expr negB = new Expr.UnaryOp(Expr.Unary.NEGATIVE, B);
            assertEquals("(-a)**b",
                    bin(Operator.POWER, negA, B).toString());
            assertEquals("a**-b",
                    bin(Operator.POWER, A, negB).toString());
            assertEquals("-a**b", new Expr.UnaryOp(Expr.Unary.NEGATIVE,
                    bin(Operator.POWER, A, B)).toString());
        }

        @Test
        void attributeOfInteger() {
            assertEquals("(1).real",
                    new Expr.Attribute(new Expr.Constant(1), "real")
                            .toString());
            assertEquals("1.5.real",
                    new Expr.Attribute(new Expr.Constant(1.5), "real")
                            .toString());
            assertEquals("'s'.join", new Expr.Attribute(
                    new Expr.Constant("s"), "join").toString());
        }

        @Test
        void yieldInsideExpressions() {
            Expr y = new Expr.Yield(new Expr.Constant(1));
            Expr call = new Expr.Call(new Expr.Name("f"),
                    List.of(y, new Expr.Constant(2)), List.of(), null,
                    null);
            assertEquals("f((yield 1), 2)", call.toString());
            assertEquals("(yield 1) + a",
                    bin(Operator.ADD, y, A).toString());
            assertEquals("yield 1", y.bare());
        }

        @Test
        @DisplayName("a conditional as a comprehension condition")
        void comprehensionCondition() {
            Suite body = new Suite();
            body.add(new Stmt.ExpressionStatement(A));
            List<String> loop = List.of("for a in x");
            Stmt.If s = new Stmt.If(new Expr.IfElse(B, C, D), body,
                    new Suite());
            assertEquals("a for a in x if (c if b else d)",
                    s.genDisplay(loop));
            s = new Stmt.If(Expr.or(B, C), body, new Suite());
            assertEquals("a for a in x if b or c", s.genDisplay(loop));
        }

        @Test
        void tupleAsArgument() {
            Expr t = new Expr.Tuple(List.of(A, B));
            Expr call = new Expr.Call(new Expr.Name("f"), List.of(t, C),
                    List.of(new Expr.Keyword("k", D)), null, null);
            assertEquals("f((a, b), c, k=d)", call.toString());
        }
    }

    @Nested
    @DisplayName("tuples")
    class Tuples {

        @Test
        void empty() {
            assertEquals("()", new Expr.Tuple(List.of()).toString());
        }

        @Test
        void single() {
            assertEquals("a,", new Expr.Tuple(List.of(A)).toString());
        }

        @Test
        void pair() {
            assertEquals("a, b", new Expr.Tuple(List.of(A, B)).toString());
        }
    }

    @Nested
    @DisplayName("boolean combination")
    class Combination {

        @Test
        @DisplayName("flattens a and (b and c)")
        void flattensAnd() {
            Expr e = Expr.and(A, Expr.and(B, C));
            assertEquals("a and b and c", e.toString());
        }

        @Test
        void keepsMixedOperators() {
            assertEquals("a or b and c", Expr.or(A, Expr.and(B, C))
                    .toString());
            assertEquals("(a or b) and c", Expr.and(Expr.or(A, B), C)
                    .toString());
        }

        @Test
        @DisplayName("merges a < b and b <= c into a chain")
        void mergesComparisons() {
            Expr e = Expr.and(new Expr.Compare(A, "<", B),
                    new Expr.Compare(B, "<=", C));
            assertEquals("a < b <= c", e.toString());
            assertTrue(e instanceof Expr.Compare);
        }

        @Test
        void keepsSeparateComparisons() {
            Expr e = Expr.and(new Expr.Compare(A, "<", B),
                    new Expr.Compare(C, "<", D));
            assertEquals("a < b and c < d", e.toString());
            assertFalse(e instanceof Expr.Compare);
        }
    }

    @Test
    void constantsUseLiterals() {
        assertEquals("\"it's\"", new Expr.Constant("it's").toString());
        assertEquals("None", new Expr.Constant(Py.None).toString());
        assertTrue(new Expr.Constant(Py.None).isNone());
    }

    @Test
    void namesCompareByText() {
        assertEquals(new Expr.Name("x"), new Expr.Name("x"));
        assertEquals(new Expr.Constant(1), new Expr.Constant(1));
    }
}
