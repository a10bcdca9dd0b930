// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3.stringlib;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

import uk.co.farowl.unpyc3.CodeObject;
import uk.co.farowl.unpyc3.Py;
import uk.co.farowl.unpyc3.PyBytes;
import uk.co.farowl.unpyc3.PyComplex;

/**
 * Python source text for constant values, following the rules of
 * {@code repr()} in CPython, so that the text reads back as an equal
 * value. The Java representation of each Python type is the one used for
 * the constants of a {@link CodeObject}.
 */
public class Literal {

    private Literal() {} // no instances

    /** The fences we may put around a docstring, in order of choice. */
    private static final String[] FENCES = {"'''", "\"\"\""};

    /**
     * The Python {@code repr()} of a constant.
     *
     * @param v the value
     * @return source text for the value
     */
    public static String repr(Object v) {
        if (v instanceof String s) {
            return repr(s);
        } else if (v instanceof Boolean b) {
            return b ? "True" : "False";
        } else if (v instanceof Integer || v instanceof Long
                || v instanceof BigInteger) {
            return v.toString();
        } else if (v instanceof Double d) {
            return repr(d.doubleValue());
        } else if (v instanceof PyComplex c) {
            return repr(c);
        } else if (v instanceof PyBytes b) {
            return repr(b);
        } else if (v instanceof List<?> tuple) {
            return reprTuple(tuple);
        } else if (v instanceof Set<?> set) {
            if (set.isEmpty()) { return "frozenset()"; }
            StringJoiner sj = new StringJoiner(", ", "frozenset({", "})");
            for (Object x : set) { sj.add(repr(x)); }
            return sj.toString();
        } else if (v instanceof Map<?, ?> map) {
            StringJoiner sj = new StringJoiner(", ", "{", "}");
            for (Map.Entry<?, ?> e : map.entrySet()) {
                sj.add(repr(e.getKey()) + ": " + repr(e.getValue()));
            }
            return sj.toString();
        } else if (v instanceof Py.Singleton || v instanceof CodeObject) {
            return v.toString();
        } else {
            throw new IllegalArgumentException(
                    "no literal for " + (v == null ? "null"
                            : v.getClass().getSimpleName()));
        }
    }

    private static String reprTuple(List<?> tuple) {
        if (tuple.size() == 1) { return "(" + repr(tuple.get(0)) + ",)"; }
        StringJoiner sj = new StringJoiner(", ", "(", ")");
        for (Object x : tuple) { sj.add(repr(x)); }
        return sj.toString();
    }

    /**
     * The {@code repr()} of a {@code str}. The quote is {@code '} unless
     * the text contains {@code '} and not {@code "}.
     *
     * @param s the value
     * @return quoted and escaped text
     */
    public static String repr(String s) {
        char quote = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder sb = new StringBuilder(s.length() + 2).append(quote);
        s.codePoints().forEach(c -> {
            if (c == quote || c == '\\') {
                sb.append('\\').appendCodePoint(c);
            } else if (!escapeControl(sb, c) && !isPrintable(c)) {
                escapeCodePoint(sb, c);
            } else if (c >= 0x20 && c != 0x7f) {
                sb.appendCodePoint(c);
            }
        });
        return sb.append(quote).toString();
    }

    /**
     * Append the escape for tab, newline, carriage return or another
     * ASCII control character, if {@code c} is one.
     *
     * @return whether {@code c} was escaped
     */
    private static boolean escapeControl(StringBuilder sb, int c) {
        switch (c) {
            case '\t' -> sb.append("\\t");
            case '\n' -> sb.append("\\n");
            case '\r' -> sb.append("\\r");
            default -> {
                if (c < 0x20 || c == 0x7f) {
                    sb.append(String.format("\\x%02x", c));
                } else {
                    return false;
                }
            }
        }
        return true;
    }

    /** Append {@code \xhh}, {@code \\uhhhh} or {@code \\Uhhhhhhhh}. */
    private static void escapeCodePoint(StringBuilder sb, int c) {
        if (c < 0x100) {
            sb.append(String.format("\\x%02x", c));
        } else if (c < 0x10000) {
            sb.append(String.format("\\u%04x", c));
        } else {
            sb.append(String.format("\\U%08x", c));
        }
    }

    /**
     * Approximately Python {@code str.isprintable()} for one character:
     * everything except separators (other than space), controls, format
     * characters, surrogates, private use and unassigned code points.
     */
    private static boolean isPrintable(int c) {
        if (c == ' ') { return true; }
        return switch (Character.getType(c)) {
            case Character.CONTROL, Character.FORMAT, Character.SURROGATE,
                    Character.PRIVATE_USE, Character.UNASSIGNED,
                    Character.LINE_SEPARATOR,
                    Character.PARAGRAPH_SEPARATOR,
                    Character.SPACE_SEPARATOR -> false;
            default -> true;
        };
    }

    /**
     * The {@code repr()} of a {@code bytes}.
     *
     * @param b the value
     * @return {@code b'...'} text
     */
    public static String repr(PyBytes b) {
        boolean single = false, dbl = false;
        for (int i = 0; i < b.size(); i++) {
            single |= b.get(i) == '\'';
            dbl |= b.get(i) == '"';
        }
        char quote = single && !dbl ? '"' : '\'';
        StringBuilder sb = new StringBuilder("b").append(quote);
        for (int i = 0; i < b.size(); i++) {
            int c = b.get(i);
            if (c == quote || c == '\\') {
                sb.append('\\').append((char)c);
            } else if (!escapeControl(sb, c)) {
                if (c >= 0x80) {
                    sb.append(String.format("\\x%02x", c));
                } else {
                    sb.append((char)c);
                }
            }
        }
        return sb.append(quote).toString();
    }

    /**
     * The {@code repr()} of a {@code float}: the shortest decimal that
     * reads back as the same value, in positional notation for decimal
     * exponents from -4 to 15, and otherwise in scientific notation. An
     * infinity or NaN, which have no literal, become a call to
     * {@code float()}.
     *
     * @param d the value
     * @return source text
     */
    public static String repr(double d) { return floatRepr(d, true); }

    /**
     * The {@code repr()} of a {@code complex}: {@code 2j} when the real
     * part is positive zero, and otherwise {@code (1+2j)}.
     *
     * @param c the value
     * @return source text
     */
    public static String repr(PyComplex c) {
        String imag = floatRepr(c.imag, false) + "j";
        if (c.real == 0.0 && 1.0 / c.real > 0) {
            return imag;
        }
        String sign = c.imag >= 0 || Double.isNaN(c.imag) ? "+" : "";
        return "(" + floatRepr(c.real, false) + sign + imag + ")";
    }

    private static String floatRepr(double d, boolean pointZero) {
        if (Double.isNaN(d)) {
            return pointZero ? "float('nan')" : "nan";
        } else if (Double.isInfinite(d)) {
            String inf = pointZero ? "float('inf')" : "inf";
            return d > 0 ? inf : "-" + inf;
        }

        String sign = Double.doubleToRawLongBits(d) < 0 ? "-" : "";
        if (d == 0.0) { return sign + (pointZero ? "0.0" : "0"); }

        BigDecimal v = new BigDecimal(Double.toString(Math.abs(d)))
                .stripTrailingZeros();
        String digits = v.unscaledValue().toString();
        // Decimal exponent of the leading digit
        int exp = digits.length() - 1 - v.scale();

        if (exp >= -4 && exp < 16) {
            String s = v.toPlainString();
            if (s.indexOf('.') < 0 && pointZero) { s += ".0"; }
            return sign + s;
        } else {
            StringBuilder sb = new StringBuilder(sign).append(digits, 0, 1);
            if (digits.length() > 1) {
                sb.append('.').append(digits, 1, digits.length());
            }
            sb.append(exp < 0 ? "e-" : "e+");
            sb.append(String.format("%02d", Math.abs(exp)));
            return sb.toString();
        }
    }

    /**
     * Source text for a docstring. A single line is written as its
     * {@code repr()}. Several lines are written between triple quotes of
     * a kind the text does not contain, each line escaped as by the
     * Python {@code unicode_escape} codec. If both kinds of triple quote
     * occur, we fall back to {@code repr()}.
     *
     * @param text of the docstring
     * @return source text
     */
    public static String docString(String text) {
        if (text.indexOf('\n') < 0) { return repr(text); }
        for (String fence : FENCES) {
            if (!text.contains(fence) && !text.endsWith(fence.substring(2))) {
                StringBuilder sb = new StringBuilder(fence);
                text.codePoints().forEach(c -> {
                    if (c == '\n') {
                        sb.append('\n');
                    } else if (c == '\\') {
                        sb.append("\\\\");
                    } else if (!escapeControl(sb, c)) {
                        if (c >= 0x7f) {
                            escapeCodePoint(sb, c);
                        } else {
                            sb.append((char)c);
                        }
                    }
                });
                return sb.append(fence).toString();
            }
        }
        return repr(text);
    }
}
