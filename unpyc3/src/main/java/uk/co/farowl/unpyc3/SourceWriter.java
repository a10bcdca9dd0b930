// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

import org.stringtemplate.v4.AutoIndentWriter;

import uk.co.farowl.unpyc3.support.InvariantError;

/**
 * A buffer of indented source lines. Writers at successive levels of
 * indentation, made by {@link #indent()}, share the same buffer. The
 * buffer records each line with its level, and the text is laid out
 * by a StringTemplate {@link AutoIndentWriter}, which indents every
 * line but a blank one.
 * <p>
 * The indentation step is 4 spaces unless the system property
 * {@value #INDENT_PROPERTY} gives another (positive) number.
 */
public class SourceWriter {

    /** Name of the system property that sets the indentation step. */
    public static final String INDENT_PROPERTY = "uk.co.farowl.unpyc3.indent";

    /** Default indentation step. */
    public static final int DEFAULT_STEP = 4;

    /**
     * A line of source and its level of indentation.
     *
     * @param level of indentation
     * @param text of the line (without indentation)
     */
    private record Line(int level, String text) {
        boolean isBlank() { return text.isEmpty(); }
    }

    /** Lines shared by the writers at every level. */
    private static class Buffer {
        final List<Line> lines = new ArrayList<>();
        /** Index of the most recent block header line. */
        int header = -1;
    }

    private final Buffer buffer;
    private final int level;
    private final int step;

    /** Create a writer at level zero with the configured step. */
    public SourceWriter() { this(configuredStep()); }

    /**
     * Create a writer at level zero.
     *
     * @param step spaces per level of indentation
     */
    public SourceWriter(int step) { this(new Buffer(), 0, step); }

    private SourceWriter(Buffer buffer, int level, int step) {
        this.buffer = buffer;
        this.level = level;
        this.step = step;
    }

    private static int configuredStep() {
        int step = Integer.getInteger(INDENT_PROPERTY, DEFAULT_STEP);
        return step > 0 ? step : DEFAULT_STEP;
    }

    /** @return a writer one level further indented, on the same buffer */
    public SourceWriter indent() {
        return new SourceWriter(buffer, level + 1, step);
    }

    /** @return the level of indentation of this writer */
    public int level() { return level; }

    /**
     * Add a line at the indentation of this writer.
     *
     * @param line to add
     */
    public void line(String line) {
        buffer.lines.add(new Line(level, line));
    }

    /**
     * Add a line at the indentation of this writer.
     *
     * @param format a Java format string
     * @param args to insert in the format string
     */
    public void line(String format, Object... args) {
        line(String.format(format, args));
    }

    /**
     * Add a line that introduces an indented block (and ends in a
     * colon).
     *
     * @param format a Java format string
     * @param args to insert in the format string
     */
    public void header(String format, Object... args) {
        line(String.format(format, args));
        buffer.header = buffer.lines.size() - 1;
    }

    /**
     * Add a blank line, unless the buffer is empty, already ends in a
     * blank line or ends in a block header.
     */
    public void separate() {
        List<Line> lines = buffer.lines;
        int last = lines.size() - 1;
        if (last >= 0 && !lines.get(last).isBlank()
                && buffer.header != last) {
            lines.add(new Line(0, ""));
        }
    }

    /** @return the text, without trailing blank lines */
    @Override
    public String toString() {
        List<Line> lines = buffer.lines;
        int n = lines.size();
        while (n > 0 && lines.get(n - 1).isBlank()) { n--; }

        StringWriter text = new StringWriter();
        AutoIndentWriter out = new AutoIndentWriter(text, "\n");
        String unit = " ".repeat(step);
        int depth = 0;
        try {
            for (int i = 0; i < n; i++) {
                Line line = lines.get(i);
                if (i > 0) { out.write("\n"); }
                if (line.isBlank()) { continue; }
                for (; depth < line.level; depth++) {
                    out.pushIndentation(unit);
                }
                for (; depth > line.level; depth--) {
                    out.popIndentation();
                }
                int nl = line.text.indexOf('\n');
                if (nl < 0) {
                    out.write(line.text);
                } else {
                    // Continuation lines of a string literal are verbatim
                    out.write(line.text.substring(0, nl));
                    for (; depth > 0; depth--) { out.popIndentation(); }
                    out.write(line.text.substring(nl));
                }
            }
        } catch (IOException e) {
            throw new InvariantError(e, "writing source to a string");
        }
        return text.toString();
    }
}
