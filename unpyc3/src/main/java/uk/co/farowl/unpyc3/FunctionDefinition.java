// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * What {@code MAKE_FUNCTION} (or {@code MAKE_CLOSURE}) gathers together
 * to create a function: the nested unit, default values for positional
 * and keyword-only parameters and annotations. It is shared by the
 * {@code def} statement and the {@code lambda} expression, and knows how
 * to render the parameter list.
 */
final class FunctionDefinition {

    /** The unit that is the body of the function. */
    final CompiledUnit unit;
    /** Defaults of the last positional parameters. */
    final List<Expr> defaults;
    /** Defaults of keyword-only parameters, by name. */
    final Map<String, Expr> kwdefaults;
    /** Annotations by parameter name (and {@code "return"}). */
    final Map<String, Expr> annotations;

    /**
     * @param unit that is the body of the function
     * @param defaults of the last positional parameters
     * @param kwdefaults of keyword-only parameters
     * @param annotations by parameter name
     */
    FunctionDefinition(CompiledUnit unit, List<Expr> defaults,
            Map<String, Expr> kwdefaults, Map<String, Expr> annotations) {
        this.unit = unit;
        this.defaults = List.copyOf(defaults);
        this.kwdefaults = Map.copyOf(kwdefaults);
        this.annotations = Map.copyOf(annotations);
    }

    /** @return the name of the function (from the code object) */
    String name() { return unit.name(); }

    /**
     * The parameters as they should be written in the definition, in
     * order, including any {@code *} or {@code **} parameters.
     *
     * @param annotated whether to include annotations
     * @return the parameters
     */
    List<String> parameters(boolean annotated) {
        CodeObject code = unit.code();
        List<String> varnames = code.varnames;
        List<String> params = new ArrayList<>();

        int n = code.argcount;
        int firstDefault = n - defaults.size();
        for (int i = 0; i < n; i++) {
            String name = varnames.get(i);
            Expr d = i >= firstDefault ? defaults.get(i - firstDefault)
                    : null;
            params.add(parameter(name, d, annotated));
        }

        List<String> kwparams = new ArrayList<>();
        for (int i = 0; i < code.kwonlyargcount; i++) {
            String name = varnames.get(n + i);
            kwparams.add(parameter(name, kwdefaults.get(name), annotated));
        }
        n += code.kwonlyargcount;

        if (code.has(CodeObject.CO_VARARGS)) {
            params.add("*" + parameter(varnames.get(n++), null, annotated));
        } else if (!kwparams.isEmpty()) {
            params.add("*");
        }
        params.addAll(kwparams);

        if (code.has(CodeObject.CO_VARKEYWORDS)) {
            params.add("**" + parameter(varnames.get(n), null, annotated));
        }
        return params;
    }

    /**
     * One parameter, with its annotation and default value if any.
     *
     * @param name of the parameter
     * @param dflt default value or {@code null}
     * @param annotated whether to include the annotation
     * @return rendered parameter
     */
    private String parameter(String name, Expr dflt, boolean annotated) {
        Expr ann = annotated ? annotations.get(name) : null;
        String p = name;
        if (ann != null) {
            p += ": " + ann.wrapAtMost(Precedence.TUPLE);
            if (dflt != null) {
                p += " = " + dflt.wrapAtMost(Precedence.TUPLE);
            }
        } else if (dflt != null) {
            p += "=" + dflt.wrapAtMost(Precedence.TUPLE);
        }
        return p;
    }

    /** @return the return annotation or {@code null} */
    Expr returnAnnotation() { return annotations.get("return"); }

    /**
     * The docstring of the function: constant zero if that is a
     * {@code str}. The compiler places {@code None} there otherwise.
     *
     * @return the docstring or {@code null}
     */
    String docString() {
        List<Object> consts = unit.code().consts;
        return !consts.isEmpty() && consts.get(0) instanceof String s ? s
                : null;
    }
}
