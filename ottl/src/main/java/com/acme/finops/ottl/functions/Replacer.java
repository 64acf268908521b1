package com.acme.finops.ottl.functions;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.ExecContext;
import com.acme.finops.ottl.expr.ExprFunc;
import com.acme.finops.ottl.expr.Getter;
import com.acme.finops.ottl.expr.TypedGetter;
import com.acme.finops.ottl.func.Arguments;
import com.acme.finops.ottl.func.FunctionGetter;
import com.acme.finops.ottl.pdata.Values;

import java.util.IllegalFormatException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes replacement text for the replace_* editors: the template, optionally passed
 * through a converter such as {@code SHA256} and then through a format string.
 */
final class Replacer<K> {
    static final String REPLACEMENT = "replacement";
    static final String FUNCTION = "function";
    static final String REPLACEMENT_FORMAT = "replacement_format";

    private final TypedGetter<K, String> replacement;
    private final String functionName;
    private final ExprFunc<K> function;
    private final ThreadLocal<String> current;
    private final TypedGetter<K, String> format;

    private Replacer(TypedGetter<K, String> replacement, String functionName, ExprFunc<K> function,
                     ThreadLocal<String> current, TypedGetter<K, String> format) {
        this.replacement = replacement;
        this.functionName = functionName;
        this.function = function;
        this.current = current;
        this.format = format;
    }

    static <K> Replacer<K> from(String functionName, Arguments<K> args) throws ConfigException {
        TypedGetter<K, String> replacement = args.get(REPLACEMENT);
        FunctionGetter<K> function = args.<FunctionGetter<K>>optional(FUNCTION).orElse(null);
        TypedGetter<K, String> format = args.<TypedGetter<K, String>>optional(REPLACEMENT_FORMAT).orElse(null);
        if (format != null && function == null) {
            throw new ConfigException(REPLACEMENT_FORMAT + " of " + functionName + " requires " + FUNCTION);
        }
        if (function == null) {
            return new Replacer<>(replacement, null, null, null, format);
        }
        // the converter reads the text being replaced from the calling thread
        ThreadLocal<String> current = new ThreadLocal<>();
        Getter<K> text = (ctx, tCtx) -> current.get();
        ExprFunc<K> bound = function.instantiate(List.of(text));
        return new Replacer<>(replacement, function.name(), bound, current, format);
    }

    /**
     * Replaces every match of {@code pattern} in {@code input}.
     */
    String replaceAll(ExecContext ctx, K tCtx, Pattern pattern, String input) throws EvaluationException {
        String template = replacement.get(ctx, tCtx);
        if (template == null) {
            return input;
        }
        Matcher m = pattern.matcher(input);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String text = transform(ctx, tCtx, Patterns.expand(m, template));
            m.appendReplacement(out, Matcher.quoteReplacement(text));
        }
        m.appendTail(out);
        return out.toString();
    }

    /**
     * Replacement for a value matched as a whole.
     */
    String whole(ExecContext ctx, K tCtx) throws EvaluationException {
        String template = replacement.get(ctx, tCtx);
        if (template == null) {
            return null;
        }
        return transform(ctx, tCtx, template);
    }

    private String transform(ExecContext ctx, K tCtx, String text) throws EvaluationException {
        if (function == null) {
            return text;
        }
        String previous = current.get();
        current.set(text);
        Object result;
        try {
            result = function.eval(ctx, tCtx);
        } finally {
            if (previous == null) {
                current.remove();
            } else {
                current.set(previous);
            }
        }
        if (!(result instanceof String s)) {
            throw new EvaluationException("replacement value from " + functionName + " is not a string but "
                + Values.typeName(result));
        }
        if (format == null) {
            return s;
        }
        String fmt = format.get(ctx, tCtx);
        if (fmt == null) {
            return s;
        }
        try {
            return String.format(Locale.ROOT, fmt, s);
        } catch (IllegalFormatException e) {
            throw new EvaluationException("invalid replacement format " + fmt, e);
        }
    }
}
