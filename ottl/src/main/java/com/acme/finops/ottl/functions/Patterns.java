package com.acme.finops.ottl.functions;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.ExecContext;
import com.acme.finops.ottl.expr.TypedGetter;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Regex and glob compilation shared by the matching functions.
 */
final class Patterns {
    private Patterns() {
    }

    /**
     * Source of a compiled pattern for one evaluation.
     */
    @FunctionalInterface
    interface PatternSource<K> {
        Pattern get(ExecContext ctx, K tCtx) throws EvaluationException;
    }

    static Pattern regex(String function, String regex) throws ConfigException {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ConfigException("the regex pattern supplied to " + function + " is not a valid pattern: "
                + e.getDescription(), e);
        }
    }

    /**
     * Compiles a literal pattern once; a dynamic pattern is compiled on every evaluation.
     */
    static <K> PatternSource<K> regex(String function, TypedGetter<K, String> pattern) throws ConfigException {
        if (pattern.isLiteral()) {
            String literal;
            try {
                literal = pattern.get(ExecContext.background(), null);
            } catch (EvaluationException e) {
                throw new ConfigException("the pattern supplied to " + function + " must be a string", e);
            }
            Pattern compiled = regex(function, literal);
            return (ctx, tCtx) -> compiled;
        }
        return (ctx, tCtx) -> {
            String raw = pattern.get(ctx, tCtx);
            try {
                return Pattern.compile(raw);
            } catch (PatternSyntaxException e) {
                throw new EvaluationException("the regex pattern supplied to " + function
                    + " is not a valid pattern: " + e.getDescription(), e);
            }
        };
    }

    static Pattern glob(String function, String glob) throws ConfigException {
        try {
            return Pattern.compile(globToRegex(glob), Pattern.DOTALL);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("the glob pattern supplied to " + function + " is not valid: " + e.getMessage(), e);
        }
    }

    /**
     * Translates a glob ({@code *}, {@code ?}, {@code [...]}, {@code {a,b}}, backslash escapes)
     * into an anchored regex.
     */
    static String globToRegex(String glob) {
        StringBuilder sb = new StringBuilder("^");
        int braces = 0;
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            switch (c) {
                case '*' -> sb.append(".*");
                case '?' -> sb.append('.');
                case '[' -> {
                    int close = glob.indexOf(']', i + 1);
                    if (close < 0) {
                        throw new IllegalArgumentException("unclosed '[' at " + i);
                    }
                    String body = glob.substring(i + 1, close);
                    if (body.startsWith("!")) {
                        body = "^" + body.substring(1);
                    }
                    sb.append('[').append(body.replace("\\", "\\\\").replace("[", "\\[")).append(']');
                    i = close;
                }
                case '{' -> {
                    braces++;
                    sb.append("(?:");
                }
                case '}' -> {
                    if (braces == 0) {
                        throw new IllegalArgumentException("unbalanced '}' at " + i);
                    }
                    braces--;
                    sb.append(')');
                }
                case ',' -> sb.append(braces > 0 ? "|" : ",");
                case '\\' -> {
                    if (i + 1 < glob.length()) {
                        sb.append(Pattern.quote(String.valueOf(glob.charAt(++i))));
                    } else {
                        sb.append("\\\\");
                    }
                }
                default -> {
                    if (".+()|^$".indexOf(c) >= 0) {
                        sb.append('\\');
                    }
                    sb.append(c);
                }
            }
        }
        if (braces != 0) {
            throw new IllegalArgumentException("unclosed '{'");
        }
        return sb.append('$').toString();
    }

    /**
     * Expands {@code $1}, {@code ${1}}, {@code $name}, {@code ${name}} and {@code $$} in a
     * replacement template against the current match. Unknown groups expand to nothing.
     */
    static String expand(Matcher m, String template) {
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c != '$' || i + 1 >= template.length()) {
                out.append(c);
                i++;
                continue;
            }
            char next = template.charAt(i + 1);
            if (next == '$') {
                out.append('$');
                i += 2;
                continue;
            }
            String name;
            if (next == '{') {
                int close = template.indexOf('}', i + 2);
                if (close < 0) {
                    out.append(c);
                    i++;
                    continue;
                }
                name = template.substring(i + 2, close);
                i = close + 1;
            } else {
                int end = i + 1;
                while (end < template.length() && isNameChar(template.charAt(end))) {
                    end++;
                }
                if (end == i + 1) {
                    out.append(c);
                    i++;
                    continue;
                }
                name = template.substring(i + 1, end);
                i = end;
            }
            String group = group(m, name);
            if (group != null) {
                out.append(group);
            }
        }
        return out.toString();
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static String group(Matcher m, String name) {
        if (!name.isEmpty() && name.chars().allMatch(Character::isDigit)) {
            int idx;
            try {
                idx = Integer.parseInt(name);
            } catch (NumberFormatException e) {
                return null;
            }
            return idx <= m.groupCount() ? m.group(idx) : null;
        }
        try {
            return m.group(name);
        } catch (IllegalArgumentException e) {
            // no group with that name
            return null;
        }
    }
}
