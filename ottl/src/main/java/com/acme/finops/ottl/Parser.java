package com.acme.finops.ottl;

import com.acme.finops.ottl.expr.BoolExpr;
import com.acme.finops.ottl.expr.BoolExprs;
import com.acme.finops.ottl.expr.Comparisons;
import com.acme.finops.ottl.expr.ExprFunc;
import com.acme.finops.ottl.expr.GetSetter;
import com.acme.finops.ottl.expr.Getter;
import com.acme.finops.ottl.expr.Getters;
import com.acme.finops.ottl.expr.Literal;
import com.acme.finops.ottl.func.ArgumentBinder;
import com.acme.finops.ottl.func.Factory;
import com.acme.finops.ottl.func.FunctionContext;
import com.acme.finops.ottl.func.ValueCompiler;
import com.acme.finops.ottl.lang.Ast;
import com.acme.finops.ottl.lang.Grammar;
import com.acme.finops.ottl.path.EnumParser;
import com.acme.finops.ottl.path.Indexing;
import com.acme.finops.ottl.path.Key;
import com.acme.finops.ottl.path.Keys;
import com.acme.finops.ottl.path.ParsedPath;
import com.acme.finops.ottl.path.PathResolver;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compiles OTTL text into executable statements, conditions and value expressions for one
 * transform context type.
 *
 * <p>A parser is immutable and may be shared. Everything it returns is safe for concurrent
 * evaluation.</p>
 *
 * @param <K> the transform context
 */
public final class Parser<K> {
    private final String contextName;
    private final Map<String, Factory<K>> functions;
    private final PathResolver<K> pathResolver;
    private final EnumParser enumParser;
    private final Compiler compiler;
    private final ArgumentBinder<K> binder;

    private Parser(Builder<K> builder) {
        this.contextName = builder.contextName;
        this.functions = Map.copyOf(builder.functions);
        this.pathResolver = builder.pathResolver;
        this.enumParser = builder.enumParser;
        this.compiler = new Compiler();
        this.binder = new ArgumentBinder<>(functions, compiler, new FunctionContext(contextName));
    }

    public static <K> Builder<K> builder(String contextName, PathResolver<K> pathResolver) {
        return new Builder<>(contextName, pathResolver);
    }

    public String contextName() {
        return contextName;
    }

    public Map<String, Factory<K>> functions() {
        return functions;
    }

    public Statement<K> parseStatement(String text) throws ConfigException {
        try {
            Ast.Statement ast = Grammar.parseStatement(text);
            ExprFunc<K> fn = binder.bind(ast.editor());
            BoolExpr<K> where = ast.whereClause() == null
                ? BoolExprs.alwaysTrue()
                : compileBoolExpression(ast.whereClause());
            return new Statement<>(fn, where, text);
        } catch (ConfigException e) {
            throw e.withSource(text);
        }
    }

    /**
     * Parses every statement and reports all failures together.
     */
    public List<Statement<K>> parseStatements(List<String> texts) throws ConfigException {
        List<Statement<K>> out = new ArrayList<>(texts.size());
        List<String> errors = new ArrayList<>();
        for (String text : texts) {
            try {
                out.add(parseStatement(text));
            } catch (ConfigException e) {
                errors.add(e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            throw new ConfigException("unable to parse OTTL statements: " + String.join("; ", errors));
        }
        return List.copyOf(out);
    }

    public Condition<K> parseCondition(String text) throws ConfigException {
        try {
            return new Condition<>(compileBoolExpression(Grammar.parseCondition(text)), text);
        } catch (ConfigException e) {
            throw e.withSource(text);
        }
    }

    public List<Condition<K>> parseConditions(List<String> texts) throws ConfigException {
        List<Condition<K>> out = new ArrayList<>(texts.size());
        List<String> errors = new ArrayList<>();
        for (String text : texts) {
            try {
                out.add(parseCondition(text));
            } catch (ConfigException e) {
                errors.add(e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            throw new ConfigException("unable to parse OTTL conditions: " + String.join("; ", errors));
        }
        return List.copyOf(out);
    }

    public ValueExpression<K> parseValueExpression(String text) throws ConfigException {
        try {
            return new ValueExpression<>(compiler.compileValue(Grammar.parseValue(text)), text);
        } catch (ConfigException e) {
            throw e.withSource(text);
        }
    }

    // boolean expressions

    private BoolExpr<K> compileBoolExpression(Ast.BoolExpression expr) throws ConfigException {
        List<BoolExpr<K>> terms = new ArrayList<>(expr.terms().size());
        for (Ast.Term term : expr.terms()) {
            List<BoolExpr<K>> factors = new ArrayList<>(term.factors().size());
            for (Ast.BoolFactor factor : term.factors()) {
                BoolExpr<K> e = compileOperand(factor.operand());
                factors.add(factor.negated() ? BoolExprs.not(e) : e);
            }
            terms.add(BoolExprs.and(factors));
        }
        return BoolExprs.or(terms);
    }

    private BoolExpr<K> compileOperand(Ast.BoolOperand operand) throws ConfigException {
        if (operand instanceof Ast.Comparison c) {
            Getter<K> left = compiler.compileValue(c.left());
            Getter<K> right = compiler.compileValue(c.right());
            return (ctx, tCtx) -> Comparisons.compare(left.get(ctx, tCtx), right.get(ctx, tCtx), c.op());
        }
        if (operand instanceof Ast.ConstBool b) {
            return b.value() ? BoolExprs.alwaysTrue() : BoolExprs.alwaysFalse();
        }
        if (operand instanceof Ast.BoolCall call) {
            Getter<K> converter = compiler.compileValue(call.converter());
            String name = call.converter().name();
            return (ctx, tCtx) -> {
                Object v = converter.get(ctx, tCtx);
                if (v instanceof Boolean b) {
                    return b;
                }
                throw TypeError.expected("bool from converter " + name, v);
            };
        }
        return compileBoolExpression(((Ast.Grouped) operand).expression());
    }

    private final class Compiler implements ValueCompiler<K> {

        @Override
        public Getter<K> compileValue(Ast.ValueNode node) throws ConfigException {
            if (node instanceof Ast.NilLiteral) {
                return Literal.of(null);
            }
            if (node instanceof Ast.StringLiteral s) {
                return Literal.of(s.value());
            }
            if (node instanceof Ast.IntLiteral i) {
                return Literal.of(i.value());
            }
            if (node instanceof Ast.FloatLiteral f) {
                return Literal.of(f.value());
            }
            if (node instanceof Ast.BoolLiteral b) {
                return Literal.of(b.value());
            }
            if (node instanceof Ast.BytesLiteral b) {
                return Literal.of(b.value());
            }
            if (node instanceof Ast.EnumSymbol e) {
                return Literal.of(resolveEnum(e));
            }
            if (node instanceof Ast.PathNode p) {
                return compilePath(p);
            }
            if (node instanceof Ast.Call call) {
                return compileConverter(call);
            }
            if (node instanceof Ast.ListNode list) {
                List<Getter<K>> items = new ArrayList<>(list.values().size());
                for (Ast.ValueNode item : list.values()) {
                    items.add(compileValue(item));
                }
                return Getters.list(items);
            }
            if (node instanceof Ast.MapNode map) {
                Map<String, Getter<K>> entries = new LinkedHashMap<>();
                for (Map.Entry<String, Ast.ValueNode> e : map.entries().entrySet()) {
                    entries.put(e.getKey(), compileValue(e.getValue()));
                }
                return Getters.map(entries);
            }
            if (node instanceof Ast.MathNode m) {
                return Getters.math(compileValue(m.left()), m.op(), compileValue(m.right()));
            }
            return Getters.negate(compileValue(((Ast.NegateNode) node).operand()));
        }

        @Override
        public GetSetter<K> compilePath(Ast.PathNode node) throws ConfigException {
            List<Ast.Field> fields = node.fields();
            String context = "";
            if (fields.size() > 1 && fields.get(0).name().equals(contextName) && fields.get(0).keys().isEmpty()) {
                context = contextName;
                fields = fields.subList(1, fields.size());
            }
            String text = render(node.fields());
            ParsedPath<K> next = null;
            for (int i = fields.size() - 1; i >= 0; i--) {
                Ast.Field f = fields.get(i);
                next = new ParsedPath<>(context, f.name(), compileKeys(f.keys()), next, text);
            }
            GetSetter<K> resolved = pathResolver.resolve(next);
            if (resolved == null) {
                throw new ConfigException("path " + text + " could not be resolved for context " + contextName);
            }
            return resolved;
        }

        @Override
        public long resolveEnum(Ast.EnumSymbol symbol) throws ConfigException {
            return enumParser.parse(symbol.name());
        }

        private Getter<K> compileConverter(Ast.Call call) throws ConfigException {
            if (call.isEditor()) {
                throw new ConfigException("converter names must start with an uppercase letter but got '"
                    + call.name() + "'");
            }
            ExprFunc<K> fn = binder.bind(call);
            if (call.keys().isEmpty()) {
                return fn::eval;
            }
            List<Key<K>> keys = compileKeys(call.keys());
            return (ctx, tCtx) -> Indexing.getStrict(ctx, tCtx, fn.eval(ctx, tCtx), keys);
        }

        private List<Key<K>> compileKeys(List<Ast.KeyNode> keyNodes) throws ConfigException {
            List<Key<K>> keys = new ArrayList<>(keyNodes.size());
            for (Ast.KeyNode k : keyNodes) {
                if (k.stringKey() != null) {
                    keys.add(Keys.of(k.stringKey()));
                } else if (k.intKey() != null) {
                    keys.add(Keys.of(k.intKey()));
                } else {
                    keys.add(Keys.dynamic(compileValue(k.expression())));
                }
            }
            return keys;
        }

        private String render(List<Ast.Field> fields) {
            StringBuilder sb = new StringBuilder();
            for (Ast.Field f : fields) {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(f.name());
                for (Ast.KeyNode k : f.keys()) {
                    if (k.stringKey() != null) {
                        sb.append("[\"").append(k.stringKey()).append("\"]");
                    } else if (k.intKey() != null) {
                        sb.append('[').append(k.intKey()).append(']');
                    } else {
                        sb.append("[...]");
                    }
                }
            }
            return sb.toString();
        }
    }

    public static final class Builder<K> {
        private final String contextName;
        private final PathResolver<K> pathResolver;
        private Map<String, Factory<K>> functions = Map.of();
        private EnumParser enumParser = EnumParser.none();

        private Builder(String contextName, PathResolver<K> pathResolver) {
            this.contextName = Objects.requireNonNull(contextName, "contextName");
            this.pathResolver = Objects.requireNonNull(pathResolver, "pathResolver");
        }

        public Builder<K> functions(Map<String, Factory<K>> functions) {
            this.functions = Objects.requireNonNull(functions, "functions");
            return this;
        }

        public Builder<K> enumParser(EnumParser enumParser) {
            this.enumParser = Objects.requireNonNull(enumParser, "enumParser");
            return this;
        }

        public Parser<K> build() {
            return new Parser<>(this);
        }
    }
}
