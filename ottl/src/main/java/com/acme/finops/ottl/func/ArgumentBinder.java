package com.acme.finops.ottl.func;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.ExecContext;
import com.acme.finops.ottl.expr.Coercion;
import com.acme.finops.ottl.expr.Coercions;
import com.acme.finops.ottl.expr.ExprFunc;
import com.acme.finops.ottl.expr.GetSetter;
import com.acme.finops.ottl.expr.Getter;
import com.acme.finops.ottl.expr.LiteralGetter;
import com.acme.finops.ottl.expr.StandardTypedGetter;
import com.acme.finops.ottl.expr.TypedGetter;
import com.acme.finops.ottl.lang.Ast;
import com.acme.finops.ottl.pdata.Values;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Matches call-site arguments against a factory's {@link Signature} and instantiates the
 * function.
 *
 * <p>Positional arguments fill parameters in declaration order, named arguments bind by
 * name. Every required parameter must end up bound; optional ones may stay absent.</p>
 */
public final class ArgumentBinder<K> {
    private final Map<String, Factory<K>> factories;
    private final ValueCompiler<K> compiler;
    private final FunctionContext functionContext;

    public ArgumentBinder(Map<String, Factory<K>> factories, ValueCompiler<K> compiler, FunctionContext functionContext) {
        this.factories = Objects.requireNonNull(factories, "factories");
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.functionContext = Objects.requireNonNull(functionContext, "functionContext");
    }

    public ExprFunc<K> bind(Ast.Call call) throws ConfigException {
        Factory<K> factory = lookup(call.name());
        Signature signature = factory.signature();
        List<ArgSpec> params = signature.parameters();
        Ast.ValueNode[] slots = new Ast.ValueNode[params.size()];

        int positional = 0;
        for (Ast.Argument arg : call.arguments()) {
            if (arg.name() == null) {
                if (positional >= params.size()) {
                    throw new ConfigException("too many arguments for " + factory.name() + ": expected at most "
                        + params.size() + " but got " + call.arguments().size());
                }
                slots[positional++] = arg.value();
                continue;
            }
            int idx = signature.indexOf(arg.name());
            if (idx < 0) {
                throw new ConfigException("no parameter named " + arg.name() + " in function " + factory.name());
            }
            if (slots[idx] != null) {
                throw new ConfigException("parameter " + arg.name() + " of " + factory.name() + " is bound twice");
            }
            slots[idx] = arg.value();
        }

        Map<String, Object> bound = new LinkedHashMap<>();
        for (int i = 0; i < params.size(); i++) {
            ArgSpec spec = params.get(i);
            if (slots[i] == null) {
                if (!spec.optional()) {
                    throw new ConfigException("not enough arguments for " + factory.name() + ": missing " + spec.name());
                }
                continue;
            }
            bound.put(spec.name(), convertParsed(factory.name(), spec, slots[i]));
        }
        return create(factory, bound);
    }

    /**
     * Binds already-built getters positionally. Used by {@link FunctionGetter}.
     */
    public ExprFunc<K> bindGetters(String functionName, List<Getter<K>> getters) throws ConfigException {
        Factory<K> factory = lookup(functionName);
        List<ArgSpec> params = factory.signature().parameters();
        if (getters.size() > params.size()) {
            throw new ConfigException("too many arguments for " + functionName + ": expected at most "
                + params.size() + " but got " + getters.size());
        }
        Map<String, Object> bound = new LinkedHashMap<>();
        for (int i = 0; i < params.size(); i++) {
            ArgSpec spec = params.get(i);
            if (i >= getters.size()) {
                if (!spec.optional()) {
                    throw new ConfigException("not enough arguments for " + functionName + ": missing " + spec.name());
                }
                continue;
            }
            bound.put(spec.name(), convertGetter(functionName, spec, getters.get(i)));
        }
        return create(factory, bound);
    }

    private Factory<K> lookup(String name) throws ConfigException {
        Factory<K> factory = factories.get(name);
        if (factory == null) {
            throw new ConfigException("undefined function \"" + name + "\"");
        }
        return factory;
    }

    private ExprFunc<K> create(Factory<K> factory, Map<String, Object> bound) throws ConfigException {
        ExprFunc<K> fn = factory.createFunction(functionContext, new Arguments<>(factory.name(), bound));
        if (fn == null) {
            throw new ConfigException("function " + factory.name() + " returned no implementation");
        }
        return fn;
    }

    private Object convertParsed(String fn, ArgSpec spec, Ast.ValueNode node) throws ConfigException {
        return switch (spec.type()) {
            case GETTER -> compiler.compileValue(node);
            case GET_SETTER -> {
                if (!(node instanceof Ast.PathNode path)) {
                    throw argError(fn, spec, "must be a path");
                }
                GetSetter<K> target = compiler.compilePath(path);
                if (target.readOnly()) {
                    throw argError(fn, spec, "refers to a read-only path");
                }
                yield target;
            }
            case STRING_LITERAL -> {
                if (!(node instanceof Ast.StringLiteral s)) {
                    throw argError(fn, spec, "must be a string literal");
                }
                yield s.value();
            }
            case INT_LITERAL -> {
                if (!(node instanceof Ast.IntLiteral i)) {
                    throw argError(fn, spec, "must be an int literal");
                }
                yield i.value();
            }
            case FLOAT_LITERAL -> {
                if (node instanceof Ast.FloatLiteral f) {
                    yield f.value();
                }
                if (node instanceof Ast.IntLiteral i) {
                    yield (double) i.value();
                }
                throw argError(fn, spec, "must be a numeric literal");
            }
            case BOOL_LITERAL -> {
                if (!(node instanceof Ast.BoolLiteral b)) {
                    throw argError(fn, spec, "must be true or false");
                }
                yield b.value();
            }
            case ENUM -> {
                if (!(node instanceof Ast.EnumSymbol e)) {
                    throw argError(fn, spec, "must be an enum symbol");
                }
                yield compiler.resolveEnum(e);
            }
            case FUNCTION -> {
                if (!(node instanceof Ast.EnumSymbol e)) {
                    throw argError(fn, spec, "must be a converter name");
                }
                yield functionGetter(fn, spec, e.name());
            }
            case GETTER_LIST -> {
                List<Getter<K>> out = new ArrayList<>();
                for (Ast.ValueNode item : listItems(fn, spec, node)) {
                    out.add(compiler.compileValue(item));
                }
                yield List.copyOf(out);
            }
            case STRING_GETTER_LIST, STRING_LIKE_GETTER_LIST -> {
                Coercion<String> c = spec.type() == ArgType.STRING_GETTER_LIST ? Coercions.STRING : Coercions.STRING_LIKE;
                List<TypedGetter<K, String>> out = new ArrayList<>();
                for (Ast.ValueNode item : listItems(fn, spec, node)) {
                    out.add(StandardTypedGetter.of(compiler.compileValue(item), c));
                }
                yield List.copyOf(out);
            }
            case STRING_LITERAL_LIST -> {
                List<String> out = new ArrayList<>();
                for (Ast.ValueNode item : listItems(fn, spec, node)) {
                    if (!(item instanceof Ast.StringLiteral s)) {
                        throw argError(fn, spec, "must be a list of string literals");
                    }
                    out.add(s.value());
                }
                yield List.copyOf(out);
            }
            default -> typed(spec.type(), compiler.compileValue(node));
        };
    }

    private Object convertGetter(String fn, ArgSpec spec, Getter<K> getter) throws ConfigException {
        return switch (spec.type()) {
            case GETTER -> getter;
            case GET_SETTER -> {
                if (!(getter instanceof GetSetter<K> gs) || gs.readOnly()) {
                    throw argError(fn, spec, "must be a writable path");
                }
                yield gs;
            }
            case STRING_LITERAL, INT_LITERAL, FLOAT_LITERAL, BOOL_LITERAL -> literalValue(fn, spec, getter);
            case ENUM, FUNCTION, GETTER_LIST, STRING_GETTER_LIST, STRING_LIKE_GETTER_LIST, STRING_LITERAL_LIST ->
                throw argError(fn, spec, "cannot be supplied by a function argument");
            default -> typed(spec.type(), getter);
        };
    }

    private Object literalValue(String fn, ArgSpec spec, Getter<K> getter) throws ConfigException {
        if (!LiteralGetter.isLiteral(getter)) {
            throw argError(fn, spec, "must be a literal");
        }
        Object v;
        try {
            v = getter.get(ExecContext.background(), null);
        } catch (EvaluationException e) {
            throw new ConfigException("unable to evaluate literal argument " + spec.name() + " of " + fn, e);
        }
        boolean ok = switch (spec.type()) {
            case STRING_LITERAL -> v instanceof String;
            case INT_LITERAL -> v instanceof Long;
            case FLOAT_LITERAL -> v instanceof Double || v instanceof Long;
            case BOOL_LITERAL -> v instanceof Boolean;
            default -> false;
        };
        if (!ok) {
            throw argError(fn, spec, "has the wrong literal type " + Values.typeName(v));
        }
        if (spec.type() == ArgType.FLOAT_LITERAL && v instanceof Long l) {
            return l.doubleValue();
        }
        return v;
    }

    private TypedGetter<K, ?> typed(ArgType type, Getter<K> getter) {
        return switch (type) {
            case STRING -> StandardTypedGetter.of(getter, Coercions.STRING);
            case STRING_LIKE -> StandardTypedGetter.of(getter, Coercions.STRING_LIKE);
            case INT -> StandardTypedGetter.of(getter, Coercions.INT);
            case INT_LIKE -> StandardTypedGetter.of(getter, Coercions.INT_LIKE);
            case FLOAT -> StandardTypedGetter.of(getter, Coercions.FLOAT);
            case FLOAT_LIKE -> StandardTypedGetter.of(getter, Coercions.FLOAT_LIKE);
            case BOOL -> StandardTypedGetter.of(getter, Coercions.BOOL);
            case BOOL_LIKE -> StandardTypedGetter.of(getter, Coercions.BOOL_LIKE);
            case BYTES_LIKE -> StandardTypedGetter.of(getter, Coercions.BYTES_LIKE);
            case TIME -> StandardTypedGetter.of(getter, Coercions.TIME);
            case DURATION -> StandardTypedGetter.of(getter, Coercions.DURATION);
            case MAP -> StandardTypedGetter.of(getter, Coercions.MAP);
            case SLICE -> StandardTypedGetter.of(getter, Coercions.SLICE);
            default -> throw new IllegalArgumentException("not a typed getter parameter: " + type);
        };
    }

    private FunctionGetter<K> functionGetter(String fn, ArgSpec spec, String name) throws ConfigException {
        Factory<K> target = factories.get(name);
        if (target == null || !Character.isUpperCase(name.charAt(0))) {
            throw argError(fn, spec, "names unknown converter " + name);
        }
        ArgumentBinder<K> binder = this;
        return new FunctionGetter<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public ExprFunc<K> instantiate(List<Getter<K>> arguments) throws ConfigException {
                return binder.bindGetters(name, arguments);
            }
        };
    }

    private List<Ast.ValueNode> listItems(String fn, ArgSpec spec, Ast.ValueNode node) throws ConfigException {
        if (!(node instanceof Ast.ListNode list)) {
            throw argError(fn, spec, "must be a list");
        }
        return list.values();
    }

    private static ConfigException argError(String fn, ArgSpec spec, String problem) {
        return new ConfigException("argument " + spec.name() + " of " + fn + " " + problem);
    }
}
