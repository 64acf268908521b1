package com.acme.finops.ottl.transform;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.ErrorMode;
import com.acme.finops.ottl.contexts.DataPointContext;
import com.acme.finops.ottl.contexts.LogContext;
import com.acme.finops.ottl.contexts.MetricContext;
import com.acme.finops.ottl.contexts.ProfileContext;
import com.acme.finops.ottl.contexts.ResourceContext;
import com.acme.finops.ottl.contexts.ScopeContext;
import com.acme.finops.ottl.contexts.SpanContext;
import com.acme.finops.ottl.contexts.SpanEventContext;
import com.acme.finops.ottl.pdata.SignalKind;
import com.acme.finops.ottl.util.EnvVars;
import com.acme.finops.ottl.util.JsonCodec;
import com.acme.finops.ottl.util.OttlEnvKeys;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Transform processor configuration: per signal, an ordered list of statement groups.
 *
 * <pre>{@code
 * {
 *   "error_mode": "ignore",
 *   "trace_statements": [
 *     { "context": "span", "statements": ["set(attributes[\"env\"], \"prod\")"] }
 *   ]
 * }
 * }</pre>
 */
public record TransformConfig(ErrorMode errorMode, Map<SignalKind, List<ContextStatements>> statements) {

    public TransformConfig {
        Objects.requireNonNull(errorMode, "errorMode");
        EnumMap<SignalKind, List<ContextStatements>> copy = new EnumMap<>(SignalKind.class);
        for (SignalKind signal : SignalKind.values()) {
            copy.put(signal, List.copyOf(statements.getOrDefault(signal, List.of())));
        }
        statements = Collections.unmodifiableMap(copy);
    }

    public List<ContextStatements> statementsFor(SignalKind signal) {
        return statements.get(signal);
    }

    public TransformConfig withErrorMode(ErrorMode mode) {
        return new TransformConfig(mode, statements);
    }

    /**
     * Reads the file named by {@code OTTL_TRANSFORM_CONFIG_FILE}, or an empty configuration
     * when unset, then applies the {@code OTTL_TRANSFORM_ERROR_MODE} override.
     */
    public static TransformConfig load(Map<String, String> env) throws ConfigException {
        Objects.requireNonNull(env, "env");
        Optional<Path> file = EnvVars.getPath(env, OttlEnvKeys.OTTL_TRANSFORM_CONFIG_FILE);
        TransformConfig config;
        if (file.isPresent()) {
            try {
                config = parse(Files.readString(file.get(), StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new ConfigException("unable to read transform configuration " + file.get() + ": " + e.getMessage(), e);
            }
        } else {
            config = new TransformConfig(ErrorMode.PROPAGATE, Map.of());
        }
        String override = EnvVars.getOrDefault(env, OttlEnvKeys.OTTL_TRANSFORM_ERROR_MODE, "");
        if (!override.isEmpty()) {
            try {
                config = config.withErrorMode(ErrorMode.parse(override));
            } catch (IllegalArgumentException e) {
                throw new ConfigException(OttlEnvKeys.OTTL_TRANSFORM_ERROR_MODE + ": " + e.getMessage(), e);
            }
        }
        return config;
    }

    public static TransformConfig parse(String json) throws ConfigException {
        try {
            return fromJson(JsonCodec.readTree(json));
        } catch (JsonProcessingException e) {
            throw new ConfigException("invalid transform configuration JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static TransformConfig fromJson(JsonNode root) throws ConfigException {
        if (root == null || !root.isObject()) {
            throw new ConfigException("transform configuration must be a JSON object");
        }
        ErrorMode errorMode = errorMode(root.path("error_mode"));
        EnumMap<SignalKind, List<ContextStatements>> statements = new EnumMap<>(SignalKind.class);
        for (Section section : Section.values()) {
            statements.put(section.signal, readGroups(section, root.path(section.key)));
        }
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!"error_mode".equals(name) && Section.byKey(name) == null) {
                throw new ConfigException("unknown transform configuration key " + name);
            }
        }
        return new TransformConfig(errorMode, statements);
    }

    private static List<ContextStatements> readGroups(Section section, JsonNode node) throws ConfigException {
        List<ContextStatements> out = new ArrayList<>();
        if (node.isMissingNode() || node.isNull()) {
            return out;
        }
        if (!node.isArray()) {
            throw new ConfigException(section.key + " must be a list");
        }
        int i = 0;
        for (JsonNode group : node) {
            String where = section.key + "[" + i++ + "]";
            if (!group.isObject()) {
                throw new ConfigException(where + " must be an object");
            }
            JsonNode ctx = group.path("context");
            String context = ctx.isMissingNode() || ctx.isNull() || ctx.asText().isBlank()
                ? section.recordContext
                : section.context(ctx.asText().trim());
            List<String> stmts = strings(where + ".statements", group.path("statements"));
            List<String> conditions = strings(where + ".conditions", group.path("conditions"));
            JsonNode mode = group.path("error_mode");
            ErrorMode groupMode = mode.isMissingNode() || mode.isNull() ? null : errorMode(mode);
            if (!stmts.isEmpty()) {
                out.add(new ContextStatements(context, stmts, conditions, groupMode));
            }
        }
        return out;
    }

    private static List<String> strings(String where, JsonNode node) throws ConfigException {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ConfigException(where + " must be a list of strings");
        }
        List<String> out = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw new ConfigException(where + " must be a list of strings");
            }
            out.add(item.textValue());
        }
        return out;
    }

    private static ErrorMode errorMode(JsonNode node) throws ConfigException {
        if (node.isMissingNode() || node.isNull()) {
            return ErrorMode.PROPAGATE;
        }
        try {
            return ErrorMode.parse(node.asText());
        } catch (IllegalArgumentException e) {
            throw new ConfigException(e.getMessage(), e);
        }
    }

    private enum Section {
        TRACES(SignalKind.TRACES, "trace_statements", SpanContext.NAME, SpanContext.NAME, SpanEventContext.NAME),
        LOGS(SignalKind.LOGS, "log_statements", LogContext.NAME, LogContext.NAME),
        METRICS(SignalKind.METRICS, "metric_statements", MetricContext.NAME, MetricContext.NAME, DataPointContext.NAME),
        PROFILES(SignalKind.PROFILES, "profile_statements", ProfileContext.NAME, ProfileContext.NAME);

        private final SignalKind signal;
        private final String key;
        private final String recordContext;
        private final List<String> contexts;

        Section(SignalKind signal, String key, String recordContext, String... recordContexts) {
            this.signal = signal;
            this.key = key;
            this.recordContext = recordContext;
            List<String> all = new ArrayList<>();
            all.add(ResourceContext.NAME);
            all.add(ScopeContext.NAME);
            all.addAll(List.of(recordContexts));
            this.contexts = List.copyOf(all);
        }

        String context(String raw) throws ConfigException {
            String name = switch (raw) {
                case "scope" -> ScopeContext.NAME;
                case "log_record" -> LogContext.NAME;
                default -> raw;
            };
            if (!contexts.contains(name)) {
                throw new ConfigException("unknown context " + raw + " for " + key + "; expected one of "
                    + String.join(", ", contexts));
            }
            return name;
        }

        static Section byKey(String key) {
            for (Section s : values()) {
                if (s.key.equals(key)) {
                    return s;
                }
            }
            return null;
        }
    }
}
