package com.acme.finops.ottl.filter;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.ErrorMode;
import com.acme.finops.ottl.contexts.DataPointContext;
import com.acme.finops.ottl.contexts.LogContext;
import com.acme.finops.ottl.contexts.MetricContext;
import com.acme.finops.ottl.contexts.ProfileContext;
import com.acme.finops.ottl.contexts.ResourceContext;
import com.acme.finops.ottl.contexts.SpanContext;
import com.acme.finops.ottl.contexts.SpanEventContext;
import com.acme.finops.ottl.pdata.SignalKind;
import com.acme.finops.ottl.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Filter processor configuration.
 *
 * <pre>{@code
 * {
 *   "error_mode": "ignore",
 *   "traces": { "span": ["attributes[\"http.route\"] == \"/healthz\""] },
 *   "log_conditions": [
 *     { "context": "log", "conditions": ["severity_number < SEVERITY_NUMBER_WARN"], "error_mode": "silent" }
 *   ]
 * }
 * }</pre>
 *
 * <p>The per-signal sections ({@code traces}, {@code logs}, {@code metrics}, {@code profiles})
 * and the grouped lists ({@code trace_conditions}, ...) are merged into one list of
 * {@link ContextConditions} per signal. A group without a context applies to the signal's
 * record context.</p>
 */
public record FilterConfig(ErrorMode errorMode, Map<SignalKind, List<ContextConditions>> conditions) {

    public FilterConfig {
        Objects.requireNonNull(errorMode, "errorMode");
        EnumMap<SignalKind, List<ContextConditions>> copy = new EnumMap<>(SignalKind.class);
        for (SignalKind signal : SignalKind.values()) {
            copy.put(signal, List.copyOf(conditions.getOrDefault(signal, List.of())));
        }
        conditions = Collections.unmodifiableMap(copy);
    }

    public List<ContextConditions> conditionsFor(SignalKind signal) {
        return conditions.get(signal);
    }

    /**
     * Conditions of {@code signal} that target {@code context}.
     */
    public List<ContextConditions> conditionsFor(SignalKind signal, String context) {
        List<ContextConditions> out = new ArrayList<>();
        for (ContextConditions cc : conditions.get(signal)) {
            if (cc.context().equals(context)) {
                out.add(cc);
            }
        }
        return out;
    }

    public FilterConfig withErrorMode(ErrorMode mode) {
        return new FilterConfig(mode, conditions);
    }

    public static FilterConfig parse(String json) throws ConfigException {
        try {
            return fromJson(JsonCodec.readTree(json));
        } catch (JsonProcessingException e) {
            throw new ConfigException("invalid filter configuration JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static FilterConfig fromJson(JsonNode root) throws ConfigException {
        if (root == null || !root.isObject()) {
            throw new ConfigException("filter configuration must be a JSON object");
        }
        ErrorMode errorMode = errorMode(root.path("error_mode"));
        EnumMap<SignalKind, List<ContextConditions>> conditions = new EnumMap<>(SignalKind.class);
        for (Section section : Section.values()) {
            List<ContextConditions> out = new ArrayList<>();
            readSection(section, root.path(section.sectionKey), out);
            readGroups(section, root.path(section.groupsKey), out);
            conditions.put(section.signal, out);
        }
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!"error_mode".equals(name) && Section.byKey(name) == null) {
                throw new ConfigException("unknown filter configuration key " + name);
            }
        }
        return new FilterConfig(errorMode, conditions);
    }

    private static void readSection(Section section, JsonNode node, List<ContextConditions> out) throws ConfigException {
        if (node.isMissingNode() || node.isNull()) {
            return;
        }
        if (!node.isObject()) {
            throw new ConfigException(section.sectionKey + " must be an object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> e = fields.next();
            String context = section.context(e.getKey());
            List<String> list = strings(section.sectionKey + "." + e.getKey(), e.getValue());
            if (!list.isEmpty()) {
                out.add(new ContextConditions(context, list));
            }
        }
    }

    private static void readGroups(Section section, JsonNode node, List<ContextConditions> out) throws ConfigException {
        if (node.isMissingNode() || node.isNull()) {
            return;
        }
        if (!node.isArray()) {
            throw new ConfigException(section.groupsKey + " must be a list");
        }
        int i = 0;
        for (JsonNode group : node) {
            String where = section.groupsKey + "[" + i++ + "]";
            if (!group.isObject()) {
                throw new ConfigException(where + " must be an object");
            }
            JsonNode ctx = group.path("context");
            String context = ctx.isMissingNode() || ctx.isNull() || ctx.asText().isBlank()
                ? section.recordContext
                : section.context(ctx.asText().trim());
            List<String> list = strings(where + ".conditions", group.path("conditions"));
            JsonNode mode = group.path("error_mode");
            ErrorMode groupMode = mode.isMissingNode() || mode.isNull() ? null : errorMode(mode);
            if (!list.isEmpty()) {
                out.add(new ContextConditions(context, list, groupMode));
            }
        }
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
        TRACES(SignalKind.TRACES, "traces", "trace_conditions", SpanContext.NAME,
            ResourceContext.NAME, SpanContext.NAME, SpanEventContext.NAME),
        LOGS(SignalKind.LOGS, "logs", "log_conditions", LogContext.NAME,
            ResourceContext.NAME, LogContext.NAME),
        METRICS(SignalKind.METRICS, "metrics", "metric_conditions", MetricContext.NAME,
            ResourceContext.NAME, MetricContext.NAME, DataPointContext.NAME),
        PROFILES(SignalKind.PROFILES, "profiles", "profile_conditions", ProfileContext.NAME,
            ResourceContext.NAME, ProfileContext.NAME);

        private final SignalKind signal;
        private final String sectionKey;
        private final String groupsKey;
        private final String recordContext;
        private final List<String> contexts;

        Section(SignalKind signal, String sectionKey, String groupsKey, String recordContext, String... contexts) {
            this.signal = signal;
            this.sectionKey = sectionKey;
            this.groupsKey = groupsKey;
            this.recordContext = recordContext;
            this.contexts = List.of(contexts);
        }

        String context(String raw) throws ConfigException {
            String name = "log_record".equals(raw) ? LogContext.NAME : raw;
            if (!contexts.contains(name)) {
                throw new ConfigException("unknown context " + raw + " for " + sectionKey + "; expected one of "
                    + String.join(", ", contexts));
            }
            return name;
        }

        static Section byKey(String key) {
            for (Section s : values()) {
                if (s.sectionKey.equals(key) || s.groupsKey.equals(key)) {
                    return s;
                }
            }
            return null;
        }
    }
}
