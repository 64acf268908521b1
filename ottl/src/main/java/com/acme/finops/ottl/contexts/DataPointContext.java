package com.acme.finops.ottl.contexts;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.Parser;
import com.acme.finops.ottl.TypeError;
import com.acme.finops.ottl.expr.GetSetter;
import com.acme.finops.ottl.func.Factory;
import com.acme.finops.ottl.path.Path;
import com.acme.finops.ottl.path.Paths;
import com.acme.finops.ottl.pdata.DataPoint;
import com.acme.finops.ottl.pdata.HistogramDataPoint;
import com.acme.finops.ottl.pdata.InstrumentationScope;
import com.acme.finops.ottl.pdata.Metric;
import com.acme.finops.ottl.pdata.NumberDataPoint;
import com.acme.finops.ottl.pdata.PMap;
import com.acme.finops.ottl.pdata.PSlice;
import com.acme.finops.ottl.pdata.Resource;
import com.acme.finops.ottl.pdata.SummaryDataPoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluation context for one data point and the metric that owns it.
 *
 * <p>Fields that only exist on some point kinds read as nil elsewhere and ignore writes:
 * {@code value_int}/{@code value_double} on number points, {@code count}/{@code sum} on
 * histogram and summary points, {@code bucket_counts}/{@code explicit_bounds} on histograms
 * and {@code quantile_values} on summaries.</p>
 */
public record DataPointContext(DataPoint dataPoint, Metric metric, InstrumentationScope scope, Resource resource,
                               PMap cache) {
    public static final String NAME = "datapoint";
    static final List<String> OWN_FIELDS = List.of(
        "attributes", "start_time_unix_nano", "time_unix_nano", "start_time", "time", "value_double",
        "value_int", "flags", "count", "sum", "bucket_counts", "explicit_bounds", "quantile_values");
    static final List<String> FIELDS = CommonPaths.known(OWN_FIELDS, "metric", "resource", "instrumentation_scope", "cache");

    public DataPointContext {
        Objects.requireNonNull(dataPoint, "dataPoint");
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(cache, "cache");
    }

    public DataPointContext(DataPoint dataPoint, Metric metric, InstrumentationScope scope, Resource resource) {
        this(dataPoint, metric, scope, resource, new PMap());
    }

    public static Parser<DataPointContext> newParser(Map<String, Factory<DataPointContext>> functions) {
        return Parser.<DataPointContext>builder(NAME, DataPointContext::resolve)
            .functions(functions)
            .enumParser(Enums.METRIC)
            .build();
    }

    static GetSetter<DataPointContext> resolve(Path<DataPointContext> path) throws ConfigException {
        return switch (path.name()) {
            case "attributes" -> CommonPaths.map(path, c -> c.dataPoint().attributes());
            case "start_time_unix_nano" -> CommonPaths.int64(path,
                c -> c.dataPoint().startTimeUnixNano(), (c, v) -> c.dataPoint().setStartTimeUnixNano(v));
            case "time_unix_nano" -> CommonPaths.int64(path,
                c -> c.dataPoint().timeUnixNano(), (c, v) -> c.dataPoint().setTimeUnixNano(v));
            case "start_time" -> CommonPaths.time(path,
                c -> c.dataPoint().startTimeUnixNano(), (c, v) -> c.dataPoint().setStartTimeUnixNano(v));
            case "time" -> CommonPaths.time(path,
                c -> c.dataPoint().timeUnixNano(), (c, v) -> c.dataPoint().setTimeUnixNano(v));
            case "flags" -> CommonPaths.int64(path, c -> c.dataPoint().flags(), (c, v) -> c.dataPoint().setFlags(v));
            case "value_double" -> terminal(path, GetSetter.of(
                (ctx, c) -> c.dataPoint() instanceof NumberDataPoint p ? p.doubleValue() : null,
                (ctx, c, value) -> {
                    if (c.dataPoint() instanceof NumberDataPoint p && value instanceof Double d) {
                        p.setDoubleValue(d);
                    }
                }));
            case "value_int" -> terminal(path, GetSetter.of(
                (ctx, c) -> c.dataPoint() instanceof NumberDataPoint p ? p.intValue() : null,
                (ctx, c, value) -> {
                    if (c.dataPoint() instanceof NumberDataPoint p && value instanceof Long l) {
                        p.setIntValue(l);
                    }
                }));
            case "count" -> terminal(path, GetSetter.of(
                (ctx, c) -> count(c.dataPoint()),
                (ctx, c, value) -> {
                    if (value instanceof Long l) {
                        if (c.dataPoint() instanceof HistogramDataPoint h) {
                            h.setCount(l);
                        } else if (c.dataPoint() instanceof SummaryDataPoint s) {
                            s.setCount(l);
                        }
                    }
                }));
            case "sum" -> terminal(path, GetSetter.of(
                (ctx, c) -> sum(c.dataPoint()),
                (ctx, c, value) -> {
                    if (value instanceof Double d) {
                        if (c.dataPoint() instanceof HistogramDataPoint h) {
                            h.setSum(d);
                        } else if (c.dataPoint() instanceof SummaryDataPoint s) {
                            s.setSum(d);
                        }
                    }
                }));
            case "bucket_counts" -> terminal(path, GetSetter.of(
                (ctx, c) -> c.dataPoint() instanceof HistogramDataPoint h ? PSlice.fromRaw(h.bucketCounts()) : null,
                (ctx, c, value) -> {
                    if (c.dataPoint() instanceof HistogramDataPoint h && value instanceof PSlice s) {
                        h.setBucketCounts(longs(s));
                    }
                }));
            case "explicit_bounds" -> terminal(path, GetSetter.of(
                (ctx, c) -> c.dataPoint() instanceof HistogramDataPoint h ? PSlice.fromRaw(h.explicitBounds()) : null,
                (ctx, c, value) -> {
                    if (c.dataPoint() instanceof HistogramDataPoint h && value instanceof PSlice s) {
                        h.setExplicitBounds(doubles(s));
                    }
                }));
            case "quantile_values" -> terminal(path, GetSetter.of(
                (ctx, c) -> c.dataPoint() instanceof SummaryDataPoint s ? quantiles(s) : null,
                (ctx, c, value) -> {
                    if (c.dataPoint() instanceof SummaryDataPoint s && value instanceof PSlice slice) {
                        setQuantiles(s, slice);
                    }
                }));
            case "metric" -> MetricPaths.resolve(CommonPaths.subField(path, MetricPaths.FIELDS),
                DataPointContext::metric, MetricContext.NAME, MetricPaths.FIELDS);
            case "resource" -> CommonPaths.resource(path, DataPointContext::resource);
            case "instrumentation_scope", "scope" -> CommonPaths.scope(path, DataPointContext::scope);
            case "cache" -> CommonPaths.map(path, DataPointContext::cache);
            default -> throw Paths.unknownField(path, NAME, FIELDS);
        };
    }

    private static GetSetter<DataPointContext> terminal(Path<DataPointContext> path, GetSetter<DataPointContext> gs)
        throws ConfigException {
        Paths.requireTerminal(path);
        return gs;
    }

    private static Long count(DataPoint point) {
        if (point instanceof HistogramDataPoint h) {
            return h.count();
        }
        if (point instanceof SummaryDataPoint s) {
            return s.count();
        }
        return null;
    }

    private static Double sum(DataPoint point) {
        if (point instanceof HistogramDataPoint h) {
            return h.sum();
        }
        if (point instanceof SummaryDataPoint s) {
            return s.sum();
        }
        return null;
    }

    private static List<Long> longs(PSlice slice) throws EvaluationException {
        List<Long> out = new ArrayList<>(slice.size());
        for (Object v : slice.asList()) {
            if (!(v instanceof Long l)) {
                throw TypeError.expected("int", v);
            }
            out.add(l);
        }
        return out;
    }

    private static List<Double> doubles(PSlice slice) throws EvaluationException {
        List<Double> out = new ArrayList<>(slice.size());
        for (Object v : slice.asList()) {
            if (v instanceof Double d) {
                out.add(d);
            } else if (v instanceof Long l) {
                out.add(l.doubleValue());
            } else {
                throw TypeError.expected("double", v);
            }
        }
        return out;
    }

    private static PSlice quantiles(SummaryDataPoint point) {
        PSlice out = new PSlice();
        for (SummaryDataPoint.Quantile q : point.quantileValues()) {
            out.add(PMap.of("quantile", q.quantile(), "value", q.value()));
        }
        return out;
    }

    private static void setQuantiles(SummaryDataPoint point, PSlice slice) throws EvaluationException {
        List<SummaryDataPoint.Quantile> parsed = new ArrayList<>(slice.size());
        for (Object v : slice.asList()) {
            if (!(v instanceof PMap m)) {
                throw TypeError.expected("map", v);
            }
            parsed.add(new SummaryDataPoint.Quantile(number(m.get("quantile")), number(m.get("value"))));
        }
        point.quantileValues().clear();
        point.quantileValues().addAll(parsed);
    }

    private static double number(Object v) throws EvaluationException {
        if (v instanceof Double d) {
            return d;
        }
        if (v instanceof Long l) {
            return l;
        }
        throw TypeError.expected("double", v);
    }
}
