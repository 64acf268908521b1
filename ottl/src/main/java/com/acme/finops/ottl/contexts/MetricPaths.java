package com.acme.finops.ottl.contexts;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.expr.GetSetter;
import com.acme.finops.ottl.path.Path;
import com.acme.finops.ottl.path.Paths;
import com.acme.finops.ottl.pdata.AggregationTemporality;
import com.acme.finops.ottl.pdata.DataPoint;
import com.acme.finops.ottl.pdata.Metric;
import com.acme.finops.ottl.pdata.PSlice;

import java.util.List;
import java.util.function.Function;

/**
 * Metric fields, reachable from the metric context and as {@code metric.*} from data points.
 * {@code type} and {@code data_points} are read-only.
 */
final class MetricPaths {
    static final List<String> FIELDS = List.of(
        "name", "description", "unit", "type", "aggregation_temporality", "is_monotonic", "data_points");

    private MetricPaths() {
    }

    static <K> GetSetter<K> resolve(Path<K> path, Function<K, Metric> metric, String contextName, List<String> known)
        throws ConfigException {
        return switch (path.name()) {
            case "name" -> CommonPaths.string(path,
                tCtx -> metric.apply(tCtx).name(), (tCtx, v) -> metric.apply(tCtx).setName(v));
            case "description" -> CommonPaths.string(path,
                tCtx -> metric.apply(tCtx).description(), (tCtx, v) -> metric.apply(tCtx).setDescription(v));
            case "unit" -> CommonPaths.string(path,
                tCtx -> metric.apply(tCtx).unit(), (tCtx, v) -> metric.apply(tCtx).setUnit(v));
            case "type" -> {
                Paths.requireTerminal(path);
                yield GetSetter.readOnly(path.string(), (ctx, tCtx) -> (long) metric.apply(tCtx).type().code());
            }
            case "aggregation_temporality" -> {
                Paths.requireTerminal(path);
                yield GetSetter.of(
                    (ctx, tCtx) -> (long) metric.apply(tCtx).aggregationTemporality().code(),
                    (ctx, tCtx, value) -> {
                        if (value instanceof Long code) {
                            AggregationTemporality t = AggregationTemporality.fromCode(code);
                            if (t == null) {
                                throw new EvaluationException("invalid aggregation temporality " + code);
                            }
                            metric.apply(tCtx).setAggregationTemporality(t);
                        }
                    });
            }
            case "is_monotonic" -> CommonPaths.bool(path,
                tCtx -> metric.apply(tCtx).isMonotonic(), (tCtx, v) -> metric.apply(tCtx).setMonotonic(v));
            case "data_points" -> {
                Paths.requireTerminal(path);
                yield GetSetter.readOnly(path.string(), (ctx, tCtx) -> {
                    PSlice points = new PSlice();
                    for (DataPoint point : metric.apply(tCtx).dataPoints()) {
                        points.add(point.attributes().copy());
                    }
                    return points;
                });
            }
            default -> throw Paths.unknownField(path, contextName, known);
        };
    }
}
