package com.acme.finops.ottl.contexts;

import com.acme.finops.ottl.path.EnumParser;
import com.acme.finops.ottl.pdata.AggregationTemporality;
import com.acme.finops.ottl.pdata.MetricType;
import com.acme.finops.ottl.pdata.SeverityNumber;
import com.acme.finops.ottl.pdata.SpanKind;
import com.acme.finops.ottl.pdata.StatusCode;

import java.util.HashMap;
import java.util.Map;

/**
 * Enum symbols visible to each context.
 */
final class Enums {
    static final EnumParser SPAN = EnumParser.of(spanSymbols());
    static final EnumParser LOG = EnumParser.of(logSymbols());
    static final EnumParser METRIC = EnumParser.of(metricSymbols());

    private Enums() {
    }

    private static Map<String, Long> spanSymbols() {
        Map<String, Long> out = new HashMap<>();
        for (SpanKind kind : SpanKind.values()) {
            out.put(kind.protoName(), (long) kind.code());
        }
        for (StatusCode status : StatusCode.values()) {
            out.put("STATUS_CODE_" + status.name(), (long) status.code());
        }
        return out;
    }

    private static Map<String, Long> logSymbols() {
        Map<String, Long> out = new HashMap<>();
        for (SeverityNumber severity : SeverityNumber.values()) {
            out.put("SEVERITY_NUMBER_" + severity.name(), (long) severity.code());
        }
        return out;
    }

    private static Map<String, Long> metricSymbols() {
        Map<String, Long> out = new HashMap<>();
        for (MetricType type : MetricType.values()) {
            String name = type == MetricType.EMPTY ? "NONE" : type.name();
            out.put("METRIC_DATA_TYPE_" + name, (long) type.code());
        }
        for (AggregationTemporality temporality : AggregationTemporality.values()) {
            out.put("AGGREGATION_TEMPORALITY_" + temporality.name(), (long) temporality.code());
        }
        out.put("FLAG_NONE", 0L);
        out.put("FLAG_NO_RECORDED_VALUE", 1L);
        return out;
    }
}
