package com.acme.finops.ottl.contexts;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.ExecContext;
import com.acme.finops.ottl.Parser;
import com.acme.finops.ottl.functions.StandardFunctions;
import com.acme.finops.ottl.pdata.InstrumentationScope;
import com.acme.finops.ottl.pdata.Metric;
import com.acme.finops.ottl.pdata.MetricType;
import com.acme.finops.ottl.pdata.NumberDataPoint;
import com.acme.finops.ottl.pdata.Resource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DataPointContextTest {
    private final Parser<DataPointContext> parser = DataPointContext.newParser(StandardFunctions.all());

    @Test
    void shouldReadValueAndParentMetric() throws Exception {
        Metric metric = new Metric("http.server.duration", MetricType.GAUGE);
        NumberDataPoint dp = NumberDataPoint.ofInt(250L);
        metric.dataPoints().add(dp);
        DataPointContext ctx = new DataPointContext(dp, metric, new InstrumentationScope(), new Resource());

        assertTrue(parser.parseCondition("metric.name == \"http.server.duration\" and value_int > 100")
            .eval(ExecContext.background(), ctx));
        assertTrue(parser.parseCondition("metric.type == METRIC_DATA_TYPE_GAUGE").eval(ExecContext.background(), ctx));
    }

    @Test
    void shouldWriteValueOfMatchingKindOnly() throws Exception {
        Metric metric = new Metric("m", MetricType.SUM);
        NumberDataPoint dp = NumberDataPoint.ofDouble(1.5d);
        DataPointContext ctx = new DataPointContext(dp, metric, new InstrumentationScope(), new Resource());

        parser.parseStatement("set(value_double, value_double * 2)").execute(ExecContext.background(), ctx);

        assertEquals(3.0d, dp.doubleValue());
    }

    @Test
    void shouldRejectWritesToMetricType() {
        assertThrows(ConfigException.class, () -> parser.parseStatement("set(metric.type, 1)"));
    }
}
