package com.acme.finops.ottl.pdata;

import java.util.ArrayList;
import java.util.List;

/**
 * A metric and its data points. The point class must match {@link #type()}: number points
 * for gauges and sums, histogram points for histograms, summary points for summaries.
 */
public final class Metric {
    private String name = "";
    private String description = "";
    private String unit = "";
    private final MetricType type;
    private AggregationTemporality aggregationTemporality = AggregationTemporality.UNSPECIFIED;
    private boolean monotonic;
    private final List<DataPoint> dataPoints = new ArrayList<>();

    public Metric(String name, MetricType type) {
        setName(name);
        this.type = type == null ? MetricType.EMPTY : type;
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name == null ? "" : name;
    }

    public String description() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description == null ? "" : description;
    }

    public String unit() {
        return unit;
    }

    public void setUnit(String unit) {
        this.unit = unit == null ? "" : unit;
    }

    public MetricType type() {
        return type;
    }

    public AggregationTemporality aggregationTemporality() {
        return aggregationTemporality;
    }

    public void setAggregationTemporality(AggregationTemporality aggregationTemporality) {
        this.aggregationTemporality = aggregationTemporality == null
            ? AggregationTemporality.UNSPECIFIED
            : aggregationTemporality;
    }

    public boolean isMonotonic() {
        return monotonic;
    }

    public void setMonotonic(boolean monotonic) {
        this.monotonic = monotonic;
    }

    public List<DataPoint> dataPoints() {
        return dataPoints;
    }
}
