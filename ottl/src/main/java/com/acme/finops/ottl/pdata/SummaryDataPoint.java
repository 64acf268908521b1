package com.acme.finops.ottl.pdata;

import java.util.ArrayList;
import java.util.List;

public final class SummaryDataPoint extends DataPoint {
    private long count;
    private double sum;
    private final List<Quantile> quantileValues = new ArrayList<>();

    public long count() {
        return count;
    }

    public void setCount(long count) {
        this.count = count;
    }

    public double sum() {
        return sum;
    }

    public void setSum(double sum) {
        this.sum = sum;
    }

    public List<Quantile> quantileValues() {
        return quantileValues;
    }

    public record Quantile(double quantile, double value) {}
}
