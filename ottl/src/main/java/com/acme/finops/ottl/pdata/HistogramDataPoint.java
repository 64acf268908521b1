package com.acme.finops.ottl.pdata;

import java.util.ArrayList;
import java.util.List;

public final class HistogramDataPoint extends DataPoint {
    private long count;
    private double sum;
    private List<Long> bucketCounts = new ArrayList<>();
    private List<Double> explicitBounds = new ArrayList<>();

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

    public List<Long> bucketCounts() {
        return bucketCounts;
    }

    public void setBucketCounts(List<Long> bucketCounts) {
        this.bucketCounts = new ArrayList<>(bucketCounts);
    }

    public List<Double> explicitBounds() {
        return explicitBounds;
    }

    public void setExplicitBounds(List<Double> explicitBounds) {
        this.explicitBounds = new ArrayList<>(explicitBounds);
    }
}
