package com.acme.finops.ottl.pdata;

public enum MetricType {
    EMPTY(0),
    GAUGE(1),
    SUM(2),
    HISTOGRAM(3),
    EXPONENTIAL_HISTOGRAM(4),
    SUMMARY(5);

    private final int code;

    MetricType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
