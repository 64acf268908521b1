package com.acme.finops.ottl.pdata;

public enum AggregationTemporality {
    UNSPECIFIED(0),
    DELTA(1),
    CUMULATIVE(2);

    private final int code;

    AggregationTemporality(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static AggregationTemporality fromCode(long code) {
        for (AggregationTemporality t : values()) {
            if (t.code == code) {
                return t;
            }
        }
        return null;
    }
}
