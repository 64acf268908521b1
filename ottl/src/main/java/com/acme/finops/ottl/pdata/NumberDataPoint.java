package com.acme.finops.ottl.pdata;

/**
 * Gauge or sum point carrying either an int or a double value.
 */
public final class NumberDataPoint extends DataPoint {
    private boolean doubleValued;
    private long intValue;
    private double doubleValue;

    public static NumberDataPoint ofInt(long value) {
        NumberDataPoint p = new NumberDataPoint();
        p.setIntValue(value);
        return p;
    }

    public static NumberDataPoint ofDouble(double value) {
        NumberDataPoint p = new NumberDataPoint();
        p.setDoubleValue(value);
        return p;
    }

    public boolean isDoubleValued() {
        return doubleValued;
    }

    public long intValue() {
        return doubleValued ? 0L : intValue;
    }

    public void setIntValue(long intValue) {
        this.doubleValued = false;
        this.intValue = intValue;
        this.doubleValue = 0d;
    }

    public double doubleValue() {
        return doubleValued ? doubleValue : 0d;
    }

    public void setDoubleValue(double doubleValue) {
        this.doubleValued = true;
        this.doubleValue = doubleValue;
        this.intValue = 0L;
    }
}
