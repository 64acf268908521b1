package com.acme.finops.ottl.pdata;

/**
 * Fields shared by every data point shape.
 */
public abstract class DataPoint {
    private final PMap attributes = new PMap();
    private long startTimeUnixNano;
    private long timeUnixNano;
    private long flags;

    public PMap attributes() {
        return attributes;
    }

    public long startTimeUnixNano() {
        return startTimeUnixNano;
    }

    public void setStartTimeUnixNano(long startTimeUnixNano) {
        this.startTimeUnixNano = startTimeUnixNano;
    }

    public long timeUnixNano() {
        return timeUnixNano;
    }

    public void setTimeUnixNano(long timeUnixNano) {
        this.timeUnixNano = timeUnixNano;
    }

    public long flags() {
        return flags;
    }

    public void setFlags(long flags) {
        this.flags = flags;
    }
}
