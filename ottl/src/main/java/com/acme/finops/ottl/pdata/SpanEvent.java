package com.acme.finops.ottl.pdata;

public final class SpanEvent {
    private String name = "";
    private long timeUnixNano;
    private final PMap attributes = new PMap();
    private long droppedAttributesCount;

    public SpanEvent() {
    }

    public SpanEvent(String name) {
        setName(name);
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name == null ? "" : name;
    }

    public long timeUnixNano() {
        return timeUnixNano;
    }

    public void setTimeUnixNano(long timeUnixNano) {
        this.timeUnixNano = timeUnixNano;
    }

    public PMap attributes() {
        return attributes;
    }

    public long droppedAttributesCount() {
        return droppedAttributesCount;
    }

    public void setDroppedAttributesCount(long droppedAttributesCount) {
        this.droppedAttributesCount = droppedAttributesCount;
    }
}
