package com.acme.finops.ottl.pdata;

import java.util.ArrayList;
import java.util.List;

public final class Span {
    public static final int TRACE_ID_LENGTH = 16;
    public static final int SPAN_ID_LENGTH = 8;

    private byte[] traceId = new byte[TRACE_ID_LENGTH];
    private byte[] spanId = new byte[SPAN_ID_LENGTH];
    private byte[] parentSpanId = new byte[SPAN_ID_LENGTH];
    private String traceState = "";
    private String name = "";
    private SpanKind kind = SpanKind.UNSPECIFIED;
    private long startTimeUnixNano;
    private long endTimeUnixNano;
    private final PMap attributes = new PMap();
    private long droppedAttributesCount;
    private final List<SpanEvent> events = new ArrayList<>();
    private long droppedEventsCount;
    private StatusCode statusCode = StatusCode.UNSET;
    private String statusMessage = "";

    public Span() {
    }

    public Span(String name) {
        setName(name);
    }

    public byte[] traceId() {
        return traceId;
    }

    public void setTraceId(byte[] traceId) {
        this.traceId = requireLength(traceId, TRACE_ID_LENGTH, "traceId");
    }

    public byte[] spanId() {
        return spanId;
    }

    public void setSpanId(byte[] spanId) {
        this.spanId = requireLength(spanId, SPAN_ID_LENGTH, "spanId");
    }

    public byte[] parentSpanId() {
        return parentSpanId;
    }

    public void setParentSpanId(byte[] parentSpanId) {
        this.parentSpanId = requireLength(parentSpanId, SPAN_ID_LENGTH, "parentSpanId");
    }

    public String traceState() {
        return traceState;
    }

    public void setTraceState(String traceState) {
        this.traceState = traceState == null ? "" : traceState;
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name == null ? "" : name;
    }

    public SpanKind kind() {
        return kind;
    }

    public void setKind(SpanKind kind) {
        this.kind = kind == null ? SpanKind.UNSPECIFIED : kind;
    }

    public long startTimeUnixNano() {
        return startTimeUnixNano;
    }

    public void setStartTimeUnixNano(long startTimeUnixNano) {
        this.startTimeUnixNano = startTimeUnixNano;
    }

    public long endTimeUnixNano() {
        return endTimeUnixNano;
    }

    public void setEndTimeUnixNano(long endTimeUnixNano) {
        this.endTimeUnixNano = endTimeUnixNano;
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

    public List<SpanEvent> events() {
        return events;
    }

    public long droppedEventsCount() {
        return droppedEventsCount;
    }

    public void setDroppedEventsCount(long droppedEventsCount) {
        this.droppedEventsCount = droppedEventsCount;
    }

    public StatusCode statusCode() {
        return statusCode;
    }

    public void setStatusCode(StatusCode statusCode) {
        this.statusCode = statusCode == null ? StatusCode.UNSET : statusCode;
    }

    public String statusMessage() {
        return statusMessage;
    }

    public void setStatusMessage(String statusMessage) {
        this.statusMessage = statusMessage == null ? "" : statusMessage;
    }

    static byte[] requireLength(byte[] id, int length, String field) {
        if (id == null || id.length != length) {
            throw new IllegalArgumentException(field + " must be " + length + " bytes");
        }
        return id.clone();
    }
}
