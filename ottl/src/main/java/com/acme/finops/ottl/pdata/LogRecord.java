package com.acme.finops.ottl.pdata;

public final class LogRecord {
    private long timeUnixNano;
    private long observedTimeUnixNano;
    private SeverityNumber severityNumber;
    private String severityText = "";
    private Object body;
    private final PMap attributes = new PMap();
    private long droppedAttributesCount;
    private long flags;
    private byte[] traceId = new byte[Span.TRACE_ID_LENGTH];
    private byte[] spanId = new byte[Span.SPAN_ID_LENGTH];

    public LogRecord() {
    }

    public LogRecord(Object body) {
        setBody(body);
    }

    public long timeUnixNano() {
        return timeUnixNano;
    }

    public void setTimeUnixNano(long timeUnixNano) {
        this.timeUnixNano = timeUnixNano;
    }

    public long observedTimeUnixNano() {
        return observedTimeUnixNano;
    }

    public void setObservedTimeUnixNano(long observedTimeUnixNano) {
        this.observedTimeUnixNano = observedTimeUnixNano;
    }

    /**
     * Severity, or {@code null} when the producer never set one.
     */
    public SeverityNumber severityNumber() {
        return severityNumber;
    }

    public void setSeverityNumber(SeverityNumber severityNumber) {
        this.severityNumber = severityNumber;
    }

    public String severityText() {
        return severityText;
    }

    public void setSeverityText(String severityText) {
        this.severityText = severityText == null ? "" : severityText;
    }

    public Object body() {
        return body;
    }

    public void setBody(Object body) {
        this.body = Values.normalizeAttribute(body);
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

    public long flags() {
        return flags;
    }

    public void setFlags(long flags) {
        this.flags = flags;
    }

    public byte[] traceId() {
        return traceId;
    }

    public void setTraceId(byte[] traceId) {
        this.traceId = Span.requireLength(traceId, Span.TRACE_ID_LENGTH, "traceId");
    }

    public byte[] spanId() {
        return spanId;
    }

    public void setSpanId(byte[] spanId) {
        this.spanId = Span.requireLength(spanId, Span.SPAN_ID_LENGTH, "spanId");
    }
}
