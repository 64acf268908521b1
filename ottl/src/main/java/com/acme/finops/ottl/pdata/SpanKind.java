package com.acme.finops.ottl.pdata;

public enum SpanKind {
    UNSPECIFIED(0, "Unspecified"),
    INTERNAL(1, "Internal"),
    SERVER(2, "Server"),
    CLIENT(3, "Client"),
    PRODUCER(4, "Producer"),
    CONSUMER(5, "Consumer");

    private final int code;
    private final String displayName;

    SpanKind(int code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public int code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    /** Protobuf-style name, e.g. {@code SPAN_KIND_SERVER}. */
    public String protoName() {
        return "SPAN_KIND_" + name();
    }

    public static SpanKind fromCode(long code) {
        for (SpanKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        return null;
    }

    public static SpanKind fromDisplayName(String name) {
        for (SpanKind kind : values()) {
            if (kind.displayName.equals(name)) {
                return kind;
            }
        }
        return null;
    }

    public static SpanKind fromProtoName(String name) {
        for (SpanKind kind : values()) {
            if (kind.protoName().equals(name)) {
                return kind;
            }
        }
        return null;
    }
}
