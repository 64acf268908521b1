package com.acme.finops.ottl.pdata;

public final class InstrumentationScope {
    private String name = "";
    private String version = "";
    private final PMap attributes = new PMap();
    private long droppedAttributesCount;

    public InstrumentationScope() {
    }

    public InstrumentationScope(String name, String version) {
        setName(name);
        setVersion(version);
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name == null ? "" : name;
    }

    public String version() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version == null ? "" : version;
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
