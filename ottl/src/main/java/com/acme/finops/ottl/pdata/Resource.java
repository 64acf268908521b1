package com.acme.finops.ottl.pdata;

public final class Resource {
    private final PMap attributes = new PMap();
    private long droppedAttributesCount;

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
