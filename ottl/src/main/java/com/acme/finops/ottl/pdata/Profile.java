package com.acme.finops.ottl.pdata;

public final class Profile {
    public static final int PROFILE_ID_LENGTH = 16;

    private byte[] profileId = new byte[PROFILE_ID_LENGTH];
    private long timeUnixNano;
    private long durationNano;
    private String originalPayloadFormat = "";
    private final PMap attributes = new PMap();
    private long droppedAttributesCount;

    public byte[] profileId() {
        return profileId;
    }

    public void setProfileId(byte[] profileId) {
        this.profileId = Span.requireLength(profileId, PROFILE_ID_LENGTH, "profileId");
    }

    public long timeUnixNano() {
        return timeUnixNano;
    }

    public void setTimeUnixNano(long timeUnixNano) {
        this.timeUnixNano = timeUnixNano;
    }

    public long durationNano() {
        return durationNano;
    }

    public void setDurationNano(long durationNano) {
        this.durationNano = durationNano;
    }

    public String originalPayloadFormat() {
        return originalPayloadFormat;
    }

    public void setOriginalPayloadFormat(String originalPayloadFormat) {
        this.originalPayloadFormat = originalPayloadFormat == null ? "" : originalPayloadFormat;
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
