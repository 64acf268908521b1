package com.acme.finops.ottl.pdata;

public enum StatusCode {
    UNSET(0),
    OK(1),
    ERROR(2);

    private final int code;

    StatusCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static StatusCode fromCode(long code) {
        for (StatusCode status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        return null;
    }
}
