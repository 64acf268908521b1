package com.acme.finops.ottl.pdata;

/**
 * Log severity numbers in OTLP order.
 */
public enum SeverityNumber {
    UNSPECIFIED,
    TRACE, TRACE2, TRACE3, TRACE4,
    DEBUG, DEBUG2, DEBUG3, DEBUG4,
    INFO, INFO2, INFO3, INFO4,
    WARN, WARN2, WARN3, WARN4,
    ERROR, ERROR2, ERROR3, ERROR4,
    FATAL, FATAL2, FATAL3, FATAL4;

    public int code() {
        return ordinal();
    }

    public static SeverityNumber fromCode(long code) {
        SeverityNumber[] all = values();
        if (code < 0 || code >= all.length) {
            return null;
        }
        return all[(int) code];
    }
}
