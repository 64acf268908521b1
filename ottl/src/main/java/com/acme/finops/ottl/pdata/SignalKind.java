package com.acme.finops.ottl.pdata;

import java.util.Locale;

public enum SignalKind {
    TRACES,
    METRICS,
    LOGS,
    PROFILES;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
