package com.acme.finops.ottl;

import java.util.Locale;

/**
 * Policy for per-record evaluation errors.
 */
public enum ErrorMode {
    /** Log the error, treat the condition as false, continue. */
    IGNORE,
    /** Abort evaluation of the record and hand the error to the caller. */
    PROPAGATE,
    /** Like {@link #IGNORE} without the log line. */
    SILENT;

    /**
     * Parses a configured value. Blank means {@link #PROPAGATE}.
     *
     * @throws IllegalArgumentException for anything other than ignore, propagate or silent
     */
    public static ErrorMode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return PROPAGATE;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "ignore" -> IGNORE;
            case "propagate" -> PROPAGATE;
            case "silent" -> SILENT;
            default -> throw new IllegalArgumentException("unknown error mode " + raw);
        };
    }

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
