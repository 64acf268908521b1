package com.acme.finops.ottl;

import java.time.Clock;
import java.util.Objects;

/**
 * Host-side context threaded through every getter, setter and function call.
 *
 * @param requestId correlation id used in log lines
 * @param clock     the only source of "now" available to functions
 */
public record ExecContext(long requestId, Clock clock) {
    private static final ExecContext BACKGROUND = new ExecContext(0L, Clock.systemUTC());

    public ExecContext {
        Objects.requireNonNull(clock, "clock");
    }

    public static ExecContext background() {
        return BACKGROUND;
    }

    public static ExecContext withClock(Clock clock) {
        return new ExecContext(0L, clock);
    }
}
