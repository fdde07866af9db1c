package com.storyscene.backend.generation.engine;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Wall-clock budget of one request against the platform ceiling.
 */
public final class TimeBudget {

    private final long startNanos;
    private final Duration hardLimit;
    private final Duration safetyBuffer;
    private final LongSupplier clock;

    private TimeBudget(Duration hardLimit, Duration safetyBuffer, LongSupplier clock) {
        this.hardLimit = hardLimit;
        this.safetyBuffer = safetyBuffer;
        this.clock = clock;
        this.startNanos = clock.getAsLong();
    }

    public static TimeBudget start(Duration hardLimit, Duration safetyBuffer) {
        return new TimeBudget(hardLimit, safetyBuffer, System::nanoTime);
    }

    static TimeBudget start(Duration hardLimit, Duration safetyBuffer, LongSupplier clock) {
        return new TimeBudget(hardLimit, safetyBuffer, clock);
    }

    public Duration elapsed() {
        return Duration.ofNanos(clock.getAsLong() - startNanos);
    }

    public long elapsedMs() {
        return elapsed().toMillis();
    }

    /** Time left before the hard limit; never negative. */
    public Duration remaining() {
        Duration r = hardLimit.minus(elapsed());
        return r.isNegative() ? Duration.ZERO : r;
    }

    public boolean hasAtLeast(Duration needed) {
        return remaining().compareTo(needed) >= 0;
    }

    /** {@code max(floor, hardLimit - elapsed - safetyBuffer)} */
    public Duration callTimeout(Duration floor) {
        Duration t = remaining().minus(safetyBuffer);
        return t.compareTo(floor) < 0 ? floor : t;
    }
}
