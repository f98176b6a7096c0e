package com.ryuqq.ulid.core.source;

import com.ryuqq.ulid.core.spi.TimeSource;

import java.time.Clock;

/**
 * {@link TimeSource} backed by a {@link Clock} (system UTC clock by default).
 *
 * @author ULID Team
 * @since 1.0.0
 */
public final class SystemTimeSource implements TimeSource {

    private final Clock clock;

    /**
     * Creates a time source reading {@link Clock#systemUTC()}.
     */
    public SystemTimeSource() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a time source reading the given clock.
     *
     * @param clock clock to read
     * @throws IllegalArgumentException if clock is null
     */
    public SystemTimeSource(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public long currentTimeMillis() {
        return clock.millis();
    }
}
