package com.ryuqq.ulid.core.spi.noop;

import com.ryuqq.ulid.core.spi.CounterStore;

import java.math.BigInteger;
import java.util.Optional;

/**
 * {@link CounterStore} that persists nothing.
 *
 * <p>With this store the local lexical counter behaves like the runtime counter: it starts at 0
 * in every process. Used when no persistent store is configured.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public final class NoOpCounterStore implements CounterStore {

    /** Shared instance. */
    public static final NoOpCounterStore INSTANCE = new NoOpCounterStore();

    private NoOpCounterStore() {
    }

    /**
     * {@inheritDoc}
     *
     * @return always empty
     */
    @Override
    public Optional<BigInteger> load() {
        return Optional.empty();
    }

    /**
     * {@inheritDoc}
     *
     * <p>Validates the argument and discards it.</p>
     */
    @Override
    public void save(BigInteger value) {
        if (value == null || value.signum() < 0) {
            throw new IllegalArgumentException("value must be non-negative (current: " + value + ")");
        }
    }
}
