package com.ryuqq.ulid.core.spi;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Persistence SPI for the local lexical counter.
 *
 * <p>The store holds a single scalar: the last counter value handed out. It is read once when
 * the counter is acquired and overwritten once when the counter is released.</p>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <pre>
 * 1. load()        → last value of the previous run (empty on first run)
 * 2. counter resumes at load() + 1
 * 3. save(value)   → last value handed out in this run
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Single writer per process: no cross-process locking is expected</li>
 *   <li>Values outside the counter range are reported as empty by {@link #load()}</li>
 *   <li>I/O failures propagate as unchecked exceptions</li>
 * </ul>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public interface CounterStore {

    /**
     * Reads the persisted counter.
     *
     * @return last persisted value, or empty when nothing usable is stored
     * @throws java.io.UncheckedIOException if the underlying storage cannot be read
     */
    Optional<BigInteger> load();

    /**
     * Overwrites the persisted counter.
     *
     * @param value non-negative counter value
     * @throws IllegalArgumentException if value is null or negative
     * @throws java.io.UncheckedIOException if the underlying storage cannot be written
     */
    void save(BigInteger value);
}
