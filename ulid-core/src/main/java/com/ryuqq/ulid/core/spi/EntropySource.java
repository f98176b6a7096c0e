package com.ryuqq.ulid.core.spi;

/**
 * Randomness SPI supplying fresh random bytes on demand.
 *
 * <p>Randomness defends against collisions, not against an adversary; implementations are not
 * required to be unpredictable, only uniformly distributed.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: callable from any thread</li>
 *   <li>Every call returns a new array of exactly {@code length} bytes</li>
 * </ul>
 *
 * @author ULID Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EntropySource {

    /**
     * Returns {@code length} random bytes.
     *
     * @param length number of bytes (non-negative)
     * @return new array
     */
    byte[] nextBytes(int length);
}
