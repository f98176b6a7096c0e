package com.ryuqq.ulid.core.spi;

/**
 * Wall-clock SPI supplying the timestamp field of every identifier.
 *
 * <p>Implementations return milliseconds since the Unix epoch. The value is validated against
 * the 48-bit timestamp range by the caller; an out-of-range value is fatal.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: callable from any thread</li>
 *   <li>Non-blocking: returns in bounded, small time</li>
 * </ul>
 *
 * @author ULID Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TimeSource {

    /**
     * Returns the current time.
     *
     * @return epoch milliseconds
     */
    long currentTimeMillis();
}
