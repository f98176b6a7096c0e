/**
 * System-backed default implementations of the time and entropy SPIs.
 *
 * <ul>
 *   <li>{@link com.ryuqq.ulid.core.source.SystemTimeSource} - {@link java.time.Clock} millis</li>
 *   <li>{@link com.ryuqq.ulid.core.source.SecureRandomEntropySource} - {@link java.security.SecureRandom} bytes</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ULID Team
 */
package com.ryuqq.ulid.core.source;
