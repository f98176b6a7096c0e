/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the external collaborators the core consumes as opaque inputs.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.ulid.core.spi.TimeSource} - current millisecond since the epoch</li>
 *   <li>{@link com.ryuqq.ulid.core.spi.EntropySource} - n random bytes</li>
 *   <li>{@link com.ryuqq.ulid.core.spi.CounterStore} - persisted local lexical counter</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>System defaults live in {@code com.ryuqq.ulid.core.source}. Adapter modules
 * (ulid-adapter-inmemory, ulid-adapter-file) provide the {@link com.ryuqq.ulid.core.spi.CounterStore}
 * implementations.</p>
 *
 * @since 1.0.0
 * @author ULID Team
 */
package com.ryuqq.ulid.core.spi;
