/**
 * No-op SPI implementations used when no adapter is configured.
 *
 * @since 1.0.0
 * @author ULID Team
 */
package com.ryuqq.ulid.core.spi.noop;
