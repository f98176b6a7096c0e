/**
 * In-memory {@link com.ryuqq.ulid.core.spi.CounterStore} 구현.
 *
 * @author ULID Team
 * @since 1.0.0
 */
package com.ryuqq.ulid.adapter.inmemory.store;
