package com.ryuqq.ulid.adapter.inmemory.store;

import com.ryuqq.ulid.core.spi.CounterStore;
import com.ryuqq.ulid.testkit.contract.AbstractCounterStoreContractTest;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract Tests for {@link InMemoryCounterStore}.
 *
 * @author ULID Team
 * @since 1.0.0
 */
class InMemoryCounterStoreContractTest extends AbstractCounterStoreContractTest {

    @Override
    protected CounterStore createStore() {
        return new InMemoryCounterStore();
    }

    @Test
    void clear_RemovesValue() {
        // given
        InMemoryCounterStore inMemory = new InMemoryCounterStore(BigInteger.TEN);

        // when
        inMemory.clear();

        // then
        assertThat(inMemory.load()).isEmpty();
    }

    @Test
    void constructor_InitialValue_IsLoaded() {
        assertThat(new InMemoryCounterStore(BigInteger.ONE).load()).contains(BigInteger.ONE);
        assertThatThrownBy(() -> new InMemoryCounterStore(BigInteger.valueOf(-5)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
