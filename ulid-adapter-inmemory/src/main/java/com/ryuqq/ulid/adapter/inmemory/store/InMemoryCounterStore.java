package com.ryuqq.ulid.adapter.inmemory.store;

import com.ryuqq.ulid.core.spi.CounterStore;

import java.math.BigInteger;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link CounterStore} SPI for testing and reference purposes.
 *
 * <p>값은 {@link AtomicReference} 하나에 보관됩니다. 같은 인스턴스를 여러
 * {@link com.ryuqq.ulid.core.strategy.LocalLexicalStrategy}에 차례로 넘기면
 * 프로세스 재시작을 흉내낼 수 있습니다.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryCounterStore store = new InMemoryCounterStore();
 * try (LocalLexicalStrategy strategy = new LocalLexicalStrategy(store)) {
 *     assembler.ulid(strategy);
 * }
 * store.load(); // Optional[0]
 * </pre>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public class InMemoryCounterStore implements CounterStore {

    /** 80비트 카운터 최대값. 이보다 큰 값은 load()에서 empty로 보고됩니다. */
    static final BigInteger MAX_VALUE = BigInteger.ONE.shiftLeft(80).subtract(BigInteger.ONE);

    private final AtomicReference<BigInteger> value = new AtomicReference<>();

    /**
     * 빈 저장소 생성.
     */
    public InMemoryCounterStore() {
    }

    /**
     * 초기 값을 가진 저장소 생성.
     *
     * @param initial 저장된 것으로 간주할 값
     * @throws IllegalArgumentException initial이 null이거나 음수인 경우
     */
    public InMemoryCounterStore(BigInteger initial) {
        save(initial);
    }

    @Override
    public Optional<BigInteger> load() {
        return Optional.ofNullable(value.get())
            .filter(stored -> stored.compareTo(MAX_VALUE) <= 0);
    }

    @Override
    public void save(BigInteger value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("value must be non-negative (current: " + value + ")");
        }
        this.value.set(value);
    }

    /**
     * 저장된 값 삭제 (테스트 격리용).
     */
    public void clear() {
        value.set(null);
    }
}
