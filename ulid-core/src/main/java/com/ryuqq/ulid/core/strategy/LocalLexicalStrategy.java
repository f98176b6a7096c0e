package com.ryuqq.ulid.core.strategy;

import com.ryuqq.ulid.core.spi.CounterStore;

import java.math.BigInteger;
import java.util.Optional;

/**
 * 영속 카운터 전략.
 *
 * <p>runtime_lexical과 같은 80비트 카운터이지만, 시작 값을 {@link CounterStore}에서 읽고
 * {@link #close()} 시점에 다시 기록합니다.</p>
 *
 * <p><strong>생명주기:</strong></p>
 * <ul>
 *   <li>생성(acquire): 저장된 값 v가 있으면 v+1 (mod 2^80)부터, 없으면 0부터 시작</li>
 *   <li>{@link #nextRandomness()}: 카운터 값을 반환하고 전진</li>
 *   <li>{@link #close()} (release): 마지막으로 발급한 값을 저장. 발급이 없었으면 읽었던 값을
 *       그대로 다시 저장하고, 읽은 값도 없었으면 아무것도 저장하지 않음</li>
 * </ul>
 *
 * <p>close는 멱등입니다. close 이후 {@link #nextRandomness()}는
 * {@link IllegalStateException}을 던집니다.</p>
 *
 * <p><strong>동시성:</strong> 동기화하지 않습니다. 두 프로세스가 같은 저장소를 공유하는
 * 경우는 보호하지 않으며, 나중에 close한 쪽의 값이 남습니다.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public final class LocalLexicalStrategy implements RandomnessStrategy, AutoCloseable {

    private final CounterStore store;
    private final MonotonicCounter counter;
    private final BigInteger loaded;
    private BigInteger lastIssued;
    private boolean closed;

    /**
     * 저장소에서 카운터를 읽어 생성.
     *
     * @param store 카운터 저장소
     * @throws IllegalArgumentException store가 null인 경우
     */
    public LocalLexicalStrategy(CounterStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        int width = StrategyKind.LOCAL_LEXICAL.counterBits();
        Optional<BigInteger> stored = store.load();
        this.store = store;
        this.loaded = stored.orElse(null);
        this.counter = stored
            .map(value -> new MonotonicCounter(width, value.add(BigInteger.ONE).mod(BigInteger.ONE.shiftLeft(width))))
            .orElseGet(() -> new MonotonicCounter(width));
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.LOCAL_LEXICAL;
    }

    @Override
    public byte[] nextRandomness() {
        if (closed) {
            throw new IllegalStateException("LocalLexicalStrategy is already closed");
        }
        BigInteger value = counter.next();
        lastIssued = value;
        return CounterLayout.compose(kind(), 0, value);
    }

    /**
     * 저장소에 기록될 값 조회.
     *
     * @return 마지막 발급 값, 없으면 읽은 값, 둘 다 없으면 empty
     */
    public Optional<BigInteger> persistentValue() {
        return Optional.ofNullable(lastIssued != null ? lastIssued : loaded);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        persistentValue().ifPresent(store::save);
    }
}
