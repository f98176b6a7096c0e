package com.ryuqq.ulid.core.strategy;

/**
 * 스레드 seed + 스레드 로컬 72비트 카운터 전략.
 *
 * <p>randomness = {@code threadSeed(8) << 72 | counter(72)}. 스레드마다 독립된 카운터
 * ({@link SeedRegistry#threadCounter()})를 가지므로
 * 같은 스레드 안에서는 엄격히 증가하고, 스레드 간에는 seed로 구분됩니다.
 * 동기화 없이 스레드 안전합니다.</p>
 *
 * <p>256개를 초과하는 스레드가 동시에 쓰면 seed가 겹쳐 값이 충돌할 수 있습니다.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public final class ThreadEnvLexicalStrategy implements RandomnessStrategy {

    private final SeedRegistry seeds;

    public ThreadEnvLexicalStrategy(SeedRegistry seeds) {
        if (seeds == null) {
            throw new IllegalArgumentException("seeds cannot be null");
        }
        this.seeds = seeds;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.THREAD_ENV_LEXICAL;
    }

    @Override
    public byte[] nextRandomness() {
        return CounterLayout.compose(kind(), seeds.threadSeed(), seeds.threadCounter().next());
    }
}
