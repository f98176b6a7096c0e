package com.ryuqq.ulid.core.strategy;

/**
 * ShortUlid용 프로세스 seed 니블 + 4비트 카운터 전략.
 *
 * <p>randomness 1바이트 = {@code seedNibble(4) << 4 | counter(4)}.
 * 카운터는 16회마다 순환하므로, 같은 밀리초에 16개를 초과해 발급하면 값이 반복됩니다.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public final class ShortEnvLexicalStrategy implements RandomnessStrategy {

    private final SeedRegistry seeds;
    private final MonotonicCounter counter;

    public ShortEnvLexicalStrategy(SeedRegistry seeds) {
        if (seeds == null) {
            throw new IllegalArgumentException("seeds cannot be null");
        }
        this.seeds = seeds;
        this.counter = seeds.processCounter(StrategyKind.SHORT_ENV_LEXICAL);
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.SHORT_ENV_LEXICAL;
    }

    @Override
    public byte[] nextRandomness() {
        return CounterLayout.compose(kind(), seeds.processSeedNibble(), counter.next());
    }
}
