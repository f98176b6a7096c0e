package com.ryuqq.ulid.core.strategy;

/**
 * Slid용 프로세스 seed + 8비트 카운터 전략.
 *
 * <p>randomness 2바이트 = {@code seed(8) << 8 | counter(8)}.
 * 카운터는 256회마다 순환하며 레지스트리 단위로 공유됩니다.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public final class SlidStrategy implements RandomnessStrategy {

    private final SeedRegistry seeds;
    private final MonotonicCounter counter;

    public SlidStrategy(SeedRegistry seeds) {
        if (seeds == null) {
            throw new IllegalArgumentException("seeds cannot be null");
        }
        this.seeds = seeds;
        this.counter = seeds.processCounter(StrategyKind.SLID);
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.SLID;
    }

    @Override
    public byte[] nextRandomness() {
        return CounterLayout.compose(kind(), seeds.processSeed(), counter.next());
    }
}
