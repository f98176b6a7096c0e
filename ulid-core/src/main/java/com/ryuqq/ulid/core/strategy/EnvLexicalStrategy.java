package com.ryuqq.ulid.core.strategy;

/**
 * 프로세스 seed + 72비트 카운터 전략.
 *
 * <p>randomness = {@code seed(8) << 72 | counter(72)}. seed는 {@link SeedRegistry#processSeed()}로
 * 프로세스 수명 동안 고정되고, 카운터도 같은 레지스트리의 프로세스 범위 카운터를 씁니다. 같은 저장소를 공유하는 여러 프로세스가 서로 다른 seed를 가질
 * 확률을 높여 충돌을 줄이는 용도입니다.</p>
 *
 * <p>동기화하지 않습니다 ({@link RuntimeLexicalStrategy}와 같은 제약).</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public final class EnvLexicalStrategy implements RandomnessStrategy {

    private final SeedRegistry seeds;
    private final MonotonicCounter counter;

    public EnvLexicalStrategy(SeedRegistry seeds) {
        this(seeds, seeds == null ? null : seeds.processCounter(StrategyKind.ENV_LEXICAL));
    }

    /**
     * 지정한 카운터로 생성.
     *
     * @param seeds seed 레지스트리
     * @param counter 72비트 카운터
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public EnvLexicalStrategy(SeedRegistry seeds, MonotonicCounter counter) {
        if (seeds == null) {
            throw new IllegalArgumentException("seeds cannot be null");
        }
        if (counter == null) {
            throw new IllegalArgumentException("counter cannot be null");
        }
        if (counter.width() != StrategyKind.ENV_LEXICAL.counterBits()) {
            throw new IllegalArgumentException(
                "counter width must be " + StrategyKind.ENV_LEXICAL.counterBits()
                    + " (current: " + counter.width() + ")"
            );
        }
        this.seeds = seeds;
        this.counter = counter;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.ENV_LEXICAL;
    }

    @Override
    public byte[] nextRandomness() {
        return CounterLayout.compose(kind(), seeds.processSeed(), counter.next());
    }
}
