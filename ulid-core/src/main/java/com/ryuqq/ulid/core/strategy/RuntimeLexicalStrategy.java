package com.ryuqq.ulid.core.strategy;

/**
 * 프로세스 메모리 카운터 전략.
 *
 * <p>randomness 80비트 전체가 카운터입니다. 0부터 시작해 호출마다 1씩 증가하며
 * 2^80에서 0으로 순환합니다. 프로세스가 재시작되면 다시 0부터 시작합니다.
 * 카운터는 {@link SeedRegistry#processCounter(StrategyKind)}에서 받으므로 같은 레지스트리를 쓰는
 * 전략 인스턴스끼리 공유됩니다.</p>
 *
 * <p><strong>동시성:</strong> 기본 카운터는 동기화하지 않습니다. 여러 스레드가 공유하면
 * 카운터 값이 중복될 수 있으며, 이는 알려진 제약입니다.
 * {@link MonotonicCounter#synchronizedCounter(int)}를 주입하면 스레드 안전해집니다.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public final class RuntimeLexicalStrategy implements RandomnessStrategy {

    private final MonotonicCounter counter;

    /**
     * 레지스트리의 프로세스 범위 카운터로 생성.
     *
     * @param seeds 카운터를 보관하는 레지스트리
     * @throws IllegalArgumentException seeds가 null인 경우
     */
    public RuntimeLexicalStrategy(SeedRegistry seeds) {
        this(sharedCounter(seeds));
    }

    /**
     * 지정한 카운터로 생성.
     *
     * @param counter 80비트 카운터
     * @throws IllegalArgumentException counter가 null이거나 폭이 80이 아닌 경우
     */
    public RuntimeLexicalStrategy(MonotonicCounter counter) {
        if (counter == null) {
            throw new IllegalArgumentException("counter cannot be null");
        }
        if (counter.width() != StrategyKind.RUNTIME_LEXICAL.counterBits()) {
            throw new IllegalArgumentException(
                "counter width must be " + StrategyKind.RUNTIME_LEXICAL.counterBits()
                    + " (current: " + counter.width() + ")"
            );
        }
        this.counter = counter;
    }

    private static MonotonicCounter sharedCounter(SeedRegistry seeds) {
        if (seeds == null) {
            throw new IllegalArgumentException("seeds cannot be null");
        }
        return seeds.processCounter(StrategyKind.RUNTIME_LEXICAL);
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.RUNTIME_LEXICAL;
    }

    @Override
    public byte[] nextRandomness() {
        return CounterLayout.compose(kind(), 0, counter.next());
    }
}
