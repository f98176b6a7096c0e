package com.ryuqq.ulid.core.strategy;

/**
 * randomness 필드 생성 전략.
 *
 * <p>{@link IdentifierAssembler}가 타임스탬프를 읽은 직후 호출합니다.
 * 반환 배열은 항상 {@code kind().format().randomnessBytes()} 길이이며,
 * 호출자가 소유합니다 (매 호출 새 배열).</p>
 *
 * <p><strong>동시성:</strong> 스레드 안전성은 구현체마다 다릅니다.
 * 각 구현체 문서를 확인하세요.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public interface RandomnessStrategy {

    /**
     * 전략 종류.
     *
     * @return 이 전략의 종류
     */
    StrategyKind kind();

    /**
     * 다음 randomness 필드 생성.
     *
     * @return big-endian randomness 바이트
     */
    byte[] nextRandomness();
}
