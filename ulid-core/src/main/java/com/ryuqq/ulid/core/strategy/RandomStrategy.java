package com.ryuqq.ulid.core.strategy;

import com.ryuqq.ulid.core.model.IdentifierFormat;
import com.ryuqq.ulid.core.spi.EntropySource;

/**
 * 기본 전략: 매 호출 80비트 전체를 새로 뽑습니다.
 *
 * <p>상태가 없으므로 EntropySource가 스레드 안전하면 이 전략도 스레드 안전합니다.
 * 같은 밀리초 안에서의 정렬 순서는 보장하지 않습니다.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public final class RandomStrategy implements RandomnessStrategy {

    private final EntropySource entropySource;

    public RandomStrategy(EntropySource entropySource) {
        if (entropySource == null) {
            throw new IllegalArgumentException("entropySource cannot be null");
        }
        this.entropySource = entropySource;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.RANDOM;
    }

    @Override
    public byte[] nextRandomness() {
        int length = IdentifierFormat.ULID.randomnessBytes();
        byte[] bytes = entropySource.nextBytes(length);
        if (bytes == null || bytes.length != length) {
            throw new IllegalStateException(
                "entropySource must return " + length + " bytes (current: "
                    + (bytes == null ? "null" : bytes.length) + ")"
            );
        }
        return bytes;
    }
}
