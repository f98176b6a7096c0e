package com.ryuqq.ulid.core.strategy;

import com.ryuqq.ulid.core.codec.IdentifierCodec;

import java.math.BigInteger;

/**
 * {@code [seed | counter]} 레이아웃을 randomness 바이트로 조립.
 *
 * @author ULID Team
 * @since 1.0.0
 */
final class CounterLayout {

    private CounterLayout() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static byte[] compose(StrategyKind kind, int seed, BigInteger counter) {
        BigInteger value = BigInteger.valueOf(seed)
            .shiftLeft(kind.counterBits())
            .or(counter);
        return IdentifierCodec.toFixedBytes(value, kind.format().randomnessBytes());
    }
}
