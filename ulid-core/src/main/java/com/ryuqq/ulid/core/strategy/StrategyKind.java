package com.ryuqq.ulid.core.strategy;

import com.ryuqq.ulid.core.model.Identifier;
import com.ryuqq.ulid.core.model.IdentifierFormat;

import java.math.BigInteger;
import java.util.OptionalInt;

/**
 * randomness 필드 생성 전략 종류.
 *
 * <p>각 전략은 randomness 필드를 {@code [seed | counter]} 두 구간으로 나눕니다.
 * seed가 없는 전략은 seedBits가 0입니다.</p>
 *
 * <table>
 *   <caption>전략별 randomness 레이아웃</caption>
 *   <tr><th>전략</th><th>포맷</th><th>seed</th><th>counter</th><th>범위</th></tr>
 *   <tr><td>RANDOM</td><td>Ulid</td><td>-</td><td>-</td><td>stateless</td></tr>
 *   <tr><td>RUNTIME_LEXICAL</td><td>Ulid</td><td>-</td><td>80</td><td>process</td></tr>
 *   <tr><td>LOCAL_LEXICAL</td><td>Ulid</td><td>-</td><td>80</td><td>process + CounterStore</td></tr>
 *   <tr><td>ENV_LEXICAL</td><td>Ulid</td><td>8</td><td>72</td><td>process</td></tr>
 *   <tr><td>THREAD_ENV_LEXICAL</td><td>Ulid</td><td>8</td><td>72</td><td>thread</td></tr>
 *   <tr><td>SHORT_ENV_LEXICAL</td><td>ShortUlid</td><td>4</td><td>4</td><td>process</td></tr>
 *   <tr><td>SLID</td><td>Slid</td><td>8</td><td>8</td><td>process</td></tr>
 * </table>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public enum StrategyKind {

    RANDOM(IdentifierFormat.ULID, 0, 0),
    RUNTIME_LEXICAL(IdentifierFormat.ULID, 0, 80),
    LOCAL_LEXICAL(IdentifierFormat.ULID, 0, 80),
    ENV_LEXICAL(IdentifierFormat.ULID, 8, 72),
    THREAD_ENV_LEXICAL(IdentifierFormat.ULID, 8, 72),
    SHORT_ENV_LEXICAL(IdentifierFormat.SHORT_ULID, 4, 4),
    SLID(IdentifierFormat.SLID, 8, 8);

    private final IdentifierFormat format;
    private final int seedBits;
    private final int counterBits;

    StrategyKind(IdentifierFormat format, int seedBits, int counterBits) {
        this.format = format;
        this.seedBits = seedBits;
        this.counterBits = counterBits;
    }

    public IdentifierFormat format() {
        return format;
    }

    public int seedBits() {
        return seedBits;
    }

    public int counterBits() {
        return counterBits;
    }

    /**
     * 카운터 기반 전략 여부.
     *
     * @return RANDOM이 아니면 true
     */
    public boolean isLexical() {
        return counterBits > 0;
    }

    /**
     * 식별자에 기록된 seed(prime) 추출.
     *
     * @param identifier 이 전략의 포맷으로 생성된 식별자
     * @return seed 값, seed가 없는 전략이면 empty
     * @throws IllegalArgumentException 포맷이 다른 경우
     */
    public OptionalInt primeOf(Identifier<?> identifier) {
        requireFormat(identifier);
        if (seedBits == 0) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(identifier.prime(seedBits));
    }

    /**
     * 식별자에 기록된 카운터 값 추출.
     *
     * @param identifier 이 전략의 포맷으로 생성된 식별자
     * @return randomness 하위 counterBits 비트 (RANDOM이면 0)
     * @throws IllegalArgumentException 포맷이 다른 경우
     */
    public BigInteger counterOf(Identifier<?> identifier) {
        requireFormat(identifier);
        BigInteger mask = BigInteger.ONE.shiftLeft(counterBits).subtract(BigInteger.ONE);
        return identifier.randomness().and(mask);
    }

    private void requireFormat(Identifier<?> identifier) {
        if (identifier == null) {
            throw new IllegalArgumentException("identifier cannot be null");
        }
        if (identifier.format() != format) {
            throw new IllegalArgumentException(
                name() + " produces " + format.displayName()
                    + " (current: " + identifier.format().displayName() + ")"
            );
        }
    }
}
