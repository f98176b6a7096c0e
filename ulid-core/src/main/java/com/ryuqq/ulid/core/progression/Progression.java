package com.ryuqq.ulid.core.progression;

import com.ryuqq.ulid.core.model.Identifier;

import java.math.BigInteger;

/**
 * 식별자 packed value 산술.
 *
 * <p>식별자 전체를 포맷 비트 폭(56, 64, 128)의 부호 없는 정수 하나로 보고
 * 모듈러 산술을 적용합니다.</p>
 *
 * <p><strong>연산:</strong></p>
 * <pre>
 * forward(id, n)  = (packed(id) + n) mod 2^width
 * backward(id, n) = (packed(id) - n) mod 2^width
 * next(id)        = forward(id, 1)
 * previous(id)    = backward(id, 1)
 * </pre>
 *
 * <p><strong>Wrap 규칙:</strong></p>
 * <ul>
 *   <li>randomness 필드 오버플로 → timestamp로 carry</li>
 *   <li>전체 폭 오버플로 → 0으로 순환 (예외 없음)</li>
 *   <li>{@code forward(id, 2^width) == id}</li>
 * </ul>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public final class Progression {

    // Utility class - prevent instantiation
    private Progression() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * n만큼 앞으로 이동.
     *
     * @param id 기준 식별자
     * @param n 이동 거리 (음수는 backward와 동일)
     * @param <T> 식별자 타입
     * @return 새 식별자
     * @throws IllegalArgumentException id 또는 n이 null인 경우
     */
    public static <T extends Identifier<T>> T forward(T id, BigInteger n) {
        requireArguments(id, n);
        BigInteger modulus = id.format().modulus();
        return id.withPackedValue(id.toBigInteger().add(n).mod(modulus));
    }

    /**
     * n만큼 뒤로 이동.
     *
     * @param id 기준 식별자
     * @param n 이동 거리
     * @param <T> 식별자 타입
     * @return 새 식별자
     * @throws IllegalArgumentException id 또는 n이 null인 경우
     */
    public static <T extends Identifier<T>> T backward(T id, BigInteger n) {
        requireArguments(id, n);
        BigInteger modulus = id.format().modulus();
        return id.withPackedValue(id.toBigInteger().subtract(n).mod(modulus));
    }

    public static <T extends Identifier<T>> T next(T id) {
        return forward(id, BigInteger.ONE);
    }

    public static <T extends Identifier<T>> T previous(T id) {
        return backward(id, BigInteger.ONE);
    }

    /**
     * id부터 +1씩 증가하는 count개 시퀀스.
     *
     * <p>역순 시퀀스는 {@link IdentifierSequence#reversed()}로 얻습니다.</p>
     *
     * @param id 시작 식별자 (첫 번째 원소)
     * @param count 원소 수
     * @param <T> 식별자 타입
     * @return 지연 평가되는 재시작 가능한 시퀀스
     * @throws IllegalArgumentException id가 null이거나 count가 음수인 경우
     */
    public static <T extends Identifier<T>> IdentifierSequence<T> sequence(T id, long count) {
        return new IdentifierSequence<>(id, count, false);
    }

    private static void requireArguments(Identifier<?> id, BigInteger n) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (n == null) {
            throw new IllegalArgumentException("n cannot be null");
        }
    }
}
