package com.ryuqq.ulid.core.strategy;

import java.math.BigInteger;

/**
 * 고정 비트 폭 단조 증가 카운터.
 *
 * <p>{@link #next()}는 현재 값을 반환한 뒤 {@code value = (value + 1) mod 2^width}로
 * 전진합니다. 오버플로는 예외 없이 0으로 순환합니다.</p>
 *
 * <p><strong>동시성:</strong> 기본 인스턴스는 동기화하지 않습니다.
 * 여러 스레드가 같은 카운터를 증가시키면 값이 중복되거나 누락될 수 있습니다.
 * 스레드 간 공유가 필요하면 {@link #synchronizedCounter(int)}를 사용하세요.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public class MonotonicCounter {

    /** 지원하는 최대 비트 폭. */
    public static final int MAX_WIDTH = 128;

    private final int width;
    private final BigInteger modulus;
    private BigInteger value;

    /**
     * 0에서 시작하는 카운터 생성.
     *
     * @param width 비트 폭 (1 ~ 128)
     * @throws IllegalArgumentException width가 범위를 벗어난 경우
     */
    public MonotonicCounter(int width) {
        this(width, BigInteger.ZERO);
    }

    /**
     * 지정한 값에서 시작하는 카운터 생성.
     *
     * @param width 비트 폭 (1 ~ 128)
     * @param initial 첫 번째 {@link #next()}가 반환할 값 (0 ~ 2^width-1)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public MonotonicCounter(int width, BigInteger initial) {
        if (width < 1 || width > MAX_WIDTH) {
            throw new IllegalArgumentException(
                "width must be between 1 and " + MAX_WIDTH + " (current: " + width + ")"
            );
        }
        if (initial == null) {
            throw new IllegalArgumentException("initial cannot be null");
        }
        BigInteger modulus = BigInteger.ONE.shiftLeft(width);
        if (initial.signum() < 0 || initial.compareTo(modulus) >= 0) {
            throw new IllegalArgumentException(
                "initial must fit in " + width + " bits (current: " + initial + ")"
            );
        }
        this.width = width;
        this.modulus = modulus;
        this.value = initial;
    }

    /**
     * 스레드 안전한 카운터 생성 (opt-in).
     *
     * @param width 비트 폭
     * @return 모든 연산이 synchronized인 카운터
     */
    public static MonotonicCounter synchronizedCounter(int width) {
        return new SynchronizedCounter(width);
    }

    /**
     * 현재 값을 반환하고 전진.
     *
     * @return 이번 호출에 할당된 값
     */
    public BigInteger next() {
        BigInteger current = value;
        BigInteger advanced = current.add(BigInteger.ONE);
        value = advanced.equals(modulus) ? BigInteger.ZERO : advanced;
        return current;
    }

    /**
     * 다음 {@link #next()}가 반환할 값 조회 (전진하지 않음).
     *
     * @return 현재 값
     */
    public BigInteger peek() {
        return value;
    }

    public int width() {
        return width;
    }

    public BigInteger modulus() {
        return modulus;
    }

    @Override
    public String toString() {
        return "MonotonicCounter{width=" + width + ", value=" + peek() + '}';
    }

    private static final class SynchronizedCounter extends MonotonicCounter {

        SynchronizedCounter(int width) {
            super(width);
        }

        @Override
        public synchronized BigInteger next() {
            return super.next();
        }

        @Override
        public synchronized BigInteger peek() {
            return super.peek();
        }
    }
}
