package com.ryuqq.ulid.testkit.source;

import com.ryuqq.ulid.core.spi.EntropySource;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 결정적 엔트로피 소스.
 *
 * <p>주어진 바이트 패턴을 순환하며 이어서 반환합니다. 호출 간 위치가 이어지므로
 * 패턴 길이가 요청 길이의 배수가 아니면 연속 두 호출의 결과가 달라집니다.</p>
 *
 * <pre>
 * SequenceEntropySource entropy = new SequenceEntropySource(0x01, 0x02, 0x03);
 * entropy.nextBytes(2); // [01, 02]
 * entropy.nextBytes(2); // [03, 01]
 * </pre>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public final class SequenceEntropySource implements EntropySource {

    private final byte[] pattern;
    private final AtomicInteger position = new AtomicInteger();
    private final AtomicInteger calls = new AtomicInteger();

    /**
     * 바이트 패턴으로 생성.
     *
     * @param pattern 0 ~ 255 값 (최소 1개)
     * @throws IllegalArgumentException 패턴이 비었거나 값이 범위를 벗어난 경우
     */
    public SequenceEntropySource(int... pattern) {
        if (pattern == null || pattern.length == 0) {
            throw new IllegalArgumentException("pattern cannot be null or empty");
        }
        this.pattern = new byte[pattern.length];
        for (int i = 0; i < pattern.length; i++) {
            if (pattern[i] < 0 || pattern[i] > 0xFF) {
                throw new IllegalArgumentException(
                    "pattern values must be between 0 and 255 (current: " + pattern[i] + ")"
                );
            }
            this.pattern[i] = (byte) pattern[i];
        }
    }

    /**
     * 0, 1, 2, ..., 254 를 순환하는 소스.
     *
     * @return SequenceEntropySource
     */
    public static SequenceEntropySource counting() {
        int[] pattern = new int[255];
        for (int i = 0; i < pattern.length; i++) {
            pattern[i] = i;
        }
        return new SequenceEntropySource(pattern);
    }

    @Override
    public byte[] nextBytes(int length) {
        calls.incrementAndGet();
        int start = position.getAndAdd(length);
        byte[] bytes = new byte[length];
        for (int i = 0; i < length; i++) {
            bytes[i] = pattern[Math.floorMod(start + i, pattern.length)];
        }
        return bytes;
    }

    /**
     * 지금까지 {@link #nextBytes(int)}가 호출된 횟수.
     *
     * @return 호출 횟수
     */
    public int calls() {
        return calls.get();
    }
}
