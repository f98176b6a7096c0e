package com.ryuqq.ulid.core.integrity;

import com.ryuqq.ulid.core.model.Slid;
import com.ryuqq.ulid.core.model.Timestamps;
import com.ryuqq.ulid.core.model.Ulid;
import com.ryuqq.ulid.core.spi.EntropySource;
import com.ryuqq.ulid.core.spi.TimeSource;
import com.ryuqq.ulid.core.strategy.MonotonicCounter;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;

import static com.ryuqq.ulid.core.integrity.IntegrityViolation.require;

/**
 * 기본 무결성 검사 모음.
 *
 * @author ULID Team
 * @since 1.0.0
 */
public final class SystemChecks {

    /** 전략이 사용하는 카운터 폭. */
    public static final int[] COUNTER_WIDTHS = {4, 8, 16, 72, 80};

    /** 시계가 이보다 과거를 가리키면 잘못 설정된 것으로 봅니다. */
    public static final Instant CLOCK_FLOOR = Instant.parse("2020-01-01T00:00:00Z");

    private static final int ENTROPY_PROBE_BYTES = 16;

    private SystemChecks() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 128비트 부호 없는 정수가 잘림 없이 표현/연산되는지 검사.
     *
     * @return IntegrityCheck
     */
    public static IntegrityCheck wideArithmetic() {
        return IntegrityCheck.of("wide-arithmetic", () -> {
            BigInteger modulus = BigInteger.ONE.shiftLeft(128);
            BigInteger max = modulus.subtract(BigInteger.ONE);
            require(max.bitLength() == 128, "2^128-1 has bit length " + max.bitLength());
            require(max.add(BigInteger.ONE).mod(modulus).signum() == 0, "2^128 mod 2^128 is not zero");
            require(max.shiftRight(127).equals(BigInteger.ONE), "top bit of 2^128-1 is lost");
            require(Ulid.MAX.toBigInteger().equals(max), "Ulid.MAX does not pack to 2^128-1");
            require(Ulid.MAX.next().equals(Ulid.MIN), "Ulid.MAX + 1 does not wrap to Ulid.MIN");
        });
    }

    /**
     * big-endian packing/unpacking 왕복 검사.
     *
     * @return IntegrityCheck
     */
    public static IntegrityCheck byteOrder() {
        return IntegrityCheck.of("byte-order", () -> {
            byte[] expected = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16};

            byte[] buffer = ByteBuffer.allocate(8).putLong(0x0102030405060708L).array();
            require(Arrays.equals(buffer, Arrays.copyOf(expected, 8)), "ByteBuffer is not big-endian");

            Ulid ulid = Ulid.of(0x010203040506L, new BigInteger("0708090a0b0c0d0e0f10", 16));
            require(Arrays.equals(ulid.toBytes(), expected), "Ulid does not pack most-significant-first");
            require(ulid.timestamp() == 0x010203040506L, "Ulid timestamp does not round-trip");
            require(Ulid.fromBytes(expected).equals(ulid), "Ulid bytes do not round-trip");

            Slid slid = Slid.fromLong(0x0102030405060708L);
            require(Arrays.equals(slid.toBytes(), Arrays.copyOf(expected, 8)), "Slid does not pack most-significant-first");
            require(slid.toLong() == 0x0102030405060708L, "Slid long does not round-trip");
        });
    }

    /**
     * 각 폭에서 카운터가 2^width-1 다음 0으로 순환하는지 검사.
     *
     * @param widths 검사할 폭
     * @return IntegrityCheck
     */
    public static IntegrityCheck counterWrap(int... widths) {
        int[] copy = widths.clone();
        return IntegrityCheck.of("counter-wrap", () -> {
            for (int width : copy) {
                BigInteger max = BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
                MonotonicCounter counter = new MonotonicCounter(width, max);
                require(counter.next().equals(max), width + "-bit counter did not yield its maximum");
                require(counter.next().signum() == 0, width + "-bit counter did not wrap to zero");
                require(counter.next().equals(BigInteger.ONE), width + "-bit counter did not continue after wrap");
            }
        });
    }

    /**
     * epoch 밀리초 0이 1970-01-01T00:00:00Z인지 검사.
     *
     * @return IntegrityCheck
     */
    public static IntegrityCheck epochDefinition() {
        return IntegrityCheck.of("epoch", () -> {
            Instant epoch = OffsetDateTime.of(1970, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC).toInstant();
            require(Instant.ofEpochMilli(0).equals(epoch), "epoch millisecond 0 is not 1970-01-01T00:00:00Z");
            require(Timestamps.fromInstant(epoch) == 0L, "Timestamps does not map the epoch to 0");
        });
    }

    /**
     * 시간 소스가 48비트 범위이며 {@link #CLOCK_FLOOR} 이후를 가리키는지 검사.
     *
     * @param timeSource 시간 소스
     * @return IntegrityCheck
     */
    public static IntegrityCheck clockRange(TimeSource timeSource) {
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        return IntegrityCheck.of("clock-range", () -> {
            long now = timeSource.currentTimeMillis();
            require(now >= CLOCK_FLOOR.toEpochMilli(), "clock is before " + CLOCK_FLOOR + " (current: " + now + ")");
            require(now <= Timestamps.MAX_TIMESTAMP, "clock does not fit in 48 bits (current: " + now + ")");
        });
    }

    /**
     * 엔트로피 소스가 요청한 길이를 반환하고, 연속 두 번의 값이 다른지 검사.
     *
     * @param entropySource 엔트로피 소스
     * @return IntegrityCheck
     */
    public static IntegrityCheck entropyLiveness(EntropySource entropySource) {
        if (entropySource == null) {
            throw new IllegalArgumentException("entropySource cannot be null");
        }
        return IntegrityCheck.of("entropy-liveness", () -> {
            byte[] first = entropySource.nextBytes(ENTROPY_PROBE_BYTES);
            byte[] second = entropySource.nextBytes(ENTROPY_PROBE_BYTES);
            require(first != null && first.length == ENTROPY_PROBE_BYTES, "entropy source returned wrong length");
            require(second != null && second.length == ENTROPY_PROBE_BYTES, "entropy source returned wrong length");
            require(!Arrays.equals(first, second), "entropy source returned the same bytes twice");
        });
    }
}
