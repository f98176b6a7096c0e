package com.ryuqq.ulid.core.model;

import com.ryuqq.ulid.core.exception.DecodeException;
import com.ryuqq.ulid.core.exception.FatalInitializationException;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 48비트 millisecond timestamp 검증 및 변환.
 *
 * <p>timestamp는 Unix epoch(1970-01-01T00:00:00Z) 이후 경과한 밀리초이며
 * 0 ~ 2^48-1 (약 10889년) 범위만 허용됩니다.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public final class Timestamps {

    /** 최소 timestamp. */
    public static final long MIN_TIMESTAMP = 0L;

    /** 최대 timestamp (2^48 - 1 = 281,474,976,710,655). */
    public static final long MAX_TIMESTAMP = (1L << IdentifierFormat.TIMESTAMP_BITS) - 1;

    private static final long NANOS_PER_MILLI = 1_000_000L;
    private static final BigDecimal MAX_MILLIS_EXCLUSIVE = BigDecimal.valueOf(MAX_TIMESTAMP + 1);

    // Utility class - prevent instantiation
    private Timestamps() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 시간 소스가 돌려준 현재 시각 검증.
     *
     * <p>범위를 벗어나면 모든 식별자의 정렬 기준이 무너지므로
     * 복구 불가능한 오류로 취급합니다.</p>
     *
     * @param epochMillis 현재 시각 (epoch 밀리초)
     * @return 검증된 값
     * @throws FatalInitializationException 0 미만이거나 48비트 초과인 경우
     */
    public static long requireClock(long epochMillis) {
        if (epochMillis < MIN_TIMESTAMP || epochMillis > MAX_TIMESTAMP) {
            throw new FatalInitializationException(
                "clock value does not fit in 48 bits (current: " + epochMillis + ")"
            );
        }
        return epochMillis;
    }

    /**
     * 외부 입력 timestamp 검증.
     *
     * @param epochMillis 입력 timestamp
     * @return 검증된 값
     * @throws DecodeException 0 미만이거나 48비트 초과인 경우
     */
    public static long requireValid(long epochMillis) {
        if (epochMillis < MIN_TIMESTAMP || epochMillis > MAX_TIMESTAMP) {
            throw new DecodeException(
                "timestamp must be between 0 and " + MAX_TIMESTAMP + " (current: " + epochMillis + ")"
            );
        }
        return epochMillis;
    }

    /**
     * Instant를 epoch 밀리초로 변환.
     *
     * @param instant 시각
     * @return 검증된 epoch 밀리초
     * @throws IllegalArgumentException instant가 null인 경우
     * @throws DecodeException 48비트 범위를 벗어난 경우
     */
    public static long fromInstant(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        if (instant.isBefore(Instant.EPOCH)) {
            throw new DecodeException("timestamp cannot precede the epoch (current: " + instant + ")");
        }
        if (instant.isAfter(Instant.ofEpochMilli(MAX_TIMESTAMP))) {
            throw new DecodeException("timestamp does not fit in 48 bits (current: " + instant + ")");
        }
        return instant.toEpochMilli();
    }

    /**
     * epoch 초(소수 포함)를 epoch 밀리초로 변환.
     *
     * <p>10진 표기 기준으로 밀리초 미만을 버립니다. 예: 1.2345 → 1234, 4.35 → 4350</p>
     *
     * @param epochSeconds epoch 초
     * @return 검증된 epoch 밀리초
     * @throws DecodeException NaN, 무한대이거나 48비트 범위를 벗어난 경우
     */
    public static long fromSeconds(double epochSeconds) {
        if (Double.isNaN(epochSeconds) || Double.isInfinite(epochSeconds)) {
            throw new DecodeException("seconds must be finite (current: " + epochSeconds + ")");
        }
        BigDecimal millis = BigDecimal.valueOf(epochSeconds).movePointRight(3);
        if (millis.signum() < 0 || millis.compareTo(MAX_MILLIS_EXCLUSIVE) >= 0) {
            throw new DecodeException("timestamp does not fit in 48 bits (current: " + epochSeconds + "s)");
        }
        return millis.longValue();
    }

    /**
     * epoch 나노초를 epoch 밀리초로 변환 (밀리초 미만 버림).
     *
     * @param epochNanos epoch 나노초
     * @return 검증된 epoch 밀리초
     * @throws DecodeException 0 미만인 경우
     */
    public static long fromNanoseconds(long epochNanos) {
        if (epochNanos < 0) {
            throw new DecodeException("timestamp cannot precede the epoch (current: " + epochNanos + "ns)");
        }
        return epochNanos / NANOS_PER_MILLI;
    }

    /**
     * epoch 밀리초를 epoch 초로 변환.
     *
     * @param epochMillis epoch 밀리초
     * @return epoch 초 (밀리초는 소수부)
     */
    public static double toSeconds(long epochMillis) {
        return epochMillis / 1000.0;
    }

    /**
     * epoch 밀리초를 epoch 나노초로 변환.
     *
     * @param epochMillis epoch 밀리초
     * @return epoch 나노초
     * @throws ArithmeticException long 범위를 넘는 경우 (2262-04-11 이후)
     */
    public static long toNanoseconds(long epochMillis) {
        return Math.multiplyExact(epochMillis, NANOS_PER_MILLI);
    }

    /**
     * 6바이트 big-endian 배열로 인코딩.
     *
     * @param epochMillis 검증된 timestamp
     * @return 6바이트 배열
     */
    public static byte[] toBytes(long epochMillis) {
        byte[] bytes = new byte[IdentifierFormat.TIMESTAMP_BYTES];
        for (int i = bytes.length - 1; i >= 0; i--) {
            bytes[i] = (byte) epochMillis;
            epochMillis >>>= 8;
        }
        return bytes;
    }

    /**
     * 배열 앞 6바이트를 big-endian timestamp로 해석.
     *
     * @param bytes 식별자 바이트 배열 (6바이트 이상)
     * @return epoch 밀리초
     */
    public static long fromBytes(byte[] bytes) {
        long value = 0;
        for (int i = 0; i < IdentifierFormat.TIMESTAMP_BYTES; i++) {
            value = (value << 8) | (bytes[i] & 0xFFL);
        }
        return value;
    }
}
