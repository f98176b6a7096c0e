package com.ryuqq.ulid.core.model;

import com.ryuqq.ulid.core.codec.IdentifierCodec;
import com.ryuqq.ulid.core.codec.Representation;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.UUID;

/**
 * 128비트 ULID.
 *
 * <p><strong>레이아웃:</strong></p>
 * <pre>
 * [TIMESTAMP(48bit|6bytes)][RANDOMNESS(80bit|10bytes)]
 * </pre>
 *
 * <p><strong>문자열:</strong> 26자 Crockford base-32
 * (timestamp 10자 + randomness 16자, I/L/O/U 제외, 대문자 정규형)</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Ulid id = Ulid.parse("01ARZ3NDEKTSV4RRFFQ69G5FAV");
 * long createdAt = id.timestamp();
 * Ulid following = id.next();
 * </pre>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public final class Ulid extends Identifier<Ulid> {

    private static final long serialVersionUID = 1L;

    /** 최소값 (packed value 0). */
    public static final Ulid MIN = new Ulid(new byte[16]);

    /** 최대값 (packed value 2^128-1). */
    public static final Ulid MAX = fromBigInteger(IdentifierFormat.ULID.maxValue());

    private Ulid(byte[] bytes) {
        super(IdentifierFormat.ULID, bytes);
    }

    @Override
    protected Ulid create(byte[] bytes) {
        return new Ulid(bytes);
    }

    @Override
    protected Ulid self() {
        return this;
    }

    /**
     * 16바이트 배열로 생성.
     *
     * @param bytes big-endian 바이트 배열
     * @return Ulid
     * @throws com.ryuqq.ulid.core.exception.DecodeException 길이가 16이 아닌 경우
     */
    public static Ulid fromBytes(byte[] bytes) {
        return new Ulid(bytes);
    }

    /**
     * 128비트 부호 없는 정수로 생성.
     *
     * @param value packed value
     * @return Ulid
     * @throws com.ryuqq.ulid.core.exception.DecodeException 음수이거나 128비트 초과인 경우
     */
    public static Ulid fromBigInteger(BigInteger value) {
        return new Ulid(IdentifierCodec.fromBigInteger(IdentifierFormat.ULID, value));
    }

    /**
     * 정규 문자열 파싱 (대소문자 무시).
     *
     * @param text 26자 Crockford base-32
     * @return Ulid
     * @throws com.ryuqq.ulid.core.exception.DecodeException 길이 또는 문자가 잘못된 경우
     */
    public static Ulid parse(CharSequence text) {
        return new Ulid(IdentifierCodec.decode(IdentifierFormat.ULID, text));
    }

    /**
     * 모든 문자열 표현 파싱 (정규형, 0x/0o/0b, repr).
     *
     * @param text 문자열 표현
     * @return Ulid
     * @throws com.ryuqq.ulid.core.exception.DecodeException 해석할 수 없는 경우
     */
    public static Ulid parseAny(String text) {
        return new Ulid(IdentifierCodec.parse(IdentifierFormat.ULID, text));
    }

    public static Ulid fromHex(String text) {
        return new Ulid(IdentifierCodec.fromRadixString(IdentifierFormat.ULID, text, Representation.HEX));
    }

    public static Ulid fromOctal(String text) {
        return new Ulid(IdentifierCodec.fromRadixString(IdentifierFormat.ULID, text, Representation.OCTAL));
    }

    public static Ulid fromBinary(String text) {
        return new Ulid(IdentifierCodec.fromRadixString(IdentifierFormat.ULID, text, Representation.BINARY));
    }

    public static Ulid fromRepr(String text) {
        return new Ulid(IdentifierCodec.fromRepr(IdentifierFormat.ULID, text));
    }

    /**
     * 두 필드로 직접 생성 (전략 우회).
     *
     * @param timestamp epoch 밀리초 (48비트)
     * @param randomness 80비트 부호 없는 정수
     * @return Ulid
     * @throws com.ryuqq.ulid.core.exception.DecodeException 필드가 비트 폭을 초과하는 경우
     */
    public static Ulid of(long timestamp, BigInteger randomness) {
        return new Ulid(IdentifierCodec.pack(IdentifierFormat.ULID, timestamp, randomness));
    }

    /**
     * 두 필드로 직접 생성 (전략 우회).
     *
     * @param timestamp epoch 밀리초 (48비트)
     * @param randomness 10바이트 배열
     * @return Ulid
     */
    public static Ulid of(long timestamp, byte[] randomness) {
        return new Ulid(IdentifierCodec.pack(IdentifierFormat.ULID, timestamp, randomness));
    }

    public static Ulid of(Instant instant, BigInteger randomness) {
        return of(Timestamps.fromInstant(instant), randomness);
    }

    /**
     * 같은 128비트 값을 가진 UUID로 변환.
     *
     * @return UUID (version/variant 비트는 설정하지 않음)
     */
    public UUID toUuid() {
        ByteBuffer buffer = ByteBuffer.wrap(toBytes());
        return new UUID(buffer.getLong(), buffer.getLong());
    }

    /**
     * UUID의 128비트 값을 그대로 Ulid로 해석.
     *
     * @param uuid UUID
     * @return Ulid
     * @throws IllegalArgumentException uuid가 null인 경우
     */
    public static Ulid fromUuid(UUID uuid) {
        if (uuid == null) {
            throw new IllegalArgumentException("uuid cannot be null");
        }
        return new Ulid(ByteBuffer.allocate(16)
            .putLong(uuid.getMostSignificantBits())
            .putLong(uuid.getLeastSignificantBits())
            .array());
    }
}
