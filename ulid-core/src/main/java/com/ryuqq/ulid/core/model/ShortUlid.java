package com.ryuqq.ulid.core.model;

import com.ryuqq.ulid.core.codec.IdentifierCodec;
import com.ryuqq.ulid.core.codec.Representation;

import java.math.BigInteger;
import java.time.Instant;

/**
 * 56비트 short ULID.
 *
 * <p>short_env_lexical 전략 전용 포맷입니다. 표준 ULID와 호환되지 않습니다.</p>
 *
 * <pre>
 * [TIMESTAMP(48bit|6bytes)][ENV-ID(4bit)][COUNTER(4bit)]
 * </pre>
 *
 * <p><strong>문자열:</strong> 12자 Crockford base-32 (timestamp 10자 + randomness 2자)</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public final class ShortUlid extends Identifier<ShortUlid> {

    private static final long serialVersionUID = 1L;

    public static final ShortUlid MIN = new ShortUlid(new byte[7]);

    public static final ShortUlid MAX = fromBigInteger(IdentifierFormat.SHORT_ULID.maxValue());

    private ShortUlid(byte[] bytes) {
        super(IdentifierFormat.SHORT_ULID, bytes);
    }

    @Override
    protected ShortUlid create(byte[] bytes) {
        return new ShortUlid(bytes);
    }

    @Override
    protected ShortUlid self() {
        return this;
    }

    public static ShortUlid fromBytes(byte[] bytes) {
        return new ShortUlid(bytes);
    }

    public static ShortUlid fromBigInteger(BigInteger value) {
        return new ShortUlid(IdentifierCodec.fromBigInteger(IdentifierFormat.SHORT_ULID, value));
    }

    public static ShortUlid parse(CharSequence text) {
        return new ShortUlid(IdentifierCodec.decode(IdentifierFormat.SHORT_ULID, text));
    }

    public static ShortUlid parseAny(String text) {
        return new ShortUlid(IdentifierCodec.parse(IdentifierFormat.SHORT_ULID, text));
    }

    public static ShortUlid fromHex(String text) {
        return new ShortUlid(IdentifierCodec.fromRadixString(IdentifierFormat.SHORT_ULID, text, Representation.HEX));
    }

    public static ShortUlid fromOctal(String text) {
        return new ShortUlid(IdentifierCodec.fromRadixString(IdentifierFormat.SHORT_ULID, text, Representation.OCTAL));
    }

    public static ShortUlid fromBinary(String text) {
        return new ShortUlid(IdentifierCodec.fromRadixString(IdentifierFormat.SHORT_ULID, text, Representation.BINARY));
    }

    public static ShortUlid fromRepr(String text) {
        return new ShortUlid(IdentifierCodec.fromRepr(IdentifierFormat.SHORT_ULID, text));
    }

    /**
     * 두 필드로 직접 생성.
     *
     * @param timestamp epoch 밀리초 (48비트)
     * @param randomness 0 ~ 255
     * @return ShortUlid
     * @throws com.ryuqq.ulid.core.exception.DecodeException 필드가 비트 폭을 초과하는 경우
     */
    public static ShortUlid of(long timestamp, int randomness) {
        return new ShortUlid(IdentifierCodec.pack(IdentifierFormat.SHORT_ULID, timestamp, BigInteger.valueOf(randomness)));
    }

    public static ShortUlid of(long timestamp, byte[] randomness) {
        return new ShortUlid(IdentifierCodec.pack(IdentifierFormat.SHORT_ULID, timestamp, randomness));
    }

    public static ShortUlid of(Instant instant, int randomness) {
        return of(Timestamps.fromInstant(instant), randomness);
    }
}
