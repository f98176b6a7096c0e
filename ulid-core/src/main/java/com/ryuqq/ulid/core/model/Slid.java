package com.ryuqq.ulid.core.model;

import com.ryuqq.ulid.core.codec.IdentifierCodec;
import com.ryuqq.ulid.core.codec.Representation;

import java.math.BigInteger;
import java.time.Instant;

/**
 * 64비트 compact 식별자 (SLID).
 *
 * <pre>
 * [TIMESTAMP(48bit|6bytes)][ENV-ID(8bit|1byte)][COUNTER(8bit|1byte)]
 * </pre>
 *
 * <p><strong>문자열:</strong> 16자 hex (대소문자 무시 파싱, 소문자 정규형)</p>
 *
 * <p>예: timestamp {@code 0x00000170A3C1}, randomness {@code 0x0203}
 * → {@code "00000170a3c10203"}</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public final class Slid extends Identifier<Slid> {

    private static final long serialVersionUID = 1L;

    public static final Slid MIN = new Slid(new byte[8]);

    public static final Slid MAX = fromBigInteger(IdentifierFormat.SLID.maxValue());

    private Slid(byte[] bytes) {
        super(IdentifierFormat.SLID, bytes);
    }

    @Override
    protected Slid create(byte[] bytes) {
        return new Slid(bytes);
    }

    @Override
    protected Slid self() {
        return this;
    }

    public static Slid fromBytes(byte[] bytes) {
        return new Slid(bytes);
    }

    public static Slid fromBigInteger(BigInteger value) {
        return new Slid(IdentifierCodec.fromBigInteger(IdentifierFormat.SLID, value));
    }

    /**
     * 64비트 패턴을 그대로 해석 (음수 long은 최상위 비트가 1인 값).
     *
     * @param bits packed 비트
     * @return Slid
     */
    public static Slid fromLong(long bits) {
        byte[] bytes = new byte[8];
        for (int i = 7; i >= 0; i--) {
            bytes[i] = (byte) bits;
            bits >>>= 8;
        }
        return new Slid(bytes);
    }

    public static Slid parse(CharSequence text) {
        return new Slid(IdentifierCodec.decode(IdentifierFormat.SLID, text));
    }

    public static Slid parseAny(String text) {
        return new Slid(IdentifierCodec.parse(IdentifierFormat.SLID, text));
    }

    public static Slid fromHex(String text) {
        return new Slid(IdentifierCodec.fromRadixString(IdentifierFormat.SLID, text, Representation.HEX));
    }

    public static Slid fromOctal(String text) {
        return new Slid(IdentifierCodec.fromRadixString(IdentifierFormat.SLID, text, Representation.OCTAL));
    }

    public static Slid fromBinary(String text) {
        return new Slid(IdentifierCodec.fromRadixString(IdentifierFormat.SLID, text, Representation.BINARY));
    }

    public static Slid fromRepr(String text) {
        return new Slid(IdentifierCodec.fromRepr(IdentifierFormat.SLID, text));
    }

    /**
     * 두 필드로 직접 생성.
     *
     * @param timestamp epoch 밀리초 (48비트)
     * @param randomness 0 ~ 65535
     * @return Slid
     * @throws com.ryuqq.ulid.core.exception.DecodeException 필드가 비트 폭을 초과하는 경우
     */
    public static Slid of(long timestamp, int randomness) {
        return new Slid(IdentifierCodec.pack(IdentifierFormat.SLID, timestamp, BigInteger.valueOf(randomness)));
    }

    public static Slid of(long timestamp, byte[] randomness) {
        return new Slid(IdentifierCodec.pack(IdentifierFormat.SLID, timestamp, randomness));
    }

    public static Slid of(Instant instant, int randomness) {
        return of(Timestamps.fromInstant(instant), randomness);
    }

    /**
     * packed value를 long 비트 패턴으로 조회.
     *
     * @return 64비트 (부호 비트 포함)
     */
    public long toLong() {
        long value = 0;
        for (byte b : toBytes()) {
            value = (value << 8) | (b & 0xFFL);
        }
        return value;
    }
}
