package com.ryuqq.ulid.core.model;

import com.ryuqq.ulid.core.codec.IdentifierCodec;
import com.ryuqq.ulid.core.codec.Representation;
import com.ryuqq.ulid.core.progression.IdentifierSequence;
import com.ryuqq.ulid.core.progression.Progression;

import java.io.Serializable;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Arrays;

/**
 * 정렬 가능한 고정 길이 식별자의 공통 기반.
 *
 * <p>식별자는 48비트 timestamp와 포맷별 randomness 필드를 big-endian으로
 * 이어 붙인 바이트 배열 하나로 표현됩니다. 이 배열을 부호 없는 정수로 본 값이
 * packed value이며, 동등성과 정렬은 packed value 비교로 정의됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가. 모든 진행(progression) 연산은
 * 새 인스턴스를 반환합니다.</p>
 *
 * <p><strong>정렬:</strong> 바이트 사전순 = packed value 순 = timestamp 순
 * (동일 밀리초는 randomness 순)</p>
 *
 * @param <T> 구체 식별자 타입
 * @author ULID Team
 * @since 1.0.0
 */
public abstract class Identifier<T extends Identifier<T>> implements Comparable<T>, Serializable {

    private static final long serialVersionUID = 1L;

    private final IdentifierFormat format;
    private final byte[] bytes;

    /**
     * 바이트 배열로 생성 (배열은 복사됨).
     *
     * @param format 식별자 포맷
     * @param bytes packed 바이트 배열
     * @throws com.ryuqq.ulid.core.exception.DecodeException 길이가 포맷과 다른 경우
     */
    protected Identifier(IdentifierFormat format, byte[] bytes) {
        this.format = format;
        this.bytes = IdentifierCodec.requireBytes(format, bytes);
    }

    /**
     * 같은 포맷의 새 인스턴스 생성.
     *
     * @param bytes 검증된 packed 바이트 배열
     * @return 새 식별자
     */
    protected abstract T create(byte[] bytes);

    /**
     * 구체 타입으로 본 자기 자신.
     *
     * @return this
     */
    protected abstract T self();

    public IdentifierFormat format() {
        return format;
    }

    // ============================================================
    // 구성 요소
    // ============================================================

    /**
     * timestamp 필드 조회.
     *
     * @return epoch 밀리초 (48비트)
     */
    public long timestamp() {
        return Timestamps.fromBytes(bytes);
    }

    /**
     * timestamp를 Instant로 조회.
     *
     * @return 생성 시각
     */
    public Instant instant() {
        return Instant.ofEpochMilli(timestamp());
    }

    /**
     * timestamp를 epoch 초로 조회.
     *
     * @return epoch 초 (밀리초는 소수부)
     */
    public double seconds() {
        return Timestamps.toSeconds(timestamp());
    }

    /**
     * timestamp를 epoch 나노초로 조회.
     *
     * @return epoch 나노초 (항상 1,000,000의 배수)
     * @throws ArithmeticException 2262-04-11 이후 timestamp인 경우
     */
    public long nanoseconds() {
        return Timestamps.toNanoseconds(timestamp());
    }

    /**
     * randomness 필드 조회.
     *
     * @return 부호 없는 정수
     */
    public BigInteger randomness() {
        return new BigInteger(1, randomnessBytes());
    }

    /**
     * randomness 필드의 선두 비트 조회.
     *
     * <p>env 계열 전략이 기록한 seed(prime)를 확인할 때 사용합니다.
     * 어떤 전략이 몇 비트를 seed로 쓰는지는
     * {@link com.ryuqq.ulid.core.strategy.StrategyKind#primeOf(Identifier)}가 알고 있습니다.</p>
     *
     * @param bits 읽을 비트 수 (1 ~ min(randomnessBits, 31))
     * @return randomness 상위 bits 비트
     * @throws IllegalArgumentException bits가 범위를 벗어난 경우
     */
    public int prime(int bits) {
        int max = Math.min(format.randomnessBits(), 31);
        if (bits < 1 || bits > max) {
            throw new IllegalArgumentException(
                "bits must be between 1 and " + max + " (current: " + bits + ")"
            );
        }
        return randomness().shiftRight(format.randomnessBits() - bits).intValue();
    }

    // ============================================================
    // 표현 변환
    // ============================================================

    /**
     * packed 바이트 배열 (복사본).
     *
     * @return big-endian 바이트 배열
     */
    public byte[] toBytes() {
        return bytes.clone();
    }

    public byte[] timestampBytes() {
        return Arrays.copyOfRange(bytes, 0, IdentifierFormat.TIMESTAMP_BYTES);
    }

    public byte[] randomnessBytes() {
        return Arrays.copyOfRange(bytes, IdentifierFormat.TIMESTAMP_BYTES, bytes.length);
    }

    /**
     * packed value 조회.
     *
     * @return 부호 없는 정수
     */
    public BigInteger toBigInteger() {
        return new BigInteger(1, bytes);
    }

    /**
     * 정규 문자열 표현.
     *
     * @return Crockford base-32 대문자 (ULID 계열) 또는 소문자 hex (SLID)
     */
    @Override
    public String toString() {
        return IdentifierCodec.encode(format, bytes);
    }

    /**
     * 정규 문자열의 timestamp 부분.
     *
     * @return Crockford 포맷이면 앞 10자, hex 포맷이면 앞 12자
     */
    public String timestampString() {
        int length = format.textEncoding() == IdentifierFormat.TextEncoding.CROCKFORD
            ? IdentifierFormat.TIMESTAMP_CHARS
            : IdentifierFormat.TIMESTAMP_BYTES * 2;
        return toString().substring(0, length);
    }

    public String toHex() {
        return IdentifierCodec.toRadixString(bytes, Representation.HEX);
    }

    public String toOctal() {
        return IdentifierCodec.toRadixString(bytes, Representation.OCTAL);
    }

    public String toBinary() {
        return IdentifierCodec.toRadixString(bytes, Representation.BINARY);
    }

    /**
     * 디버깅용 표현.
     *
     * @return {@code <Ulid 01ARZ3NDEKTSV4RRFFQ69G5FAV>} 형태
     */
    public String toRepr() {
        return IdentifierCodec.toRepr(format, bytes);
    }

    /**
     * 지정한 표현으로 변환.
     *
     * @param representation 대상 표현
     * @return BYTES는 byte[], INTEGER는 BigInteger, 그 외는 String
     * @throws IllegalArgumentException representation이 null인 경우
     */
    public Object as(Representation representation) {
        return IdentifierCodec.render(format, bytes, representation);
    }

    /**
     * 임의 표현의 값과 동일한 식별자인지 비교.
     *
     * <p>비교 대상의 형태로 표현을 판별한 뒤({@link Representation#of(Object)})
     * 같은 표현으로 변환해 비교합니다. 문자열 비교는 대소문자를 구분하지 않습니다.
     * 정규 길이와 정규 문자만으로 된 문자열은 {@code 0B}, {@code 0X}로 시작하더라도 정규 표현으로 봅니다
     * ({@link IdentifierCodec#parse(IdentifierFormat, String)}와 같은 규칙).</p>
     *
     * @param other 식별자, byte[], 정수 또는 문자열
     * @return 같은 값을 가리키면 true
     */
    public boolean sameAs(Object other) {
        if (other instanceof Identifier<?>) {
            return equals(other);
        }
        if (other instanceof CharSequence && IdentifierCodec.isCanonical(format, other.toString())) {
            return toString().equalsIgnoreCase(other.toString());
        }
        Representation representation = Representation.of(other);
        if (representation == null) {
            return false;
        }
        return switch (representation) {
            case BYTES -> Arrays.equals(bytes, (byte[]) other);
            case INTEGER -> toBigInteger().equals(new BigInteger(other.toString()));
            case REPR -> toRepr().equals(other.toString());
            default -> as(representation).toString().equalsIgnoreCase(other.toString());
        };
    }

    // ============================================================
    // 진행 (Progression)
    // ============================================================

    /**
     * packed value를 받아 같은 포맷의 식별자 생성.
     *
     * @param packedValue 0 ~ 2^totalBits-1
     * @return 새 식별자
     * @throws com.ryuqq.ulid.core.exception.DecodeException 범위를 벗어난 경우
     */
    public T withPackedValue(BigInteger packedValue) {
        return create(IdentifierCodec.fromBigInteger(format, packedValue));
    }

    public T next() {
        return Progression.next(self());
    }

    public T previous() {
        return Progression.previous(self());
    }

    public T forward(long n) {
        return Progression.forward(self(), BigInteger.valueOf(n));
    }

    public T forward(BigInteger n) {
        return Progression.forward(self(), n);
    }

    public T backward(long n) {
        return Progression.backward(self(), BigInteger.valueOf(n));
    }

    public T backward(BigInteger n) {
        return Progression.backward(self(), n);
    }

    /**
     * 이 식별자부터 +1씩 증가하는 지연 시퀀스.
     *
     * @param count 원소 수 (0 이상)
     * @return 재시작 가능한 시퀀스
     */
    public IdentifierSequence<T> sequence(long count) {
        return Progression.sequence(self(), count);
    }


    // ============================================================
    // 동등성 / 정렬
    // ============================================================

    @Override
    public int compareTo(T other) {
        return Arrays.compareUnsigned(bytes, other.bytesView());
    }

    byte[] bytesView() {
        return bytes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Identifier<?> that = (Identifier<?>) o;
        return format == that.format && Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }
}
