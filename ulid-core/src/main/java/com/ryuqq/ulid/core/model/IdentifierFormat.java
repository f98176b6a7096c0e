package com.ryuqq.ulid.core.model;

import java.math.BigInteger;

/**
 * 식별자 포맷 정의.
 *
 * <p>모든 포맷은 48비트 timestamp 뒤에 포맷별 randomness 필드가 붙는
 * big-endian 고정 길이 바이트 배열입니다 (패딩 없음).</p>
 *
 * <table>
 *   <caption>포맷별 레이아웃</caption>
 *   <tr><th>포맷</th><th>randomness</th><th>전체</th><th>문자열</th></tr>
 *   <tr><td>ULID</td><td>80bit</td><td>128bit / 16byte</td><td>Crockford base-32, 26자</td></tr>
 *   <tr><td>SHORT_ULID</td><td>8bit</td><td>56bit / 7byte</td><td>Crockford base-32, 12자</td></tr>
 *   <tr><td>SLID</td><td>16bit</td><td>64bit / 8byte</td><td>소문자 hex, 16자</td></tr>
 * </table>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public enum IdentifierFormat {

    /** 128비트 ULID. */
    ULID("Ulid", 80, TextEncoding.CROCKFORD),

    /** short_env_lexical 전용 56비트 ULID. */
    SHORT_ULID("ShortUlid", 8, TextEncoding.CROCKFORD),

    /** 64비트 compact 식별자. */
    SLID("Slid", 16, TextEncoding.HEX);

    /** timestamp 필드 비트 폭 (모든 포맷 공통). */
    public static final int TIMESTAMP_BITS = 48;

    /** timestamp 필드 바이트 길이. */
    public static final int TIMESTAMP_BYTES = TIMESTAMP_BITS / 8;

    /** timestamp 세그먼트의 Crockford 문자 수. */
    public static final int TIMESTAMP_CHARS = 10;

    /**
     * 문자열 인코딩 방식.
     */
    public enum TextEncoding {
        /** 대문자 Crockford base-32, timestamp/randomness 세그먼트별 오른쪽 정렬. */
        CROCKFORD,
        /** 소문자 16진수, 전체 값 한 번에. */
        HEX
    }

    private final String displayName;
    private final int randomnessBits;
    private final TextEncoding textEncoding;
    private final BigInteger modulus;

    IdentifierFormat(String displayName, int randomnessBits, TextEncoding textEncoding) {
        this.displayName = displayName;
        this.randomnessBits = randomnessBits;
        this.textEncoding = textEncoding;
        this.modulus = BigInteger.ONE.shiftLeft(TIMESTAMP_BITS + randomnessBits);
    }

    /**
     * repr 표현에 사용되는 이름.
     *
     * @return 표시 이름 (예: "Ulid")
     */
    public String displayName() {
        return displayName;
    }

    public int randomnessBits() {
        return randomnessBits;
    }

    public int randomnessBytes() {
        return randomnessBits / 8;
    }

    public int totalBits() {
        return TIMESTAMP_BITS + randomnessBits;
    }

    public int byteLength() {
        return totalBits() / 8;
    }

    public TextEncoding textEncoding() {
        return textEncoding;
    }

    /**
     * 정규 문자열 길이.
     *
     * @return ULID 26, SHORT_ULID 12, SLID 16
     */
    public int textLength() {
        if (textEncoding == TextEncoding.HEX) {
            return totalBits() / 4;
        }
        return TIMESTAMP_CHARS + randomnessChars();
    }

    /**
     * randomness 세그먼트의 Crockford 문자 수.
     *
     * @return ceil(randomnessBits / 5)
     */
    public int randomnessChars() {
        return (randomnessBits + 4) / 5;
    }

    /**
     * 전체 값의 모듈러스 (2^totalBits).
     *
     * @return 2^totalBits
     */
    public BigInteger modulus() {
        return modulus;
    }

    /**
     * 표현 가능한 최대 packed 값.
     *
     * @return 2^totalBits - 1
     */
    public BigInteger maxValue() {
        return modulus.subtract(BigInteger.ONE);
    }

    /**
     * randomness 필드의 최대값.
     *
     * @return 2^randomnessBits - 1
     */
    public BigInteger maxRandomness() {
        return BigInteger.ONE.shiftLeft(randomnessBits).subtract(BigInteger.ONE);
    }
}
