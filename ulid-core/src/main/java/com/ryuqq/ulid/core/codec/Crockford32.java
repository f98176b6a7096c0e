package com.ryuqq.ulid.core.codec;

import com.ryuqq.ulid.core.exception.DecodeException;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Crockford base-32 encoding of unsigned integers.
 *
 * <p>Each character carries 5 bits. The alphabet omits {@code I}, {@code L}, {@code O} and
 * {@code U}; encoding is upper-case, decoding accepts either case. Values are right-aligned:
 * a field of {@code n} bits is written as {@code ceil(n / 5)} characters whose leading unused
 * bits are zero, and decoding rejects text whose value needs more than {@code n} bits.</p>
 *
 * <p><strong>Thread-safety:</strong> stateless, safe for concurrent use.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public final class Crockford32 {

    /** Encoding alphabet. */
    public static final String ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ";

    private static final char[] ENCODING = ALPHABET.toCharArray();
    private static final byte[] DECODING = new byte[128];

    static {
        Arrays.fill(DECODING, (byte) -1);
        for (int i = 0; i < ENCODING.length; i++) {
            DECODING[ENCODING[i]] = (byte) i;
            DECODING[Character.toLowerCase(ENCODING[i])] = (byte) i;
        }
    }

    private Crockford32() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Number of characters needed for a field of the given width.
     *
     * @param bits field width in bits
     * @return {@code ceil(bits / 5)}
     */
    public static int charsFor(int bits) {
        return (bits + 4) / 5;
    }

    /**
     * Encodes an unsigned value of at most {@code bits} bits.
     *
     * @param value non-negative value
     * @param bits field width
     * @return upper-case text of {@link #charsFor(int)} characters
     * @throws IllegalArgumentException if the value is negative or wider than {@code bits}
     */
    public static String encode(BigInteger value, int bits) {
        if (value.signum() < 0 || value.bitLength() > bits) {
            throw new IllegalArgumentException(
                "value must fit in " + bits + " unsigned bits (current: " + value + ")"
            );
        }
        char[] chars = new char[charsFor(bits)];
        BigInteger remaining = value;
        for (int i = chars.length - 1; i >= 0; i--) {
            chars[i] = ENCODING[remaining.intValue() & 0x1F];
            remaining = remaining.shiftRight(5);
        }
        return new String(chars);
    }

    /**
     * Encodes an unsigned value of at most {@code bits} bits ({@code bits <= 63}).
     *
     * @param value non-negative value
     * @param bits field width
     * @return upper-case text
     */
    public static String encode(long value, int bits) {
        if (bits > 63) {
            return encode(BigInteger.valueOf(value), bits);
        }
        if (value < 0 || (value >>> bits) != 0) {
            throw new IllegalArgumentException(
                "value must fit in " + bits + " unsigned bits (current: " + value + ")"
            );
        }
        char[] chars = new char[charsFor(bits)];
        for (int i = chars.length - 1; i >= 0; i--) {
            chars[i] = ENCODING[(int) (value & 0x1F)];
            value >>>= 5;
        }
        return new String(chars);
    }

    /**
     * Decodes a field of {@code bits} bits.
     *
     * @param text exactly {@link #charsFor(int)} characters, either case
     * @param bits field width
     * @return decoded unsigned value
     * @throws DecodeException on wrong length, a character outside the alphabet, or overflow
     */
    public static BigInteger decode(CharSequence text, int bits) {
        if (text == null) {
            throw new DecodeException("text cannot be null");
        }
        int expected = charsFor(bits);
        if (text.length() != expected) {
            throw new DecodeException(
                "base-32 field must be " + expected + " characters (current: " + text.length() + ")"
            );
        }
        BigInteger value = BigInteger.ZERO;
        for (int i = 0; i < text.length(); i++) {
            value = value.shiftLeft(5).or(BigInteger.valueOf(digit(text.charAt(i), i)));
        }
        if (value.bitLength() > bits) {
            throw new DecodeException("base-32 field overflows " + bits + " bits: " + text);
        }
        return value;
    }

    /**
     * Decodes a field of at most 63 bits.
     *
     * @param text exactly {@link #charsFor(int)} characters, either case
     * @param bits field width ({@code <= 63})
     * @return decoded unsigned value
     * @throws DecodeException on wrong length, a character outside the alphabet, or overflow
     */
    public static long decodeLong(CharSequence text, int bits) {
        if (bits > 63) {
            throw new IllegalArgumentException("bits must be at most 63 (current: " + bits + ")");
        }
        return decode(text, bits).longValueExact();
    }

    /**
     * Checks whether every character belongs to the alphabet.
     *
     * @param text candidate text
     * @return true if non-empty and fully within the alphabet (either case)
     */
    public static boolean isValid(CharSequence text) {
        if (text == null || text.length() == 0) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= DECODING.length || DECODING[c] < 0) {
                return false;
            }
        }
        return true;
    }

    private static int digit(char c, int index) {
        if (c >= DECODING.length || DECODING[c] < 0) {
            throw new DecodeException("invalid base-32 character '" + c + "' at index " + index);
        }
        return DECODING[c];
    }
}
