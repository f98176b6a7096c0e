package com.ryuqq.ulid.core.codec;

import com.ryuqq.ulid.core.exception.DecodeException;
import com.ryuqq.ulid.core.model.IdentifierFormat;
import com.ryuqq.ulid.core.model.Timestamps;

import java.math.BigInteger;
import java.util.HexFormat;

/**
 * Bit-exact conversions between the packed byte form of an identifier and its other
 * representations.
 *
 * <p>Every {@code from*}/{@code decode}/{@code parse} operation either returns a freshly
 * allocated byte array of exactly {@link IdentifierFormat#byteLength()} bytes or throws
 * {@link DecodeException}. No conversion has side effects.</p>
 *
 * <p><strong>Conversion surface:</strong></p>
 * <ul>
 *   <li>bytes ↔ packed bytes: length check only</li>
 *   <li>unsigned integer ↔ packed bytes: big-endian, range {@code [0, 2^totalBits)}</li>
 *   <li>canonical text ↔ packed bytes: Crockford base-32 (ULID formats) or lower-case hex (SLID)</li>
 *   <li>{@code 0x}/{@code 0o}/{@code 0b} text ↔ packed bytes: numeral-system views of the integer form</li>
 *   <li>{@code (timestamp, randomness)} ↔ packed bytes: field-wise packing with width checks</li>
 * </ul>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public final class IdentifierCodec {

    private static final HexFormat HEX = HexFormat.of();

    private IdentifierCodec() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    // ============================================================
    // bytes / integer
    // ============================================================

    /**
     * Validates the length of a packed byte array and returns a copy.
     *
     * @param format identifier format
     * @param bytes candidate bytes
     * @return defensive copy
     * @throws DecodeException if bytes is null or has the wrong length
     */
    public static byte[] requireBytes(IdentifierFormat format, byte[] bytes) {
        requireFormat(format);
        if (bytes == null) {
            throw new DecodeException("bytes cannot be null");
        }
        if (bytes.length != format.byteLength()) {
            throw new DecodeException(
                format.displayName() + " requires " + format.byteLength() + " bytes (current: " + bytes.length + ")"
            );
        }
        return bytes.clone();
    }

    public static BigInteger toBigInteger(byte[] bytes) {
        return new BigInteger(1, bytes);
    }

    /**
     * Converts an unsigned packed value into its byte form.
     *
     * @param format identifier format
     * @param value packed value
     * @return big-endian bytes
     * @throws DecodeException if the value is null, negative or wider than the format
     */
    public static byte[] fromBigInteger(IdentifierFormat format, BigInteger value) {
        requireFormat(format);
        if (value == null) {
            throw new DecodeException("value cannot be null");
        }
        if (value.signum() < 0) {
            throw new DecodeException("value cannot be negative (current: " + value + ")");
        }
        if (value.bitLength() > format.totalBits()) {
            throw new DecodeException(
                "value exceeds " + format.totalBits() + " bits (current: 0x" + value.toString(16) + ")"
            );
        }
        return toFixedBytes(value, format.byteLength());
    }

    /**
     * Packs the two fields into the byte layout of the format.
     *
     * @param format identifier format
     * @param timestamp epoch milliseconds (48 bits)
     * @param randomness unsigned randomness field
     * @return packed bytes
     * @throws DecodeException if either field exceeds its width
     */
    public static byte[] pack(IdentifierFormat format, long timestamp, BigInteger randomness) {
        requireFormat(format);
        Timestamps.requireValid(timestamp);
        if (randomness == null) {
            throw new DecodeException("randomness cannot be null");
        }
        if (randomness.signum() < 0 || randomness.bitLength() > format.randomnessBits()) {
            throw new DecodeException(
                "randomness must fit in " + format.randomnessBits() + " unsigned bits (current: " + randomness + ")"
            );
        }
        byte[] packed = new byte[format.byteLength()];
        System.arraycopy(Timestamps.toBytes(timestamp), 0, packed, 0, IdentifierFormat.TIMESTAMP_BYTES);
        byte[] field = toFixedBytes(randomness, format.randomnessBytes());
        System.arraycopy(field, 0, packed, IdentifierFormat.TIMESTAMP_BYTES, field.length);
        return packed;
    }

    /**
     * Packs a timestamp with a randomness field given as raw bytes.
     *
     * @param format identifier format
     * @param timestamp epoch milliseconds (48 bits)
     * @param randomness exactly {@link IdentifierFormat#randomnessBytes()} bytes
     * @return packed bytes
     * @throws DecodeException if the timestamp overflows or the field has the wrong length
     */
    public static byte[] pack(IdentifierFormat format, long timestamp, byte[] randomness) {
        requireFormat(format);
        Timestamps.requireValid(timestamp);
        if (randomness == null) {
            throw new DecodeException("randomness cannot be null");
        }
        if (randomness.length != format.randomnessBytes()) {
            throw new DecodeException(
                "randomness requires " + format.randomnessBytes() + " bytes (current: " + randomness.length + ")"
            );
        }
        byte[] packed = new byte[format.byteLength()];
        System.arraycopy(Timestamps.toBytes(timestamp), 0, packed, 0, IdentifierFormat.TIMESTAMP_BYTES);
        System.arraycopy(randomness, 0, packed, IdentifierFormat.TIMESTAMP_BYTES, randomness.length);
        return packed;
    }

    // ============================================================
    // canonical text
    // ============================================================

    /**
     * Encodes packed bytes as canonical text.
     *
     * @param format identifier format
     * @param bytes packed bytes of the format's length
     * @return upper-case Crockford base-32 or lower-case hex
     */
    public static String encode(IdentifierFormat format, byte[] bytes) {
        requireFormat(format);
        if (format.textEncoding() == IdentifierFormat.TextEncoding.HEX) {
            return HEX.formatHex(bytes);
        }
        BigInteger randomness = new BigInteger(1, bytes, IdentifierFormat.TIMESTAMP_BYTES, format.randomnessBytes());
        return Crockford32.encode(Timestamps.fromBytes(bytes), IdentifierFormat.TIMESTAMP_BITS)
            + Crockford32.encode(randomness, format.randomnessBits());
    }

    /**
     * Decodes canonical text, case-insensitively.
     *
     * @param format identifier format
     * @param text canonical text of {@link IdentifierFormat#textLength()} characters
     * @return packed bytes
     * @throws DecodeException on wrong length or a character outside the alphabet
     */
    public static byte[] decode(IdentifierFormat format, CharSequence text) {
        requireFormat(format);
        if (text == null) {
            throw new DecodeException("text cannot be null");
        }
        if (text.length() != format.textLength()) {
            throw new DecodeException(
                format.displayName() + " text must be " + format.textLength()
                    + " characters (current: " + text.length() + ")"
            );
        }
        if (format.textEncoding() == IdentifierFormat.TextEncoding.HEX) {
            for (int i = 0; i < text.length(); i++) {
                if (!isHexDigit(text.charAt(i))) {
                    throw new DecodeException("invalid hex character '" + text.charAt(i) + "' at index " + i);
                }
            }
            return HEX.parseHex(text);
        }
        int split = IdentifierFormat.TIMESTAMP_CHARS;
        long timestamp = Crockford32.decodeLong(text.subSequence(0, split), IdentifierFormat.TIMESTAMP_BITS);
        BigInteger randomness = Crockford32.decode(text.subSequence(split, text.length()), format.randomnessBits());
        return pack(format, timestamp, randomness);
    }

    // ============================================================
    // auxiliary text
    // ============================================================

    /**
     * Renders the integer form in a prefixed numeral system.
     *
     * @param bytes packed bytes
     * @param representation HEX, OCTAL or BINARY
     * @return e.g. {@code 0x1f}, {@code 0o37}, {@code 0b11111}
     */
    public static String toRadixString(byte[] bytes, Representation representation) {
        requireRadix(representation);
        return representation.prefix() + toBigInteger(bytes).toString(representation.radix());
    }

    /**
     * Parses a numeral-system view of the integer form. The prefix is optional.
     *
     * @param format identifier format
     * @param text digits, optionally prefixed
     * @param representation HEX, OCTAL or BINARY
     * @return packed bytes
     * @throws DecodeException on invalid digits or an out-of-range value
     */
    public static byte[] fromRadixString(IdentifierFormat format, String text, Representation representation) {
        requireRadix(representation);
        if (text == null) {
            throw new DecodeException("text cannot be null");
        }
        String digits = text;
        if (digits.regionMatches(true, 0, representation.prefix(), 0, 2)) {
            digits = digits.substring(2);
        }
        if (digits.isEmpty()) {
            throw new DecodeException("no digits in " + representation + " text: '" + text + "'");
        }
        BigInteger value;
        try {
            value = new BigInteger(digits, representation.radix());
        } catch (NumberFormatException e) {
            throw new DecodeException("invalid " + representation + " text: '" + text + "'", e);
        }
        return fromBigInteger(format, value);
    }

    public static String toRepr(IdentifierFormat format, byte[] bytes) {
        return "<" + format.displayName() + " " + encode(format, bytes) + ">";
    }

    /**
     * Parses the debug form {@code <Name CANONICAL>}.
     *
     * @param format identifier format
     * @param text repr text
     * @return packed bytes
     * @throws DecodeException if the text is not a repr of this format
     */
    public static byte[] fromRepr(IdentifierFormat format, String text) {
        requireFormat(format);
        if (text == null || !text.startsWith("<") || !text.endsWith(">")) {
            throw new DecodeException("repr must be enclosed in angle brackets: " + text);
        }
        String inner = text.substring(1, text.length() - 1);
        int space = inner.indexOf(' ');
        if (space < 0 || !inner.substring(0, space).equals(format.displayName())) {
            throw new DecodeException("repr is not a " + format.displayName() + ": " + text);
        }
        return decode(format, inner.substring(space + 1));
    }

    // ============================================================
    // representation dispatch
    // ============================================================

    /**
     * Renders packed bytes in the requested representation.
     *
     * @param format identifier format
     * @param bytes packed bytes
     * @param representation target representation
     * @return byte[] for BYTES, BigInteger for INTEGER, String otherwise
     */
    public static Object render(IdentifierFormat format, byte[] bytes, Representation representation) {
        if (representation == null) {
            throw new IllegalArgumentException("representation cannot be null");
        }
        return switch (representation) {
            case BYTES -> bytes.clone();
            case INTEGER -> toBigInteger(bytes);
            case HEX, OCTAL, BINARY -> toRadixString(bytes, representation);
            case REPR -> toRepr(format, bytes);
            case CANONICAL -> encode(format, bytes);
        };
    }

    /**
     * Reconstructs an identifier from any textual representation.
     *
     * <p>Text of canonical length made only of canonical characters is decoded as canonical
     * first, because canonical text may itself begin with {@code 0b} or {@code 0x}. Otherwise the
     * representation is chosen by prefix ({@link Representation#of(Object)}).</p>
     *
     * @param format identifier format
     * @param text canonical, prefixed numeral or repr text
     * @return packed bytes
     * @throws DecodeException if no representation matches
     */
    public static byte[] parse(IdentifierFormat format, String text) {
        requireFormat(format);
        if (text == null) {
            throw new DecodeException("text cannot be null");
        }
        if (isCanonical(format, text)) {
            return decode(format, text);
        }
        Representation representation = Representation.ofText(text);
        return switch (representation) {
            case HEX, OCTAL, BINARY -> fromRadixString(format, text, representation);
            case REPR -> fromRepr(format, text);
            default -> decode(format, text);
        };
    }

    /**
     * Checks whether text has the canonical length and alphabet of the format.
     *
     * <p>Such text is read as canonical even when it begins with a numeral prefix.</p>
     *
     * @param format identifier format
     * @param text candidate text
     * @return true if {@link #decode(IdentifierFormat, String)} accepts the text
     */
    public static boolean isCanonical(IdentifierFormat format, String text) {
        requireFormat(format);
        return text != null && text.length() == format.textLength() && hasCanonicalAlphabet(format, text);
    }

    private static boolean hasCanonicalAlphabet(IdentifierFormat format, String text) {
        if (format.textEncoding() == IdentifierFormat.TextEncoding.CROCKFORD) {
            return Crockford32.isValid(text);
        }
        for (int i = 0; i < text.length(); i++) {
            if (!isHexDigit(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isHexDigit(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    /**
     * Writes a non-negative value right-aligned into a big-endian array of fixed length.
     *
     * <p>Bits above {@code length * 8} are dropped; callers validate the range first.</p>
     *
     * @param value non-negative value
     * @param length array length
     * @return big-endian bytes
     */
    public static byte[] toFixedBytes(BigInteger value, int length) {
        byte[] raw = value.toByteArray();
        byte[] fixed = new byte[length];
        int copy = Math.min(raw.length, length);
        System.arraycopy(raw, raw.length - copy, fixed, length - copy, copy);
        return fixed;
    }

    private static void requireFormat(IdentifierFormat format) {
        if (format == null) {
            throw new IllegalArgumentException("format cannot be null");
        }
    }

    private static void requireRadix(Representation representation) {
        if (representation == null || !representation.isRadix()) {
            throw new IllegalArgumentException(
                "representation must be HEX, OCTAL or BINARY (current: " + representation + ")"
            );
        }
    }
}
