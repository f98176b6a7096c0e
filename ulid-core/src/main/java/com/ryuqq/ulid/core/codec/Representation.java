package com.ryuqq.ulid.core.codec;

import java.math.BigInteger;

/**
 * External representations an identifier can be converted to and from.
 *
 * <p>{@link #of(Object)} classifies a sample value by its type and shape, so that an identifier
 * can be rendered the same way before comparison, or reconstructed from text whose encoding is
 * not known ahead of time.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public enum Representation {

    /** Fixed-length big-endian byte array. */
    BYTES(null, 0),

    /** Unsigned packed value. */
    INTEGER(null, 10),

    /** {@code 0x}-prefixed base-16 text. */
    HEX("0x", 16),

    /** {@code 0o}-prefixed base-8 text. */
    OCTAL("0o", 8),

    /** {@code 0b}-prefixed base-2 text. */
    BINARY("0b", 2),

    /** {@code <Ulid 01ARZ...>} debug text. */
    REPR("<", 0),

    /** Canonical text: Crockford base-32 or plain hex, depending on the format. */
    CANONICAL(null, 0);

    private final String prefix;
    private final int radix;

    Representation(String prefix, int radix) {
        this.prefix = prefix;
        this.radix = radix;
    }

    /**
     * Text prefix marking this representation.
     *
     * @return prefix, or null when the representation has none
     */
    public String prefix() {
        return prefix;
    }

    /**
     * Numeral-system radix for HEX/OCTAL/BINARY.
     *
     * @return radix
     */
    public int radix() {
        return radix;
    }

    public boolean isRadix() {
        return this == HEX || this == OCTAL || this == BINARY;
    }

    /**
     * Determines the representation a sample value is written in.
     *
     * <ul>
     *   <li>{@code byte[]} → BYTES</li>
     *   <li>{@link BigInteger}, {@link Long}, {@link Integer}, {@link Short}, {@link Byte} → INTEGER</li>
     *   <li>text starting with {@code 0x}, {@code 0o}, {@code 0b} (either case) → HEX, OCTAL, BINARY</li>
     *   <li>text starting with {@code <} → REPR</li>
     *   <li>any other text → CANONICAL</li>
     * </ul>
     *
     * @param sample sample value
     * @return matching representation, or null when the type is not supported
     */
    public static Representation of(Object sample) {
        if (sample instanceof byte[]) {
            return BYTES;
        }
        if (sample instanceof BigInteger || sample instanceof Long || sample instanceof Integer
                || sample instanceof Short || sample instanceof Byte) {
            return INTEGER;
        }
        if (sample instanceof CharSequence) {
            return ofText(sample.toString());
        }
        return null;
    }

    static Representation ofText(String text) {
        if (text.length() >= 2 && text.charAt(0) == '0') {
            switch (Character.toLowerCase(text.charAt(1))) {
                case 'x':
                    return HEX;
                case 'o':
                    return OCTAL;
                case 'b':
                    return BINARY;
                default:
                    break;
            }
        }
        if (text.startsWith(REPR.prefix)) {
            return REPR;
        }
        return CANONICAL;
    }
}
