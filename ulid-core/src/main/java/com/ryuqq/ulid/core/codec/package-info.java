/**
 * Codec package: pure conversions between identifiers and their external representations.
 *
 * <ul>
 *   <li>{@link com.ryuqq.ulid.core.codec.Crockford32} - Crockford base-32 field encoding</li>
 *   <li>{@link com.ryuqq.ulid.core.codec.IdentifierCodec} - bytes, integer, canonical, numeral and repr conversions</li>
 *   <li>{@link com.ryuqq.ulid.core.codec.Representation} - representation detection from a sample value</li>
 * </ul>
 *
 * <p>Malformed input raises {@link com.ryuqq.ulid.core.exception.DecodeException} immediately.</p>
 *
 * @since 1.0.0
 * @author ULID Team
 */
package com.ryuqq.ulid.core.codec;
