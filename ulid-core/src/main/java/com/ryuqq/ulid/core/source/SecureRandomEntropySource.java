package com.ryuqq.ulid.core.source;

import com.ryuqq.ulid.core.spi.EntropySource;

import java.security.SecureRandom;

/**
 * {@link EntropySource} backed by {@link SecureRandom}.
 *
 * <p>{@link SecureRandom} is thread-safe; a single instance is shared by all callers.</p>
 *
 * @author ULID Team
 * @since 1.0.0
 */
public final class SecureRandomEntropySource implements EntropySource {

    private final SecureRandom random;

    public SecureRandomEntropySource() {
        this(new SecureRandom());
    }

    /**
     * Creates an entropy source drawing from the given generator.
     *
     * @param random generator
     * @throws IllegalArgumentException if random is null
     */
    public SecureRandomEntropySource(SecureRandom random) {
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.random = random;
    }

    @Override
    public byte[] nextBytes(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative (current: " + length + ")");
        }
        byte[] bytes = new byte[length];
        random.nextBytes(bytes);
        return bytes;
    }
}
