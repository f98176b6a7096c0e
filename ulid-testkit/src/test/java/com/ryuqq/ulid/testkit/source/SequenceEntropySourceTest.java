package com.ryuqq.ulid.testkit.source;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 테스트 더블 자체 검증.
 *
 * @author ULID Team
 * @since 1.0.0
 */
class SequenceEntropySourceTest {

    @Test
    void nextBytes_ContinuesPatternAcrossCalls() {
        // Given
        SequenceEntropySource entropy = new SequenceEntropySource(1, 2, 3);

        // Then
        assertArrayEquals(new byte[] {1, 2}, entropy.nextBytes(2));
        assertArrayEquals(new byte[] {3, 1}, entropy.nextBytes(2));
        assertEquals(2, entropy.calls());
    }

    @Test
    void constructor_InvalidPattern_ThrowsException() {
        assertThrows(IllegalArgumentException.class, SequenceEntropySource::new);
        assertThrows(IllegalArgumentException.class, () -> new SequenceEntropySource(256));
    }

    @Test
    void manualTimeSource_AdvancesOnlyWhenTold() {
        // Given
        ManualTimeSource clock = new ManualTimeSource(100L);

        // When
        long before = clock.currentTimeMillis();
        clock.advance(5);

        // Then
        assertEquals(100L, before);
        assertEquals(105L, clock.currentTimeMillis());
        clock.set(7L);
        assertEquals(7L, clock.currentTimeMillis());
    }
}
