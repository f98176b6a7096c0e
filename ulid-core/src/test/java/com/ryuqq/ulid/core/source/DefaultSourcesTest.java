package com.ryuqq.ulid.core.source;

import com.ryuqq.ulid.core.spi.noop.NoOpCounterStore;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 기본 소스와 NoOp 저장소 테스트.
 *
 * @author ULID Team
 * @since 1.0.0
 */
class DefaultSourcesTest {

    @Test
    void systemTimeSource_ReadsGivenClock() {
        // Given
        Instant fixed = Instant.parse("2024-01-02T03:04:05.678Z");
        SystemTimeSource source = new SystemTimeSource(Clock.fixed(fixed, ZoneOffset.UTC));

        // Then
        assertEquals(fixed.toEpochMilli(), source.currentTimeMillis());
        assertThrows(IllegalArgumentException.class, () -> new SystemTimeSource(null));
    }

    @Test
    void secureRandomEntropySource_ReturnsRequestedLength() {
        // Given
        SecureRandomEntropySource source = new SecureRandomEntropySource();

        // Then
        assertEquals(10, source.nextBytes(10).length);
        assertEquals(0, source.nextBytes(0).length);
        assertThrows(IllegalArgumentException.class, () -> source.nextBytes(-1));
    }

    @Test
    void noOpCounterStore_PersistsNothing() {
        // When
        NoOpCounterStore.INSTANCE.save(BigInteger.TEN);

        // Then
        assertTrue(NoOpCounterStore.INSTANCE.load().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> NoOpCounterStore.INSTANCE.save(BigInteger.valueOf(-1)));
    }
}
