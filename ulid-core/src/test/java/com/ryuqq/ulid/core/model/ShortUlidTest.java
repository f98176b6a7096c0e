package com.ryuqq.ulid.core.model;

import com.ryuqq.ulid.core.exception.DecodeException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ShortUlid 값 객체 테스트.
 *
 * @author ULID Team
 * @since 1.0.0
 */
class ShortUlidTest {

    @Test
    void of_Fields_ProducesTwelveCharacterText() {
        // When
        ShortUlid id = ShortUlid.of(0x00000170A3C1L, 0x02);

        // Then
        assertEquals("00000Q18Y102", id.toString());
        assertEquals(7, id.toBytes().length);
        assertEquals(0x00000170A3C1L, id.timestamp());
        assertEquals(id, ShortUlid.parse(id.toString()));
    }

    @Test
    void max_UsesFullRandomnessByte() {
        assertEquals("7ZZZZZZZZZ7Z", ShortUlid.MAX.toString());
        assertEquals(ShortUlid.MIN, ShortUlid.MAX.next());
    }

    @Test
    void parse_RandomnessOverflow_ThrowsDecodeException() {
        // two characters hold 10 bits, randomness is 8
        assertThrows(DecodeException.class, () -> ShortUlid.parse("0000000000ZZ"));
    }

    @Test
    void of_RandomnessTooWide_ThrowsDecodeException() {
        assertThrows(DecodeException.class, () -> ShortUlid.of(0L, 256));
    }

    @Test
    void repr_RoundTrips() {
        // Given
        ShortUlid id = ShortUlid.of(1_700_000_000_000L, 0xC3);

        // Then
        assertEquals("<ShortUlid " + id + ">", id.toRepr());
        assertEquals(id, ShortUlid.fromRepr(id.toRepr()));
        assertEquals(id, ShortUlid.parseAny(id.toBinary()));
    }

    @Test
    void ofInstant_UsesEpochMillis() {
        // Given
        Instant instant = Instant.ofEpochMilli(0x00000170A3C1L);

        // When
        ShortUlid shortUlid = ShortUlid.of(instant, 2);

        // Then
        assertEquals(ShortUlid.of(0x00000170A3C1L, 2), shortUlid);
        assertEquals(instant, shortUlid.instant());
        assertThrows(DecodeException.class, () -> ShortUlid.of(Instant.EPOCH.minusMillis(1), 2));
    }
}
