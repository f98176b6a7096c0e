package com.ryuqq.ulid.core.progression;

import com.ryuqq.ulid.core.model.ShortUlid;
import com.ryuqq.ulid.core.model.Slid;
import com.ryuqq.ulid.core.model.Ulid;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Progression 산술 테스트.
 *
 * @author ULID Team
 * @since 1.0.0
 */
class ProgressionTest {

    @Test
    void next_AtMaximum_WrapsToMinimum() {
        assertEquals(Ulid.MIN, Ulid.MAX.next());
        assertEquals(Slid.MIN, Slid.MAX.next());
        assertEquals(ShortUlid.MIN, ShortUlid.MAX.next());
    }

    @Test
    void previous_AtMinimum_WrapsToMaximum() {
        assertEquals(Ulid.MAX, Ulid.MIN.previous());
        assertEquals(Slid.MAX, Slid.MIN.previous());
    }

    @Test
    void next_CarriesRandomnessIntoTimestamp() {
        // Given
        Ulid id = Ulid.of(1000L, BigInteger.ONE.shiftLeft(80).subtract(BigInteger.ONE));

        // When
        Ulid next = id.next();

        // Then
        assertEquals(1001L, next.timestamp());
        assertEquals(BigInteger.ZERO, next.randomness());
    }

    @Test
    void forward_ByFullModulus_ReturnsSameIdentifier() {
        // Given
        Ulid ulid = Ulid.parse("01ARYZ6S41TSV4RRFFQ69G5FAV");
        Slid slid = Slid.of(0x00000170A3C1L, 0x0203);

        // Then
        assertEquals(ulid, ulid.forward(BigInteger.ONE.shiftLeft(128)));
        assertEquals(slid, slid.forward(BigInteger.ONE.shiftLeft(64)));
    }

    @Test
    void forwardThenBackward_ReturnsSameIdentifier() {
        // Given
        Ulid ulid = Ulid.parse("01ARYZ6S41TSV4RRFFQ69G5FAV");

        // Then
        assertEquals(ulid, ulid.forward(12345L).backward(12345L));
        assertEquals(ulid.forward(5L), ulid.backward(-5L));
        assertEquals(ulid.toBigInteger().add(BigInteger.valueOf(7)), ulid.forward(7L).toBigInteger());
    }

    @Test
    void forward_NullStep_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Ulid.MIN.forward(null));
    }

    @Test
    void next_PreservesFormat() {
        assertEquals(Slid.class, Slid.MIN.next().getClass());
        assertEquals(ShortUlid.class, ShortUlid.MIN.next().getClass());
    }
}
