package villagecompute.reports.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.time.Instant;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link TimestampFormats}.
 */
class TimestampFormatsTest {

    @Test
    void testFormat_truncatesToSecondsInUtc() {
        assertEquals("2025-01-15 22:35:57", TimestampFormats.format(Instant.parse("2025-01-15T22:35:57.987Z")));
        assertNull(TimestampFormats.format(null));
    }

    @Test
    void testParse_canonical() {
        assertEquals(Instant.parse("2025-01-15T22:35:57Z"), TimestampFormats.parse("2025-01-15 22:35:57"));
    }

    @Test
    void testParse_offsetWithZoneName() {
        assertEquals(Instant.parse("2025-01-15T22:35:57Z"), TimestampFormats.parse("2025-01-15 17:35:57 -0500 EST"));
        assertEquals(Instant.parse("2025-01-15T22:35:57Z"), TimestampFormats.parse("2025-01-15 22:35:57 +0000 UTC"));
    }

    @Test
    void testParse_offsetWithFraction() {
        assertEquals(Instant.parse("2025-01-15T22:35:57.250Z"),
                TimestampFormats.parse("2025-01-15 23:35:57.25 +0100"));
    }

    @Test
    void testParse_iso8601() {
        assertEquals(Instant.parse("2025-01-15T22:35:57Z"), TimestampFormats.parse("2025-01-16T07:35:57+09:00"));
    }

    @Test
    void testParse_unparseableIsAbsent() {
        assertNull(TimestampFormats.parse("yesterday at noon"));
        assertNull(TimestampFormats.parse("   "));
        assertNull(TimestampFormats.parse(null));
    }

    @Test
    void testCanonicalTextSortsChronologically() {
        String earlier = TimestampFormats.format(Instant.parse("2025-01-09T23:59:59Z"));
        String later = TimestampFormats.format(Instant.parse("2025-01-10T00:00:00Z"));
        assertEquals(-1, Integer.signum(earlier.compareTo(later)));
    }
}
