package me.golemcore.worklog.domain.service;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class JournalDateSupportTest {

    @Test
    void shouldParseIsoDate() {
        assertEquals(LocalDate.of(2026, 2, 10), JournalDateSupport.parseDate(" 2026-02-10 ", "from"));
    }

    @Test
    void shouldRejectMalformedDates() {
        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
                () -> JournalDateSupport.parseDate("10/02/2026", "from"));
        assertTrue(thrown.getMessage().contains("from"));
        assertThrows(IllegalArgumentException.class, () -> JournalDateSupport.parseDate("2026-02-30", "to"));
        assertThrows(IllegalArgumentException.class, () -> JournalDateSupport.parseDate("", "to"));
    }

    @Test
    void shouldFallBackForMissingValue() {
        LocalDate fallback = LocalDate.of(2026, 1, 1);

        assertEquals(fallback, JournalDateSupport.parseDateOrDefault(null, "to", fallback));
        assertEquals(fallback, JournalDateSupport.parseDateOrDefault(" ", "to", fallback));
    }

    @Test
    void shouldRequireOrderedRange() {
        LocalDate day = LocalDate.of(2026, 2, 10);

        assertDoesNotThrow(() -> JournalDateSupport.requireOrderedRange(day, day));
        assertThrows(IllegalArgumentException.class,
                () -> JournalDateSupport.requireOrderedRange(day.plusDays(1), day));
    }

    @Test
    void shouldRequirePositive() {
        assertEquals(3, JournalDateSupport.requirePositive(3, "limit"));
        assertThrows(IllegalArgumentException.class, () -> JournalDateSupport.requirePositive(0, "limit"));
        assertThrows(IllegalArgumentException.class, () -> JournalDateSupport.requirePositive(null, "limit"));
    }

    @Test
    void shouldCoverWholeDay() {
        LocalDate day = LocalDate.of(2026, 2, 10);

        assertEquals(Instant.parse("2026-02-10T00:00:00Z"), JournalDateSupport.startOfDay(day, ZoneOffset.UTC));
        assertEquals(Instant.parse("2026-02-10T23:59:59.999999999Z"), JournalDateSupport.endOfDay(day, ZoneOffset.UTC));
    }
}
