package com.dynop.routing.hybrid.client;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryScheduleTest {

    @ParameterizedTest
    @CsvSource({
            "1, 0",
            "2, 1000",
            "3, 2000",
            "4, 4000",
            "5, 8000"
    })
    void backoffDoublesFromTheBase(int attempt, long expectedMillis) {
        RetrySchedule schedule = new RetrySchedule(5, Duration.ofSeconds(1));
        assertEquals(Duration.ofMillis(expectedMillis), schedule.backoffBefore(attempt));
    }

    @Test
    void attemptsAreOnePlusRetries() {
        RetrySchedule schedule = new RetrySchedule(2, Duration.ofSeconds(1));

        assertEquals(3, schedule.getMaxAttempts());
        assertTrue(schedule.hasAttemptAfter(1));
        assertTrue(schedule.hasAttemptAfter(2));
        assertFalse(schedule.hasAttemptAfter(3));
    }

    @Test
    void zeroRetriesMeansOneAttempt() {
        assertFalse(new RetrySchedule(0, Duration.ofSeconds(1)).hasAttemptAfter(1));
    }

    @Test
    void rejectsNegativeValues() {
        assertThrows(IllegalArgumentException.class, () -> new RetrySchedule(-1, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new RetrySchedule(1, Duration.ofSeconds(-1)));
    }
}
