package org.example.kbsync.utils;

import org.example.kbsync.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TimestampsTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-03-01T08:00:00.123456789Z"));

    @Test
    void truncatesToMicroseconds() {
        assertThat(Timestamps.now(clock)).isEqualTo(Instant.parse("2025-03-01T08:00:00.123456Z"));
    }

    @Test
    void nextIsStrictlyLaterEvenWhenClockIsFrozen() {
        Instant first = Timestamps.next(clock, null);
        Instant second = Timestamps.next(clock, first);
        Instant third = Timestamps.next(clock, second);

        assertThat(second).isAfter(first);
        assertThat(third).isAfter(second);
        assertThat(Duration.between(first, third)).isEqualTo(Duration.of(2, ChronoUnit.MICROS));
    }

    @Test
    void nextSurvivesClockGoingBackwards() {
        Instant previous = Timestamps.now(clock);
        clock.advance(Duration.ofMinutes(-5));

        assertThat(Timestamps.next(clock, previous)).isAfter(previous);
    }

    @Test
    void nextFollowsTheClockWhenItMovesForward() {
        Instant previous = Timestamps.now(clock);
        clock.advance(Duration.ofSeconds(1));

        assertThat(Timestamps.next(clock, previous)).isEqualTo(previous.plusSeconds(1));
    }
}
