package org.example.kbsync.utils;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * updated_at 的生成规则：精度截断到微秒（与数据库一致），并且严格大于上一次的值，
 * 即使时钟没有前进或被回拨。
 */
public final class Timestamps {

    private Timestamps() {
    }

    public static Instant now(Clock clock) {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    public static Instant next(Clock clock, Instant previous) {
        Instant now = now(clock);
        if (previous != null && !now.isAfter(previous)) {
            return previous.truncatedTo(ChronoUnit.MICROS).plus(1, ChronoUnit.MICROS);
        }
        return now;
    }
}
