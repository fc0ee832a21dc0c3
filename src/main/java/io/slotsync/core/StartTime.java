package io.slotsync.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Blockchain start time. No other type in this library accepts absolute times; they are
 * converted to a {@link RelativeTime} here first.
 */
@Getter
@EqualsAndHashCode
public final class StartTime implements Comparable<StartTime> {

    private final Instant instant;

    private StartTime(Instant instant) {
        this.instant = instant;
    }

    public static StartTime of(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("Start time can not be null");
        }
        return new StartTime(instant);
    }

    public static StartTime ofEpochMilli(long millis) {
        return of(Instant.ofEpochMilli(millis));
    }

    /**
     * Converts an absolute time to a relative time, or empty if it precedes the start.
     */
    public Optional<RelativeTime> toRelativeTime(Instant time) {
        if (time.isBefore(instant)) {
            return Optional.empty();
        }
        return Optional.of(RelativeTime.of(Duration.between(instant, time)));
    }

    /**
     * Same as {@link #toRelativeTime(Instant)}, but times before the start (which only happens
     * when launching test networks) are reported as {@link RelativeTime#ZERO}. Never fails.
     */
    public RelativeTime toRelativeTimeOrZero(Instant time) {
        return toRelativeTime(time).orElse(RelativeTime.ZERO);
    }

    public Instant toAbsoluteTime(RelativeTime time) {
        return instant.plus(time.getSinceStart());
    }

    @Override
    public int compareTo(StartTime o) {
        return instant.compareTo(o.instant);
    }

    @Override
    public String toString() {
        return "StartTime " + instant;
    }
}
