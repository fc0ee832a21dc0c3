package io.slotsync.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;

/**
 * Time elapsed since the blockchain start time.
 */
@Getter
@EqualsAndHashCode
public final class RelativeTime implements Comparable<RelativeTime> {

    public static final RelativeTime ZERO = new RelativeTime(Duration.ZERO);

    private final Duration sinceStart;

    private RelativeTime(Duration sinceStart) {
        this.sinceStart = sinceStart;
    }

    public static RelativeTime of(Duration sinceStart) {
        if (sinceStart == null) {
            throw new IllegalArgumentException("Relative time can not be null");
        }
        return sinceStart.isZero() ? ZERO : new RelativeTime(sinceStart);
    }

    public static RelativeTime ofMillis(long millis) {
        return of(Duration.ofMillis(millis));
    }

    public static RelativeTime ofSeconds(long seconds) {
        return of(Duration.ofSeconds(seconds));
    }

    public RelativeTime plus(Duration duration) {
        return of(sinceStart.plus(duration));
    }

    /**
     * Returns {@code this - other}.
     */
    public Duration diff(RelativeTime other) {
        return sinceStart.minus(other.sinceStart);
    }

    /**
     * Milliseconds since start, rounded half to even.
     */
    public long toMillisRounded() {
        return toMillisDecimal().longValueExact();
    }

    /**
     * Same as {@link #toMillisRounded()}, without the {@code long} range limit.
     */
    public BigDecimal toMillisDecimal() {
        return BigDecimal.valueOf(sinceStart.getSeconds())
                .add(BigDecimal.valueOf(sinceStart.getNano(), 9))
                .movePointRight(3)
                .setScale(0, RoundingMode.HALF_EVEN);
    }

    public boolean isBefore(RelativeTime other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(RelativeTime o) {
        return sinceStart.compareTo(o.sinceStart);
    }

    @Override
    public String toString() {
        return "RelativeTime " + sinceStart;
    }
}
