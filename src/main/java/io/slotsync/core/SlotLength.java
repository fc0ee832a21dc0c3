package io.slotsync.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Duration;

/**
 * Duration of a single slot.
 */
@Getter
@EqualsAndHashCode
public final class SlotLength {

    private final Duration duration;

    private SlotLength(Duration duration) {
        this.duration = duration;
    }

    public static SlotLength of(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("Slot length must be positive: " + duration);
        }
        return new SlotLength(duration);
    }

    public static SlotLength ofMillis(long millis) {
        return of(Duration.ofMillis(millis));
    }

    public static SlotLength ofSeconds(long seconds) {
        return of(Duration.ofSeconds(seconds));
    }

    /**
     * Time taken by {@code slots} consecutive slots of this length.
     */
    public Duration times(long slots) {
        return duration.multipliedBy(slots);
    }

    @Override
    public String toString() {
        return "SlotLength " + duration;
    }
}
