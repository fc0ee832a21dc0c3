package io.slotsync.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * A time tolerance inside which a node is considered synced.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class SyncTolerance {

    private final Duration duration;

    private SyncTolerance(Duration duration) {
        this.duration = duration;
    }

    public static SyncTolerance of(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("Sync tolerance must not be negative: " + duration);
        }
        return new SyncTolerance(duration);
    }

    public static SyncTolerance ofSeconds(long seconds) {
        return of(Duration.ofSeconds(seconds));
    }
}
