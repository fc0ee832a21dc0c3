package io.slotsync.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Number of slots in a single epoch.
 */
@Getter
@EqualsAndHashCode
public final class EpochSize {

    private final long slots;

    private EpochSize(long slots) {
        this.slots = slots;
    }

    public static EpochSize of(long slots) {
        if (slots <= 0) {
            throw new IllegalArgumentException("Epoch size must be positive: " + slots);
        }
        return new EpochSize(slots);
    }

    @Override
    public String toString() {
        return "EpochSize " + slots;
    }
}
