package io.slotsync.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Index of a slot, the discrete unit of chain time, counted from genesis.
 */
@Getter
@EqualsAndHashCode
public final class SlotNo implements Comparable<SlotNo> {

    public static final SlotNo ZERO = new SlotNo(0);

    private final long value;

    private SlotNo(long value) {
        this.value = value;
    }

    public static SlotNo of(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Slot number can not be negative: " + value);
        }
        return value == 0 ? ZERO : new SlotNo(value);
    }

    public SlotNo plus(long slots) {
        return of(Math.addExact(value, slots));
    }

    /**
     * Number of slots between {@code other} and this slot.
     */
    public long minus(SlotNo other) {
        return value - other.value;
    }

    @Override
    public int compareTo(SlotNo o) {
        return Long.compare(value, o.value);
    }

    @Override
    public String toString() {
        return "SlotNo " + value;
    }
}
