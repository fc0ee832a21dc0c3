package io.slotsync.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;

@Getter
@EqualsAndHashCode
public final class EpochNo implements Comparable<EpochNo> {

    public static final EpochNo ZERO = new EpochNo(0);

    private final long value;

    private EpochNo(long value) {
        this.value = value;
    }

    public static EpochNo of(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Epoch number can not be negative: " + value);
        }
        return value == 0 ? ZERO : new EpochNo(value);
    }

    public EpochNo plus(long epochs) {
        return of(Math.addExact(value, epochs));
    }

    public long minus(EpochNo other) {
        return value - other.value;
    }

    @Override
    public int compareTo(EpochNo o) {
        return Long.compare(value, o.value);
    }

    @Override
    public String toString() {
        return "EpochNo " + value;
    }
}
