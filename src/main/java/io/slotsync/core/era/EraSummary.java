package io.slotsync.core.era;

import io.slotsync.core.EpochNo;
import io.slotsync.core.RelativeTime;
import io.slotsync.core.SlotNo;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * One era: where it starts, where it ends (if that is known yet) and its parameters.
 * The start bound is inclusive and the end bound exclusive.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class EraSummary {

    private final Bound start;

    /**
     * Null when the end of the era is not known.
     */
    private final Bound end;

    private final EraParams params;

    public EraSummary(Bound start, Bound end, EraParams params) {
        if (start == null || params == null) {
            throw new IllegalArgumentException("Era start and parameters are required");
        }
        if (end != null && end.getSlot().compareTo(start.getSlot()) < 0) {
            throw new IllegalArgumentException("Era ends before it starts: " + start + " > " + end);
        }
        this.start = start;
        this.end = end;
        this.params = params;
    }

    public Optional<Bound> getEnd() {
        return Optional.ofNullable(end);
    }

    public boolean containsSlot(SlotNo slot) {
        return start.getSlot().compareTo(slot) <= 0
                && (end == null || slot.compareTo(end.getSlot()) < 0);
    }

    public boolean containsTime(RelativeTime time) {
        return start.getTime().compareTo(time) <= 0
                && (end == null || time.compareTo(end.getTime()) < 0);
    }

    public boolean containsEpoch(EpochNo epoch) {
        return start.getEpoch().compareTo(epoch) <= 0
                && (end == null || epoch.compareTo(end.getEpoch()) < 0);
    }
}
