package io.slotsync.core.era;

import io.slotsync.core.EpochNo;
import io.slotsync.core.RelativeTime;
import io.slotsync.core.SlotNo;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A point where an era starts or ends, expressed in all three units.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Bound {

    public static final Bound INITIAL = new Bound(RelativeTime.ZERO, SlotNo.ZERO, EpochNo.ZERO);

    private final RelativeTime time;

    private final SlotNo slot;

    private final EpochNo epoch;

    public Bound(RelativeTime time, SlotNo slot, EpochNo epoch) {
        this.time = time;
        this.slot = slot;
        this.epoch = epoch;
    }

    /**
     * The bound reached after {@code epochs} whole epochs of an era with the given parameters.
     */
    public Bound advance(EraParams params, long epochs) {
        if (epochs < 0) {
            throw new IllegalArgumentException("Can not advance a bound by negative epochs: " + epochs);
        }
        long slots = Math.multiplyExact(epochs, params.getEpochSize().getSlots());
        return new Bound(
                time.plus(params.getSlotLength().times(slots)),
                slot.plus(slots),
                epoch.plus(epochs));
    }
}
