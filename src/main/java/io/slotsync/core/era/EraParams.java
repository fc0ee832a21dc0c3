package io.slotsync.core.era;

import io.slotsync.core.EpochSize;
import io.slotsync.core.SlotLength;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Time-keeping rules of one era.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class EraParams {

    private final EpochSize epochSize;

    private final SlotLength slotLength;

    public EraParams(EpochSize epochSize, SlotLength slotLength) {
        if (epochSize == null || slotLength == null) {
            throw new IllegalArgumentException("Epoch size and slot length are required");
        }
        this.epochSize = epochSize;
        this.slotLength = slotLength;
    }
}
