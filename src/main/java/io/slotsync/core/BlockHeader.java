package io.slotsync.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The parts of a block header needed to follow the chain. Sync progress only looks at
 * {@link #getSlotNo()}.
 */
@Getter
@EqualsAndHashCode
@ToString
public class BlockHeader {

    private final SlotNo slotNo;

    private final long blockHeight;

    private final Hash headerHash;

    private final Hash parentHeaderHash;

    public BlockHeader(SlotNo slotNo, long blockHeight, Hash headerHash, Hash parentHeaderHash) {
        if (slotNo == null) {
            throw new IllegalArgumentException("Slot number can not be null");
        }
        if (blockHeight < 0) {
            throw new IllegalArgumentException("Block height can not be negative: " + blockHeight);
        }
        this.slotNo = slotNo;
        this.blockHeight = blockHeight;
        this.headerHash = headerHash;
        this.parentHeaderHash = parentHeaderHash;
    }
}
