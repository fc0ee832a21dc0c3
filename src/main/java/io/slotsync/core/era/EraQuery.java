package io.slotsync.core.era;

import io.slotsync.core.EpochNo;
import io.slotsync.core.RelativeTime;
import io.slotsync.core.SlotLength;
import io.slotsync.core.SlotNo;
import org.apache.commons.lang3.tuple.Pair;

import java.time.Duration;
import java.util.function.Function;

/**
 * A slot, time or epoch conversion that can only be answered within a single era.
 * <p>
 * Two queries that are each answerable on their own can not necessarily be combined with
 * {@link #both(EraQuery, EraQuery)}: the combination needs one era containing both. Use
 * {@link io.slotsync.core.query.Query} to chain conversions across eras.
 */
public abstract class EraQuery<T> {

    /**
     * Whether everything this query refers to lies within {@code era}.
     */
    public abstract boolean isContainedIn(EraSummary era);

    /**
     * Answers the query using the rules of {@code era}. Only valid if
     * {@link #isContainedIn(EraSummary)} holds.
     *
     * @throws ArithmeticException if the answer does not fit in a slot, epoch or time value
     */
    public abstract T answerIn(EraSummary era);

    public <R> EraQuery<R> map(Function<? super T, ? extends R> f) {
        EraQuery<T> self = this;
        return new EraQuery<R>() {
            @Override
            public boolean isContainedIn(EraSummary era) {
                return self.isContainedIn(era);
            }

            @Override
            public R answerIn(EraSummary era) {
                return f.apply(self.answerIn(era));
            }

            @Override
            public String toString() {
                return self.toString();
            }
        };
    }

    /**
     * The relative time at which {@code slot} starts, and the length of that slot.
     */
    public static EraQuery<Pair<RelativeTime, SlotLength>> slotToWallclock(SlotNo slot) {
        return new EraQuery<Pair<RelativeTime, SlotLength>>() {
            @Override
            public boolean isContainedIn(EraSummary era) {
                return era.containsSlot(slot);
            }

            @Override
            public Pair<RelativeTime, SlotLength> answerIn(EraSummary era) {
                SlotLength slotLength = era.getParams().getSlotLength();
                long slotsIntoEra = slot.minus(era.getStart().getSlot());
                return Pair.of(era.getStart().getTime().plus(slotLength.times(slotsIntoEra)), slotLength);
            }

            @Override
            public String toString() {
                return "slotToWallclock(" + slot + ")";
            }
        };
    }

    /**
     * The slot containing {@code time}, and how far into that slot {@code time} is.
     */
    public static EraQuery<Pair<SlotNo, Duration>> wallclockToSlot(RelativeTime time) {
        return new EraQuery<Pair<SlotNo, Duration>>() {
            @Override
            public boolean isContainedIn(EraSummary era) {
                return era.containsTime(time);
            }

            @Override
            public Pair<SlotNo, Duration> answerIn(EraSummary era) {
                Duration intoEra = time.diff(era.getStart().getTime());
                Duration slotLength = era.getParams().getSlotLength().getDuration();
                long slots = intoEra.dividedBy(slotLength);
                Duration intoSlot = intoEra.minus(slotLength.multipliedBy(slots));
                return Pair.of(era.getStart().getSlot().plus(slots), intoSlot);
            }

            @Override
            public String toString() {
                return "wallclockToSlot(" + time + ")";
            }
        };
    }

    /**
     * The epoch containing {@code slot}, and the index of the slot within that epoch.
     */
    public static EraQuery<Pair<EpochNo, Long>> slotToEpoch(SlotNo slot) {
        return new EraQuery<Pair<EpochNo, Long>>() {
            @Override
            public boolean isContainedIn(EraSummary era) {
                return era.containsSlot(slot);
            }

            @Override
            public Pair<EpochNo, Long> answerIn(EraSummary era) {
                long epochSize = era.getParams().getEpochSize().getSlots();
                long slotsIntoEra = slot.minus(era.getStart().getSlot());
                return Pair.of(era.getStart().getEpoch().plus(slotsIntoEra / epochSize), slotsIntoEra % epochSize);
            }

            @Override
            public String toString() {
                return "slotToEpoch(" + slot + ")";
            }
        };
    }

    /**
     * The first slot of {@code epoch}.
     */
    public static EraQuery<SlotNo> epochToFirstSlot(EpochNo epoch) {
        return new EraQuery<SlotNo>() {
            @Override
            public boolean isContainedIn(EraSummary era) {
                return era.containsEpoch(epoch);
            }

            @Override
            public SlotNo answerIn(EraSummary era) {
                long epochsIntoEra = epoch.minus(era.getStart().getEpoch());
                return era.getStart().getSlot()
                        .plus(Math.multiplyExact(epochsIntoEra, era.getParams().getEpochSize().getSlots()));
            }

            @Override
            public String toString() {
                return "epochToFirstSlot(" + epoch + ")";
            }
        };
    }

    /**
     * Both answers, which must come from the same era.
     */
    public static <A, B> EraQuery<Pair<A, B>> both(EraQuery<A> first, EraQuery<B> second) {
        return new EraQuery<Pair<A, B>>() {
            @Override
            public boolean isContainedIn(EraSummary era) {
                return first.isContainedIn(era) && second.isContainedIn(era);
            }

            @Override
            public Pair<A, B> answerIn(EraSummary era) {
                return Pair.of(first.answerIn(era), second.answerIn(era));
            }

            @Override
            public String toString() {
                return "both(" + first + ", " + second + ")";
            }
        };
    }
}
