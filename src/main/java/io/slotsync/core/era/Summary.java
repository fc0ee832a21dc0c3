package io.slotsync.core.era;

import io.slotsync.core.EpochSize;
import io.slotsync.core.SlotLength;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The known history of eras, oldest first. Consecutive eras share a bound and only the last era
 * may be open ended. If the last era has an end, nothing after it can be answered yet.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Summary {

    private final List<EraSummary> eras;

    public Summary(List<EraSummary> eras) {
        if (eras == null || eras.isEmpty()) {
            throw new IllegalArgumentException("A summary needs at least one era");
        }
        for (int i = 1; i < eras.size(); i++) {
            Bound previousEnd = eras.get(i - 1).getEnd().orElseThrow(
                    () -> new IllegalArgumentException("Only the last era may be open ended"));
            if (!previousEnd.equals(eras.get(i).getStart())) {
                throw new IllegalArgumentException("Era " + i + " does not start where era " + (i - 1) + " ends");
            }
        }
        this.eras = Collections.unmodifiableList(new ArrayList<>(eras));
    }

    /**
     * A summary for a chain that never forks: one era, from genesis, with no end.
     */
    public static Summary neverForks(EpochSize epochSize, SlotLength slotLength) {
        return new Summary(List.of(new EraSummary(Bound.INITIAL, null, new EraParams(epochSize, slotLength))));
    }

    public static Builder builder() {
        return new Builder();
    }

    public EraSummary getLastEra() {
        return eras.get(eras.size() - 1);
    }

    /**
     * Builds a summary from era parameters and the number of epochs each era lasts.
     */
    public static class Builder {

        private final List<EraSummary> eras = new ArrayList<>();
        private Bound next = Bound.INITIAL;
        private boolean open = false;

        /**
         * Adds an era lasting {@code epochs} epochs.
         */
        public Builder era(EraParams params, long epochs) {
            checkNotOpen();
            Bound end = next.advance(params, epochs);
            eras.add(new EraSummary(next, end, params));
            next = end;
            return this;
        }

        /**
         * Adds a final era whose end is not known.
         */
        public Builder openEra(EraParams params) {
            checkNotOpen();
            eras.add(new EraSummary(next, null, params));
            open = true;
            return this;
        }

        public Summary build() {
            return new Summary(eras);
        }

        private void checkNotOpen() {
            if (open) {
                throw new IllegalStateException("Can not add an era after an open ended era");
            }
        }
    }
}
