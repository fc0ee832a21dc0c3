package io.slotsync.core.query;

import io.slotsync.core.EpochNo;
import io.slotsync.core.RelativeTime;
import io.slotsync.core.SlotNo;
import io.slotsync.core.StartTime;
import io.slotsync.core.era.EraQuery;
import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;

import java.time.Instant;
import java.util.function.Function;

/**
 * A query for time, slot and epoch conversions, run with {@link QueryRunner} or a
 * {@link io.slotsync.consensus.TimeInterpreter}.
 *
 * <h2>Differences to {@link EraQuery}</h2>
 *
 * An {@link EraQuery} can only be answered within a single era. Given
 *
 * <pre>
 *     q1 = slotToEpoch(someSlotInTheFirstEra)
 *     q2 = slotToEpoch(someSlotInTheSecondEra)
 * </pre>
 *
 * each can be answered on its own, but {@code EraQuery.both(q1, q2)} can not. Composing them with
 * {@link #bind(Function)} instead resolves each against its own era. This class also offers
 * {@link #startTime()}.
 * <p>
 * A query is an immutable description and can be run any number of times.
 */
public abstract class Query<T> {

    Query() {
    }

    /**
     * A query that must be answered within one era.
     */
    public static <T> Query<T> eraContained(EraQuery<T> query) {
        if (query == null) {
            throw new IllegalArgumentException("Era query can not be null");
        }
        return new EraContained<>(query);
    }

    public static Query<StartTime> startTime() {
        return QueryStartTime.INSTANCE;
    }

    public static <T> Query<T> pure(T value) {
        return new Pure<>(value);
    }

    /**
     * Runs this query, then the query built from its result.
     */
    public <R> Query<R> bind(Function<? super T, ? extends Query<R>> continuation) {
        if (continuation == null) {
            throw new IllegalArgumentException("Continuation can not be null");
        }
        return new Bind<>(this, continuation);
    }

    public <R> Query<R> map(Function<? super T, ? extends R> f) {
        return bind(value -> pure(f.apply(value)));
    }

    /**
     * The relative time at which a slot starts.
     */
    public static Query<RelativeTime> slotToRelativeTime(SlotNo slot) {
        return eraContained(EraQuery.slotToWallclock(slot).map(Pair::getLeft));
    }

    /**
     * The absolute time at which a slot starts.
     */
    public static Query<Instant> slotToUtcTime(SlotNo slot) {
        return startTime().bind(start -> slotToRelativeTime(slot).map(start::toAbsoluteTime));
    }

    /**
     * The slot containing a relative time.
     */
    public static Query<SlotNo> relativeTimeToSlot(RelativeTime time) {
        return eraContained(EraQuery.wallclockToSlot(time).map(Pair::getLeft));
    }

    public static Query<EpochNo> slotToEpoch(SlotNo slot) {
        return eraContained(EraQuery.slotToEpoch(slot).map(Pair::getLeft));
    }

    public static Query<SlotNo> firstSlotInEpoch(EpochNo epoch) {
        return eraContained(EraQuery.epochToFirstSlot(epoch));
    }

    @Getter
    static final class EraContained<T> extends Query<T> {
        private final EraQuery<T> query;

        EraContained(EraQuery<T> query) {
            this.query = query;
        }

        @Override
        public String toString() {
            return "EraContained(" + query + ")";
        }
    }

    static final class QueryStartTime extends Query<StartTime> {
        static final QueryStartTime INSTANCE = new QueryStartTime();

        @Override
        public String toString() {
            return "StartTime";
        }
    }

    @Getter
    static final class Pure<T> extends Query<T> {
        private final T value;

        Pure(T value) {
            this.value = value;
        }

        @Override
        public String toString() {
            return "Pure(" + value + ")";
        }
    }

    @Getter
    static final class Bind<A, T> extends Query<T> {
        private final Query<A> source;
        private final Function<? super A, ? extends Query<T>> continuation;

        Bind(Query<A> source, Function<? super A, ? extends Query<T>> continuation) {
            this.source = source;
            this.continuation = continuation;
        }

        @Override
        public String toString() {
            return "Bind";
        }
    }
}
