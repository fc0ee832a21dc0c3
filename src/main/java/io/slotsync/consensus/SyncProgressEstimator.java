/*
 * The MIT License (MIT)
 *
 * Copyright (c) 2020-2030 The XdagJ Developers
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.slotsync.consensus;

import io.slotsync.core.BlockHeader;
import io.slotsync.core.Percentage;
import io.slotsync.core.PercentageOutOfBoundsException;
import io.slotsync.core.RelativeTime;
import io.slotsync.core.SlotNo;
import io.slotsync.core.SyncProgress;
import io.slotsync.core.SyncTolerance;
import io.slotsync.core.query.Query;
import io.slotsync.core.query.QueryResult;
import io.slotsync.utils.TimeUtils;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;

/**
 * Estimates restoration progress from the local tip and the current time.
 * <p>
 * Slots and block height are deliberately conflated here, because the local node can not be
 * trusted to know the real network tip. Progress is
 *
 * <pre>
 * p = h / (h + X)
 * </pre>
 *
 * where {@code h} is the number of blocks ingested so far and {@code X} the estimated number of
 * remaining slots to the network tip. Early on {@code X} is a poor estimate, since it assumes
 * every slot holds a block, but as blocks are ingested {@code h} grows and {@code X} shrinks until
 * {@code p = h / h}. Both are measured as time since the blockchain start, so {@code p} is the
 * time covered by the tip divided by the current time.
 */
@Slf4j
public final class SyncProgressEstimator {

    private SyncProgressEstimator() {
    }

    /**
     * @param tolerance
     *            a time tolerance inside which we consider ourselves synced
     * @param timeInterpreter
     *            converts slots to actual time
     * @param tip
     *            the local tip
     * @param now
     *            the current time
     * @return the progress, or a past horizon failure if the tip slot could not be converted
     */
    public static QueryResult<SyncProgress> syncProgress(SyncTolerance tolerance, TimeInterpreter timeInterpreter,
                                                         BlockHeader tip, RelativeTime now) {
        return syncProgress(tolerance, timeInterpreter, tip.getSlotNo(), now);
    }

    public static QueryResult<SyncProgress> syncProgress(SyncTolerance tolerance, TimeInterpreter timeInterpreter,
                                                         SlotNo tipSlot, RelativeTime now) {
        return timeInterpreter.interpret(Query.slotToRelativeTime(tipSlot))
                .map(timeCovered -> estimate(tolerance, timeCovered, now));
    }

    /**
     * Estimates the progress of the given local tip at the current time of {@code clock}. The
     * interpreter is expected to never fail for the tip, so a past horizon failure is traced and
     * thrown as a {@link PastHorizonError}.
     */
    public static QueryResult<SyncProgress> getSyncProgress(SyncTolerance tolerance, BlockHeader tip,
                                                            TimeInterpreter timeInterpreter, Clock clock) {
        RelativeTime now = timeInterpreter.currentRelativeTime(clock);
        return syncProgress(tolerance, timeInterpreter.neverFails("syncProgress"), tip, now);
    }

    static SyncProgress estimate(SyncTolerance tolerance, RelativeTime timeCovered, RelativeTime now) {
        Duration behind = now.diff(timeCovered);
        if (behind.compareTo(tolerance.getDuration()) <= 0) {
            return SyncProgress.ready();
        }

        BigDecimal progress = ratio(timeCovered, now);
        try {
            Percentage percentage = Percentage.of(progress);
            log.debug("Local tip at {} is {} behind, progress {}", timeCovered,
                    TimeUtils.formatDuration(behind), percentage.toPercentString());
            return SyncProgress.syncing(percentage);
        } catch (PercentageOutOfBoundsException e) {
            throw new IllegalStateException("syncProgress: " + progress.toPlainString() + " is out of bounds", e);
        }
    }

    /**
     * {@code timeCovered / now} in whole milliseconds, so fractions of a second do not dominate for
     * very early slots. Zero when no time has passed.
     */
    private static BigDecimal ratio(RelativeTime timeCovered, RelativeTime now) {
        BigDecimal nowMillis = now.toMillisDecimal();
        if (now.equals(RelativeTime.ZERO) || nowMillis.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return timeCovered.toMillisDecimal().divide(nowMillis, MathContext.DECIMAL64);
    }
}
