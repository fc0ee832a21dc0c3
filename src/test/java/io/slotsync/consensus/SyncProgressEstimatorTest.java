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
import io.slotsync.core.EpochSize;
import io.slotsync.core.Hash;
import io.slotsync.core.Percentage;
import io.slotsync.core.RelativeTime;
import io.slotsync.core.SlotLength;
import io.slotsync.core.SlotNo;
import io.slotsync.core.StartTime;
import io.slotsync.core.SyncProgress;
import io.slotsync.core.SyncTolerance;
import io.slotsync.core.era.EraParams;
import io.slotsync.core.era.Summary;
import io.slotsync.core.query.QueryResult;
import org.junit.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class SyncProgressEstimatorTest {

    private static final SyncTolerance TOLERANCE = SyncTolerance.ofSeconds(20);

    private final StartTime start = StartTime.of(Instant.parse("2020-01-01T00:00:00Z"));

    // one second slots, so slot n starts at n seconds
    private final TimeInterpreter ti = TimeInterpreter.create(TimeInterpreterTracer.nullTracer(), start,
            EpochSize.of(100), SlotLength.ofSeconds(1));

    private static BlockHeader tipAt(long slot) {
        return new BlockHeader(SlotNo.of(slot), slot / 2, Hash.fromHex("aa"), Hash.fromHex("bb"));
    }

    @Test
    public void testCaughtUp() {
        assertEquals(QueryResult.success(SyncProgress.ready()),
                SyncProgressEstimator.syncProgress(TOLERANCE, ti, tipAt(1000), RelativeTime.ofSeconds(1000)));
    }

    @Test
    public void testWithinTolerance() {
        assertEquals(QueryResult.success(SyncProgress.ready()),
                SyncProgressEstimator.syncProgress(TOLERANCE, ti, tipAt(980), RelativeTime.ofSeconds(1000)));
        assertEquals(QueryResult.success(SyncProgress.ready()),
                SyncProgressEstimator.syncProgress(TOLERANCE, ti, tipAt(995), RelativeTime.ofSeconds(1000)));
    }

    @Test
    public void testSyncing() {
        QueryResult<SyncProgress> result =
                SyncProgressEstimator.syncProgress(TOLERANCE, ti, tipAt(970), RelativeTime.ofSeconds(1000));

        assertEquals(QueryResult.success(SyncProgress.syncing(Percentage.of(new BigDecimal("0.97")))), result);
        assertTrue(result.getValue().isSyncing());
    }

    @Test
    public void testJustOutsideTolerance() {
        SyncProgress progress = SyncProgressEstimator
                .syncProgress(TOLERANCE, ti, SlotNo.of(979), RelativeTime.ofSeconds(1000)).getValue();
        assertEquals(SyncProgress.syncing(Percentage.of(new BigDecimal("0.979"))), progress);
    }

    @Test
    public void testRatioUsesRoundedMillis() {
        RelativeTime now = RelativeTime.of(Duration.ofSeconds(1000).plusNanos(400_000));
        assertEquals(QueryResult.success(SyncProgress.syncing(Percentage.of(new BigDecimal("0.97")))),
                SyncProgressEstimator.syncProgress(TOLERANCE, ti, tipAt(970), now));
    }

    @Test
    public void testGenesisAtOrigin() {
        assertEquals(QueryResult.success(SyncProgress.ready()),
                SyncProgressEstimator.syncProgress(TOLERANCE, ti, tipAt(0), RelativeTime.ZERO));
    }

    @Test
    public void testNoTimePassedIsZeroProgress() {
        SyncTolerance none = SyncTolerance.of(Duration.ZERO);
        RelativeTime now = RelativeTime.of(Duration.ofNanos(400_000));
        assertEquals(QueryResult.success(SyncProgress.syncing(Percentage.ZERO)),
                SyncProgressEstimator.syncProgress(none, ti, tipAt(0), now));
    }

    @Test
    public void testEarlyTip() {
        SyncProgress progress = SyncProgressEstimator
                .syncProgress(TOLERANCE, ti, tipAt(0), RelativeTime.ofSeconds(86_400)).getValue();
        assertEquals(SyncProgress.syncing(Percentage.ZERO), progress);
    }

    @Test
    public void testPastHorizonIsReturned() {
        TimeInterpreter boundedTi = TimeInterpreter.create(TimeInterpreterTracer.nullTracer(), start,
                Summary.builder().era(new EraParams(EpochSize.of(100), SlotLength.ofSeconds(1)), 5).build());

        QueryResult<SyncProgress> result =
                SyncProgressEstimator.syncProgress(TOLERANCE, boundedTi, tipAt(600), RelativeTime.ofSeconds(1000));
        assertTrue(result.isPastHorizon());
    }

    @Test
    public void testGetSyncProgress() {
        Clock clock = Clock.fixed(start.getInstant().plusSeconds(1000), ZoneOffset.UTC);
        assertEquals(QueryResult.success(SyncProgress.syncing(Percentage.of(new BigDecimal("0.5")))),
                SyncProgressEstimator.getSyncProgress(TOLERANCE, tipAt(500), ti, clock));
    }

    @Test
    public void testGetSyncProgressBeforeStart() {
        Clock clock = Clock.fixed(start.getInstant().minusSeconds(60), ZoneOffset.UTC);
        assertEquals(QueryResult.success(SyncProgress.ready()),
                SyncProgressEstimator.getSyncProgress(TOLERANCE, tipAt(0), ti, clock));
    }

    @Test
    public void testGetSyncProgressNeverReturnsPastHorizon() {
        TimeInterpreterTracer tracer = mock(TimeInterpreterTracer.class);
        TimeInterpreter boundedTi = TimeInterpreter.create(tracer, start,
                Summary.builder().era(new EraParams(EpochSize.of(100), SlotLength.ofSeconds(1)), 5).build());
        Clock clock = Clock.fixed(start.getInstant().plusSeconds(1000), ZoneOffset.UTC);

        try {
            SyncProgressEstimator.getSyncProgress(TOLERANCE, tipAt(600), boundedTi, clock);
            fail("Expected a PastHorizonError");
        } catch (PastHorizonError e) {
            assertEquals("syncProgress", e.getReason());
            verify(tracer).trace(any(TimeInterpreterLog.class));
        }
    }
}
