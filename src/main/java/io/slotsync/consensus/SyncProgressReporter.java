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

import io.slotsync.config.spec.ChainSpec;
import io.slotsync.core.BlockHeader;
import io.slotsync.core.SyncProgress;
import io.slotsync.core.query.QueryResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Periodically estimates the sync progress of the local tip and logs it.
 * <p>
 * When the tip can not be read the node is reported as {@link SyncProgress.Status#NOT_RESPONDING}.
 * A {@link PastHorizonError} stops the reporter, since the chain configuration it relies on was
 * wrong.
 */
@Slf4j
public class SyncProgressReporter {

    private final ChainSpec chainSpec;
    private final TimeInterpreter timeInterpreter;
    private final Supplier<BlockHeader> tipSupplier;
    private final Clock clock;

    private ScheduledExecutorService timer;
    private final AtomicBoolean isRunning = new AtomicBoolean(false);
    private final AtomicReference<SyncProgress> latest = new AtomicReference<>(SyncProgress.notResponding());
    private final AtomicReference<PastHorizonError> failure = new AtomicReference<>();

    private ScheduledFuture<?> reporter;

    public SyncProgressReporter(ChainSpec chainSpec, TimeInterpreter timeInterpreter,
                                Supplier<BlockHeader> tipSupplier, Clock clock) {
        this.chainSpec = chainSpec;
        this.timeInterpreter = timeInterpreter;
        this.tipSupplier = tipSupplier;
        this.clock = clock;
    }

    public SyncProgressReporter(ChainSpec chainSpec, Supplier<BlockHeader> tipSupplier) {
        this(chainSpec, TimeInterpreter.create(new Slf4jTimeInterpreterTracer(), chainSpec.getStartTime(),
                chainSpec.getSummary()), tipSupplier, Clock.systemUTC());
    }

    /**
     * Starts reporting. A stopped reporter can be started again with a fresh timer thread.
     */
    public synchronized void start() {
        if (isRunning.get()) {
            return;
        }
        long interval = chainSpec.getReportInterval().toMillis();
        Validate.isTrue(interval > 0, "Report interval must be positive: %s ms", interval);
        timer = Executors.newSingleThreadScheduledExecutor(new BasicThreadFactory.Builder()
                .namingPattern("sync-progress-%d")
                .daemon(true)
                .build());
        isRunning.set(true);
        reporter = timer.scheduleAtFixedRate(this::report, 0, interval, TimeUnit.MILLISECONDS);
        log.info("Sync progress reporter started for {}, reporting every {} ms", chainSpec.getNetwork(), interval);
    }

    public synchronized void stop() {
        if (isRunning.compareAndSet(true, false)) {
            reporter.cancel(false);
            timer.shutdown();
            log.info("Sync progress reporter stopped");
        }
    }

    public boolean isRunning() {
        return isRunning.get();
    }

    /**
     * The most recent estimate, {@link SyncProgress.Status#NOT_RESPONDING} before the first one.
     */
    public SyncProgress getLatest() {
        return latest.get();
    }

    /**
     * The failure that stopped the reporter, if any.
     */
    public PastHorizonError getFailure() {
        return failure.get();
    }

    /**
     * Estimates and records the current progress once.
     */
    protected SyncProgress report() {
        BlockHeader tip;
        try {
            tip = tipSupplier.get();
        } catch (RuntimeException e) {
            log.warn("Failed to read the local tip", e);
            tip = null;
        }
        if (tip == null) {
            latest.set(SyncProgress.notResponding());
            log.info("Syncing status: {}", SyncProgress.notResponding());
            return latest.get();
        }

        try {
            QueryResult<SyncProgress> result = SyncProgressEstimator.getSyncProgress(
                    chainSpec.getSyncTolerance(), tip, timeInterpreter, clock);
            SyncProgress progress = result.getValue();
            latest.set(progress);
            log.info("Syncing status: {}, local tip {} at height {}", progress, tip.getSlotNo(), tip.getBlockHeight());
            return progress;
        } catch (PastHorizonError e) {
            failure.set(e);
            log.error("Stopping sync progress reporter", e);
            stop();
            throw e;
        }
    }
}
