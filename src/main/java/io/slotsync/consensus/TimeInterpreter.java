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

import io.slotsync.core.EpochSize;
import io.slotsync.core.RelativeTime;
import io.slotsync.core.SlotLength;
import io.slotsync.core.StartTime;
import io.slotsync.core.era.EraInterpreter;
import io.slotsync.core.era.EraInterpreterSource;
import io.slotsync.core.era.PastHorizonException;
import io.slotsync.core.era.Summary;
import io.slotsync.core.era.SummaryInterpreter;
import io.slotsync.core.query.Query;
import io.slotsync.core.query.QueryResult;
import io.slotsync.core.query.QueryRunner;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs {@link Query queries} with the blockchain start time as context.
 * <p>
 * Instances are immutable and may be shared between threads. The era interpreter is fetched from
 * the source once per query, so each query sees a single snapshot of the era history.
 */
@Slf4j
@Getter
public final class TimeInterpreter {

    private final EraInterpreterSource interpreterSource;

    private final StartTime blockchainStartTime;

    private final TimeInterpreterTracer tracer;

    private final ResultHandler resultHandler;

    public TimeInterpreter(EraInterpreterSource interpreterSource, StartTime blockchainStartTime,
                           TimeInterpreterTracer tracer, ResultHandler resultHandler) {
        this.interpreterSource = Validate.notNull(interpreterSource, "interpreterSource");
        this.blockchainStartTime = Validate.notNull(blockchainStartTime, "blockchainStartTime");
        this.tracer = Validate.notNull(tracer, "tracer");
        this.resultHandler = Validate.notNull(resultHandler, "resultHandler");
    }

    /**
     * Sets up a time interpreter for a chain that never forks, with the given start time and era
     * parameters. Past horizon failures are returned to the caller.
     */
    public static TimeInterpreter create(TimeInterpreterTracer tracer, StartTime start,
                                         EpochSize epochSize, SlotLength slotLength) {
        return create(tracer, start, Summary.neverForks(epochSize, slotLength));
    }

    public static TimeInterpreter create(TimeInterpreterTracer tracer, StartTime start, Summary summary) {
        return new TimeInterpreter(EraInterpreterSource.of(new SummaryInterpreter(summary)), start, tracer,
                ResultHandler.propagate());
    }

    /**
     * Runs a query against the current era interpreter.
     */
    public <T> QueryResult<T> interpret(Query<T> query) {
        EraInterpreter eraInterpreter = interpreterSource.current();
        if (eraInterpreter == null) {
            throw new IllegalStateException("No era interpreter available");
        }
        QueryResult<T> result = QueryRunner.run(blockchainStartTime, eraInterpreter, query);
        if (result.isPastHorizon()) {
            log.debug("Query failed past the horizon at {}", result.getFailure().get().getQuery());
        }
        return resultHandler.handle(result);
    }

    /**
     * Runs a query on {@code executor}.
     */
    public <T> CompletableFuture<QueryResult<T>> interpretAsync(Query<T> query, Executor executor) {
        return CompletableFuture.supplyAsync(() -> interpret(query), executor);
    }

    /**
     * A time interpreter for callers that know past horizon failures can not happen, for example
     * because the chain never forks. A failure anyway is traced with {@code reason} and thrown as a
     * {@link PastHorizonError}; failed results are never returned.
     *
     * @param reason
     *            why the caller expects queries to always succeed
     */
    public TimeInterpreter neverFails(String reason) {
        TimeInterpreterTracer reasonTracer = tracer.withReason(reason);
        ResultHandler inner = resultHandler;
        StartTime start = blockchainStartTime;
        ResultHandler handler = new ResultHandler() {
            @Override
            public <T> QueryResult<T> handle(QueryResult<T> result) {
                QueryResult<T> handled = inner.handle(result);
                if (handled.isPastHorizon()) {
                    PastHorizonException e = handled.getFailure().get();
                    reasonTracer.trace(TimeInterpreterLog.pastHorizon(start, e));
                    throw new PastHorizonError(reason, e);
                }
                return handled;
            }
        };
        return new TimeInterpreter(interpreterSource, blockchainStartTime, reasonTracer, handler);
    }

    /**
     * A time interpreter whose era interpreter source, tracer and result handler all run through
     * {@code transformer}. The start time and the meaning of queries are unchanged.
     */
    public TimeInterpreter hoist(EffectTransformer transformer) {
        EraInterpreterSource source = interpreterSource;
        TimeInterpreterTracer innerTracer = tracer;
        ResultHandler inner = resultHandler;
        ResultHandler handler = new ResultHandler() {
            @Override
            public <T> QueryResult<T> handle(QueryResult<T> result) {
                return transformer.apply(() -> inner.handle(result));
            }
        };
        return new TimeInterpreter(
                () -> transformer.apply(source::current),
                blockchainStartTime,
                msg -> transformer.run(() -> innerTracer.trace(msg)),
                handler);
    }

    /**
     * The current time of {@code clock} relative to the blockchain start time. If the clock is
     * before the start (which only happens when launching test networks), this is
     * {@link RelativeTime#ZERO}.
     */
    public RelativeTime currentRelativeTime(Clock clock) {
        return blockchainStartTime.toRelativeTimeOrZero(clock.instant());
    }
}
