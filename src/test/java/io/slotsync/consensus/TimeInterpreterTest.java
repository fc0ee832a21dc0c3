package io.slotsync.consensus;

import io.slotsync.core.EpochSize;
import io.slotsync.core.RelativeTime;
import io.slotsync.core.SlotLength;
import io.slotsync.core.SlotNo;
import io.slotsync.core.StartTime;
import io.slotsync.core.era.EraInterpreter;
import io.slotsync.core.era.EraInterpreterSource;
import io.slotsync.core.era.EraParams;
import io.slotsync.core.era.PastHorizonException;
import io.slotsync.core.era.RefreshableEraInterpreterSource;
import io.slotsync.core.era.Summary;
import io.slotsync.core.era.SummaryInterpreter;
import io.slotsync.core.query.Query;
import io.slotsync.core.query.QueryResult;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@RunWith(MockitoJUnitRunner.class)
public class TimeInterpreterTest {

    private static final String REASON = "chain never forks";

    private final StartTime start = StartTime.of(Instant.parse("2020-01-01T00:00:00Z"));
    private final EraParams params = new EraParams(EpochSize.of(10), SlotLength.ofSeconds(1));

    // slots [0, 20) are known
    private final EraInterpreter bounded = new SummaryInterpreter(Summary.builder().era(params, 2).build());
    private final EraInterpreter unbounded = new SummaryInterpreter(Summary.builder().openEra(params).build());

    @Mock
    private TimeInterpreterTracer tracer;

    @Mock
    private EraInterpreterSource source;

    private TimeInterpreter ti;

    @Before
    public void setUp() {
        ti = new TimeInterpreter(source, start, tracer, ResultHandler.propagate());
    }

    @Test
    public void testInterpret() {
        when(source.current()).thenReturn(bounded);
        assertEquals(QueryResult.success(RelativeTime.ofSeconds(15)), ti.interpret(Query.slotToRelativeTime(SlotNo.of(15))));
        assertEquals(QueryResult.success(start), ti.interpret(Query.startTime()));
    }

    @Test
    public void testSourceIsReadOncePerQuery() {
        when(source.current()).thenReturn(unbounded);
        Query<Duration> q = Query.slotToRelativeTime(SlotNo.of(1))
                .bind(a -> Query.slotToRelativeTime(SlotNo.of(50)).map(b -> b.diff(a)));

        assertEquals(QueryResult.success(Duration.ofSeconds(49)), ti.interpret(q));
        verify(source, times(1)).current();
    }

    @Test
    public void testQuerySeesOneSnapshot() {
        RefreshableEraInterpreterSource refreshable = new RefreshableEraInterpreterSource(bounded);
        TimeInterpreter interpreter = new TimeInterpreter(refreshable, start, tracer, ResultHandler.propagate());

        Query<RelativeTime> q = Query.slotToRelativeTime(SlotNo.of(1)).bind(a -> {
            refreshable.update(unbounded);
            return Query.slotToRelativeTime(SlotNo.of(25));
        });

        assertTrue("Running query must not see the refreshed history", interpreter.interpret(q).isPastHorizon());
        assertEquals(QueryResult.success(RelativeTime.ofSeconds(25)), interpreter.interpret(q));
    }

    @Test
    public void testPastHorizonIsPropagated() {
        when(source.current()).thenReturn(bounded);
        QueryResult<RelativeTime> result = ti.interpret(Query.slotToRelativeTime(SlotNo.of(20)));

        assertTrue(result.isPastHorizon());
        verifyNoInteractions(tracer);
    }

    @Test
    public void testNeverFailsThrowsAndTraces() {
        when(source.current()).thenReturn(bounded);
        TimeInterpreter neverFails = ti.neverFails(REASON);

        try {
            neverFails.interpret(Query.slotToRelativeTime(SlotNo.of(1))
                    .bind(a -> Query.slotToRelativeTime(SlotNo.of(99))));
            fail("Expected a PastHorizonError");
        } catch (PastHorizonError e) {
            assertEquals(REASON, e.getReason());
            assertTrue(e.getMessage().contains(REASON));
            assertNotNull(e.getCause());

            ArgumentCaptor<TimeInterpreterLog> captor = ArgumentCaptor.forClass(TimeInterpreterLog.class);
            verify(tracer).trace(captor.capture());
            TimeInterpreterLog msg = captor.getValue();
            assertEquals(Optional.of(REASON), msg.getReason());
            assertEquals(start, msg.getStartTime());
            assertSame(e.getCause(), msg.getFailure());
        }
    }

    @Test
    public void testNeverFailsPassesSuccess() {
        when(source.current()).thenReturn(bounded);
        QueryResult<RelativeTime> result = ti.neverFails(REASON).interpret(Query.slotToRelativeTime(SlotNo.of(3)));
        assertEquals(QueryResult.success(RelativeTime.ofSeconds(3)), result);
        verifyNoInteractions(tracer);
    }

    @Test
    public void testNeverFailsKeepsStartTimeAndSource() {
        TimeInterpreter neverFails = ti.neverFails(REASON);
        assertSame(start, neverFails.getBlockchainStartTime());
        assertSame(source, neverFails.getInterpreterSource());
    }

    @Test
    public void testHoistRunsEveryEffectThroughTransformer() {
        when(source.current()).thenReturn(bounded);
        CountingTransformer counting = new CountingTransformer();
        TimeInterpreter hoisted = ti.hoist(counting);

        assertSame(start, hoisted.getBlockchainStartTime());
        assertEquals(ti.interpret(Query.slotToRelativeTime(SlotNo.of(4))),
                hoisted.interpret(Query.slotToRelativeTime(SlotNo.of(4))));
        // the source and the result handler
        assertEquals(2, counting.count.get());

        assertTrue(hoisted.interpret(Query.slotToRelativeTime(SlotNo.of(40))).isPastHorizon());
        assertEquals(4, counting.count.get());
    }

    @Test
    public void testHoistIdentityKeepsResults() {
        when(source.current()).thenReturn(bounded);
        TimeInterpreter hoisted = ti.hoist(EffectTransformer.identity());

        assertEquals(QueryResult.success(RelativeTime.ofSeconds(4)),
                hoisted.interpret(Query.slotToRelativeTime(SlotNo.of(4))));
        assertTrue(hoisted.interpret(Query.slotToRelativeTime(SlotNo.of(40))).isPastHorizon());
    }

    @Test
    public void testHoistThenNeverFailsTracesThroughTransformer() {
        when(source.current()).thenReturn(bounded);
        CountingTransformer counting = new CountingTransformer();
        TimeInterpreter ti2 = ti.hoist(counting).neverFails(REASON);

        try {
            ti2.interpret(Query.slotToRelativeTime(SlotNo.of(40)));
            fail("Expected a PastHorizonError");
        } catch (PastHorizonError e) {
            // source, inner result handler and tracer
            assertEquals(3, counting.count.get());
            verify(tracer).trace(any(TimeInterpreterLog.class));
        }
    }

    @Test
    public void testDiagnosticContextTransformer() {
        AtomicInteger seen = new AtomicInteger();
        EraInterpreterSource checking = () -> {
            if ("mainnet".equals(MDC.get("network"))) {
                seen.incrementAndGet();
            }
            return bounded;
        };
        TimeInterpreter hoisted = new TimeInterpreter(checking, start, tracer, ResultHandler.propagate())
                .hoist(EffectTransformer.withDiagnosticContext("network", "mainnet"));

        assertTrue(hoisted.interpret(Query.slotToRelativeTime(SlotNo.of(2))).isSuccess());
        assertEquals(1, seen.get());
        assertNull(MDC.get("network"));
    }

    @Test
    public void testSerializedTransformerHoldsLock() {
        Object lock = new Object();
        EraInterpreterSource checking = () -> {
            assertTrue(Thread.holdsLock(lock));
            return bounded;
        };
        TimeInterpreter hoisted = new TimeInterpreter(checking, start, tracer, ResultHandler.propagate())
                .hoist(EffectTransformer.serializedOn(lock));
        assertTrue(hoisted.interpret(Query.startTime()).isSuccess());
    }

    @Test
    public void testInterpretAsync() throws Exception {
        when(source.current()).thenReturn(unbounded);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            QueryResult<RelativeTime> result = ti.interpretAsync(Query.slotToRelativeTime(SlotNo.of(7)), executor)
                    .get(5, TimeUnit.SECONDS);
            assertEquals(QueryResult.success(RelativeTime.ofSeconds(7)), result);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testCurrentRelativeTime() {
        Clock later = Clock.fixed(Instant.parse("2020-01-01T00:10:00Z"), ZoneOffset.UTC);
        assertEquals(RelativeTime.ofSeconds(600), ti.currentRelativeTime(later));

        Clock before = Clock.fixed(Instant.parse("2019-12-01T00:00:00Z"), ZoneOffset.UTC);
        assertEquals(RelativeTime.ZERO, ti.currentRelativeTime(before));
    }

    @Test
    public void testCreate() {
        TimeInterpreter created = TimeInterpreter.create(tracer, start, EpochSize.of(21600), SlotLength.ofSeconds(20));
        assertEquals(QueryResult.success(RelativeTime.ofSeconds(2000)),
                created.interpret(Query.slotToRelativeTime(SlotNo.of(100))));
    }

    private static class CountingTransformer implements EffectTransformer {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public <T> T apply(Supplier<T> operation) {
            count.incrementAndGet();
            return operation.get();
        }
    }
}
