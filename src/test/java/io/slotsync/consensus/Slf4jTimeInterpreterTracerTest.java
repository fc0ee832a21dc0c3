package io.slotsync.consensus;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.slotsync.core.StartTime;
import io.slotsync.core.era.PastHorizonException;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;

import static org.junit.Assert.*;

public class Slf4jTimeInterpreterTracerTest {

    private final StartTime start = StartTime.of(Instant.parse("2020-01-01T00:00:00Z"));

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;

    @Before
    public void setUp() {
        logger = (Logger) LoggerFactory.getLogger(Slf4jTimeInterpreterTracer.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @After
    public void tearDown() {
        logger.detachAppender(appender);
    }

    @Test
    public void testTraceLogsAtError() {
        PastHorizonException failure = new PastHorizonException("slotToWallclock(SlotNo 800)", Collections.emptyList());
        new Slf4jTimeInterpreterTracer().trace(new TimeInterpreterLog("syncProgress", start, failure));

        assertEquals(1, appender.list.size());
        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.ERROR, event.getLevel());
        assertTrue(event.getFormattedMessage().contains("syncProgress"));
        assertTrue(event.getFormattedMessage().contains("2020-01-01T00:00:00Z"));
        assertEquals(PastHorizonException.class.getName(), event.getThrowableProxy().getClassName());
    }

    @Test
    public void testTraceWithoutReason() {
        PastHorizonException failure = new PastHorizonException("slotToEpoch(SlotNo 9)", Collections.emptyList());
        new Slf4jTimeInterpreterTracer().trace(TimeInterpreterLog.pastHorizon(start, failure));

        assertTrue(appender.list.get(0).getFormattedMessage().contains("<none>"));
    }
}
