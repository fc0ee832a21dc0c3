package io.slotsync.consensus;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes {@link TimeInterpreterLog} messages to the application log at error severity.
 */
@Slf4j
public class Slf4jTimeInterpreterTracer implements TimeInterpreterTracer {

    @Override
    public void trace(TimeInterpreterLog msg) {
        log.error("Time interpreter queried past the horizon, reason it should be impossible: {}, start time: {}",
                msg.getReason().orElse("<none>"), msg.getStartTime().getInstant(), msg.getFailure());
    }
}
