package io.slotsync.consensus;

import io.slotsync.core.StartTime;
import io.slotsync.core.era.PastHorizonException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * Diagnostic traced when a time interpreter unexpectedly fails past the horizon.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class TimeInterpreterLog {

    /**
     * Why the failure should have been impossible, if known.
     */
    private final String reason;

    private final StartTime startTime;

    private final PastHorizonException failure;

    public TimeInterpreterLog(String reason, StartTime startTime, PastHorizonException failure) {
        this.reason = reason;
        this.startTime = startTime;
        this.failure = failure;
    }

    public static TimeInterpreterLog pastHorizon(StartTime startTime, PastHorizonException failure) {
        return new TimeInterpreterLog(null, startTime, failure);
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    public TimeInterpreterLog withReason(String reason) {
        return new TimeInterpreterLog(reason, startTime, failure);
    }
}
