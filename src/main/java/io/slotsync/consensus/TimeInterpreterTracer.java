package io.slotsync.consensus;

/**
 * Sink for {@link TimeInterpreterLog} diagnostics.
 */
@FunctionalInterface
public interface TimeInterpreterTracer {

    void trace(TimeInterpreterLog msg);

    /**
     * A tracer that stamps every message with {@code reason} before passing it on.
     */
    default TimeInterpreterTracer withReason(String reason) {
        return msg -> trace(msg.withReason(reason));
    }

    static TimeInterpreterTracer nullTracer() {
        return msg -> {
        };
    }
}
