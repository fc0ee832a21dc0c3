package io.slotsync.core.era;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the latest {@link EraInterpreter}, replaced whenever a newer era summary is learned.
 * Readers always see a complete instance.
 */
@Slf4j
public class RefreshableEraInterpreterSource implements EraInterpreterSource {

    private final AtomicReference<EraInterpreter> current;

    public RefreshableEraInterpreterSource(EraInterpreter initial) {
        if (initial == null) {
            throw new IllegalArgumentException("Initial interpreter can not be null");
        }
        this.current = new AtomicReference<>(initial);
    }

    @Override
    public EraInterpreter current() {
        return current.get();
    }

    public void update(EraInterpreter interpreter) {
        if (interpreter == null) {
            throw new IllegalArgumentException("Interpreter can not be null");
        }
        current.set(interpreter);
        log.debug("Era interpreter updated to {}", interpreter);
    }

    public void update(Summary summary) {
        update(new SummaryInterpreter(summary));
    }
}
