package io.slotsync.core.era;

/**
 * Supplies the current {@link EraInterpreter}. The returned instance may change between calls as
 * more of the chain history becomes known.
 */
@FunctionalInterface
public interface EraInterpreterSource {

    EraInterpreter current();

    static EraInterpreterSource of(EraInterpreter interpreter) {
        return () -> interpreter;
    }
}
