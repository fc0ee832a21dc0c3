package io.slotsync.consensus;

import org.slf4j.MDC;

import java.util.function.Supplier;

/**
 * Runs an effectful operation of a {@link TimeInterpreter} within some context. Used by
 * {@link TimeInterpreter#hoist(EffectTransformer)} to move an interpreter into another context
 * without changing what its queries mean.
 */
public interface EffectTransformer {

    <T> T apply(Supplier<T> operation);

    default void run(Runnable operation) {
        apply(() -> {
            operation.run();
            return null;
        });
    }

    static EffectTransformer identity() {
        return new EffectTransformer() {
            @Override
            public <T> T apply(Supplier<T> operation) {
                return operation.get();
            }
        };
    }

    /**
     * Puts {@code key} into the logging diagnostic context for the duration of each operation.
     */
    static EffectTransformer withDiagnosticContext(String key, String value) {
        return new EffectTransformer() {
            @Override
            public <T> T apply(Supplier<T> operation) {
                try (MDC.MDCCloseable ignored = MDC.putCloseable(key, value)) {
                    return operation.get();
                }
            }
        };
    }

    /**
     * Runs each operation while holding {@code lock}.
     */
    static EffectTransformer serializedOn(Object lock) {
        return new EffectTransformer() {
            @Override
            public <T> T apply(Supplier<T> operation) {
                synchronized (lock) {
                    return operation.get();
                }
            }
        };
    }
}
