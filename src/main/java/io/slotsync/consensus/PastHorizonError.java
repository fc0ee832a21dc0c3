package io.slotsync.consensus;

import io.slotsync.core.era.PastHorizonException;
import lombok.Getter;

/**
 * A past horizon failure from a time interpreter that was configured to never fail. Not meant to
 * be recovered from.
 */
@Getter
public class PastHorizonError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String reason;

    public PastHorizonError(String reason, PastHorizonException cause) {
        super("Unexpected past horizon failure (" + reason + "): " + cause.getMessage(), cause);
        this.reason = reason;
    }

    @Override
    public synchronized PastHorizonException getCause() {
        return (PastHorizonException) super.getCause();
    }
}
