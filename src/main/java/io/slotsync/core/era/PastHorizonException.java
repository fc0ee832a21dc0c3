package io.slotsync.core.era;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when a query refers to a slot, time or epoch beyond the era history known to an
 * {@link EraInterpreter}. Recoverable: more history may become known later.
 */
@Getter
public class PastHorizonException extends Exception {
    private static final long serialVersionUID = 1L;

    /**
     * Description of the single-era query that could not be answered.
     */
    private final String query;

    /**
     * The eras that were known when the query failed.
     */
    private final transient List<EraSummary> eras;

    public PastHorizonException(String query, List<EraSummary> eras) {
        super("Query " + query + " is past the horizon of " + eras.size() + " known era(s): " + eras);
        this.query = query;
        this.eras = Collections.unmodifiableList(eras);
    }

    public PastHorizonException(String query, List<EraSummary> eras, Throwable cause) {
        this(query, eras);
        initCause(cause);
    }
}
