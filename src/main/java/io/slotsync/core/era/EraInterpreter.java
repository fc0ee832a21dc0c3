package io.slotsync.core.era;

/**
 * Answers queries that can be resolved within a single era.
 */
public interface EraInterpreter {

    /**
     * Runs a single-era query.
     *
     * @param query
     *            the query, answered in whichever known era contains everything it refers to
     * @return the answer
     * @throws PastHorizonException
     *             if no single known era contains the query
     */
    <T> T interpretQuery(EraQuery<T> query) throws PastHorizonException;
}
