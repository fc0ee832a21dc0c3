package io.slotsync.consensus;

import io.slotsync.core.query.QueryResult;

/**
 * Decides what a {@link TimeInterpreter} does with the outcome of a query.
 */
public interface ResultHandler {

    <T> QueryResult<T> handle(QueryResult<T> result);

    /**
     * Hands past horizon failures to the caller as failed results.
     */
    static ResultHandler propagate() {
        return Propagate.INSTANCE;
    }

    final class Propagate implements ResultHandler {
        private static final Propagate INSTANCE = new Propagate();

        private Propagate() {
        }

        @Override
        public <T> QueryResult<T> handle(QueryResult<T> result) {
            return result;
        }
    }
}
