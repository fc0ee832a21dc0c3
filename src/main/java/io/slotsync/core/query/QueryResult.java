package io.slotsync.core.query;

import io.slotsync.core.era.PastHorizonException;
import lombok.EqualsAndHashCode;

import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of running a {@link Query}: either a value, or the {@link PastHorizonException} that
 * stopped it.
 */
@EqualsAndHashCode
public final class QueryResult<T> {

    private final T value;
    private final PastHorizonException failure;

    private QueryResult(T value, PastHorizonException failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> QueryResult<T> success(T value) {
        return new QueryResult<>(value, null);
    }

    public static <T> QueryResult<T> pastHorizon(PastHorizonException failure) {
        if (failure == null) {
            throw new IllegalArgumentException("Failure can not be null");
        }
        return new QueryResult<>(null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public boolean isPastHorizon() {
        return failure != null;
    }

    /**
     * @throws IllegalStateException if the query failed
     */
    public T getValue() {
        if (failure != null) {
            throw new IllegalStateException("Query failed, no value available", failure);
        }
        return value;
    }

    public Optional<PastHorizonException> getFailure() {
        return Optional.ofNullable(failure);
    }

    /**
     * The value, or empty if the query failed. A successful null value is also empty.
     */
    public Optional<T> toOptional() {
        return failure == null ? Optional.ofNullable(value) : Optional.empty();
    }

    /**
     * The value, or the failure rethrown.
     */
    public T orElseThrow() throws PastHorizonException {
        if (failure != null) {
            throw failure;
        }
        return value;
    }

    public <R> QueryResult<R> map(Function<? super T, ? extends R> f) {
        return failure == null ? success(f.apply(value)) : pastHorizon(failure);
    }

    @Override
    public String toString() {
        return failure == null ? "Success(" + value + ")" : "PastHorizon(" + failure.getQuery() + ")";
    }
}
