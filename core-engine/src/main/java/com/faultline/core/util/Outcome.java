package com.faultline.core.util;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Success-or-failure result used at component boundaries on the ingestion
 * path.
 *
 * <p>
 * Components that must never fail the pipeline return an {@code Outcome}
 * instead of throwing; the caller picks an explicit fallback with
 * {@link #orElse(Object)} or inspects {@link #getError()}.
 * </p>
 *
 * @param <T> type of the success value
 * @since 1.0.0
 */
public final class Outcome<T> {

    private final T value;
    private final Exception error;

    private Outcome(T value, Exception error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Outcome<T> ok(T value) {
        return new Outcome<>(value, null);
    }

    public static <T> Outcome<T> failure(Exception error) {
        return new Outcome<>(null, Objects.requireNonNull(error, "error must not be null"));
    }

    /**
     * Run a computation, capturing any exception it throws as a failure.
     *
     * @param action the computation
     * @param <T>    result type
     * @return success holding the result, or failure holding the exception
     */
    public static <T> Outcome<T> of(Callable<T> action) {
        try {
            return ok(action.call());
        } catch (Exception e) {
            return failure(e);
        }
    }

    public boolean isOk() {
        return error == null;
    }

    /**
     * @return the success value
     * @throws IllegalStateException if this is a failure
     */
    public T get() {
        if (error != null) {
            throw new IllegalStateException("Outcome is a failure", error);
        }
        return value;
    }

    public Optional<Exception> getError() {
        return Optional.ofNullable(error);
    }

    public T orElse(T fallback) {
        return error == null ? value : fallback;
    }

    public T orElseGet(Function<Exception, T> fallback) {
        return error == null ? value : fallback.apply(error);
    }

    /**
     * Transform the success value. A failure is passed through unchanged and
     * exceptions thrown by {@code mapper} become failures.
     */
    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return failure(error);
        }
        try {
            return ok(mapper.apply(value));
        } catch (RuntimeException e) {
            return failure(e);
        }
    }

    @Override
    public String toString() {
        return error == null ? "Outcome.ok(" + value + ")" : "Outcome.failure(" + error + ")";
    }
}
