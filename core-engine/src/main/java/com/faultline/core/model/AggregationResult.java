package com.faultline.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Outcome of folding one signal into the aggregated-error store.
 *
 * <p>
 * Downstream consumers use {@link #isFirstOccurrence()} to decide whether to
 * notify at all and {@link #isJustReopened()} to re-notify about regressions.
 * </p>
 *
 * @since 1.0.0
 */
public class AggregationResult implements Serializable {

    private static final long serialVersionUID = 1L;

    /** What the engine did with the signal. */
    public enum Action {
        CREATED,
        INCREMENTED,
        REOPENED
    }

    private AggregatedError error;
    private Action action;

    /** No-arg constructor required by Jackson. */
    public AggregationResult() {
    }

    public AggregationResult(AggregatedError error, Action action) {
        this.error = Objects.requireNonNull(error, "error must not be null");
        this.action = Objects.requireNonNull(action, "action must not be null");
    }

    public static AggregationResult created(AggregatedError error) {
        return new AggregationResult(error, Action.CREATED);
    }

    public static AggregationResult incremented(AggregatedError error) {
        return new AggregationResult(error, Action.INCREMENTED);
    }

    public static AggregationResult reopened(AggregatedError error) {
        return new AggregationResult(error, Action.REOPENED);
    }

    public AggregatedError getError() {
        return error;
    }

    public void setError(AggregatedError error) {
        this.error = error;
    }

    public Action getAction() {
        return action;
    }

    public void setAction(Action action) {
        this.action = action;
    }

    public boolean isJustReopened() {
        return action == Action.REOPENED;
    }

    public boolean isFirstOccurrence() {
        return error != null && error.getOccurrenceCount() == 1;
    }

    @Override
    public String toString() {
        return "AggregationResult{action=" + action + ", error=" + error + '}';
    }
}
