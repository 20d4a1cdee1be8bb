package com.faultline.core.model;

/**
 * Workflow state of an {@link AggregatedError}.
 *
 * <p>
 * Transitions other than reopening are driven by external workflow tooling.
 * {@link #RESOLVED} and {@link #WONT_FIX} are terminal: a record in either
 * state is reopened when its fingerprint recurs.
 * </p>
 *
 * @since 1.0.0
 */
public enum ErrorState {

    NEW,
    IN_PROGRESS,
    INVESTIGATING,
    RESOLVED,
    WONT_FIX;

    public boolean isTerminal() {
        return this == RESOLVED || this == WONT_FIX;
    }
}
