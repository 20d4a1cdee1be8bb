package com.faultline.core.aggregation;

/**
 * Raised by {@link ErrorStore#insert(com.faultline.core.model.AggregatedError)}
 * when an active record already exists for the same tenant and fingerprint.
 *
 * <p>
 * The aggregation engine recovers from it by re-reading the key; it never
 * reaches callers of the engine.
 * </p>
 *
 * @since 1.0.0
 */
public class DuplicateErrorException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String key;

    public DuplicateErrorException(String key) {
        super("Active error already exists for key '" + key + "'");
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
