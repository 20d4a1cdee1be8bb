package com.faultline.core.fingerprint;

import com.faultline.core.model.ErrorSignal;

/**
 * Custom fingerprint derivation, replacing the default key entirely.
 *
 * <p>
 * Implementations may throw or return a blank value; the
 * {@link FingerprintGenerator} then falls back to its default algorithm.
 * </p>
 */
@FunctionalInterface
public interface FingerprintStrategy {

    /**
     * @param signal the captured error
     * @return the grouping key, or {@code null}/blank to use the default
     * @throws Exception if the key cannot be derived
     */
    String fingerprint(ErrorSignal signal) throws Exception;
}
