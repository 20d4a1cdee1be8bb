/**
 * Domain model classes for Faultline.
 *
 * <p>
 * This package contains the types shared between the aggregation engine, the
 * statistical detectors and the Flink job layer:
 * </p>
 * <ul>
 * <li>{@link com.faultline.core.model.ErrorSignal}: captured error, the
 * pipeline input</li>
 * <li>{@link com.faultline.core.model.AggregatedError}: deduplicated record
 * per tenant and fingerprint</li>
 * <li>{@link com.faultline.core.model.AggregationResult}: what the engine did
 * with a signal</li>
 * <li>{@link com.faultline.core.model.Baseline} and
 * {@link com.faultline.core.model.CascadePattern}: derived statistics</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.faultline.core.model;
