/**
 * Aggregation engine and the store contract it runs against.
 *
 * <p>
 * {@link com.faultline.core.aggregation.AggregationEngine} is the only writer
 * of {@link com.faultline.core.model.AggregatedError} records.
 * {@link com.faultline.core.aggregation.InMemoryErrorStore} is the reference
 * store used by the streaming job and the tests.
 * </p>
 *
 * @since 1.0.0
 */
package com.faultline.core.aggregation;
