/**
 * Rolling baselines and anomaly classification.
 *
 * @since 1.0.0
 */
package com.faultline.core.baseline;
