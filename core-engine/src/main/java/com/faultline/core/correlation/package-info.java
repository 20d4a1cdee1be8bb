/**
 * Correlation and trend classification across error types.
 *
 * @since 1.0.0
 */
package com.faultline.core.correlation;
