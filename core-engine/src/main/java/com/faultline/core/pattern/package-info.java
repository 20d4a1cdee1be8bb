/**
 * Time-series pattern detection: daily rhythms, bursts and cascades between
 * errors.
 *
 * @since 1.0.0
 */
package com.faultline.core.pattern;
