/**
 * Wiring: the per-signal ingestion pipeline and the periodic analysis
 * scheduler.
 *
 * @since 1.0.0
 */
package com.faultline.core.pipeline;
