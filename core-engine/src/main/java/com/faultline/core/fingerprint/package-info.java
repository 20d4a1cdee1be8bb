/**
 * Error fingerprinting: groups logically identical errors under one stable key.
 *
 * @since 1.0.0
 */
package com.faultline.core.fingerprint;
