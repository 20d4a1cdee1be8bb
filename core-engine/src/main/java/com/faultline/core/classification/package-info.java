/**
 * Pure classification functions: severity, ignore/sampling gate, platform
 * detection and priority scoring.
 *
 * @since 1.0.0
 */
package com.faultline.core.classification;
