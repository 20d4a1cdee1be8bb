/**
 * Configuration loading and validation.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.faultline.core.config.ConfigLoader} into a
 * {@link com.faultline.core.config.FaultlineConfig} instance, which is
 * validated immediately after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.faultline.core.config;
