/**
 * Notification throttling and the dispatch contract.
 *
 * @since 1.0.0
 */
package com.faultline.core.notification;
