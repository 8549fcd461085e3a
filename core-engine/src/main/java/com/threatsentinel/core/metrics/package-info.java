/**
 * Sliding-window request and error counters and the periodic
 * {@code metrics_update} publisher.
 *
 * @since 1.0.0
 */
package com.threatsentinel.core.metrics;
