/**
 * Aggregated statistics over the incident histories.
 *
 * @since 1.0.0
 */
package com.threatsentinel.core.analytics;
