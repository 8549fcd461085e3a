/**
 * Aggregation of detections into a risk score.
 *
 * @since 1.0.0
 */
package com.threatsentinel.core.risk;
