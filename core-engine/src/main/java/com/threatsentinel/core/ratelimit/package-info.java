/**
 * Adaptive blocking of high-risk source IPs.
 *
 * @since 1.0.0
 */
package com.threatsentinel.core.ratelimit;
