/**
 * Circuit breaker protecting the expensive detector stage.
 *
 * @since 1.0.0
 */
package com.threatsentinel.core.resilience;
