/**
 * Staged detector pipeline: cheap stages in order with early exit on
 * CRITICAL, then the breaker-guarded expensive stage.
 *
 * @since 1.0.0
 */
package com.threatsentinel.core.pipeline;
