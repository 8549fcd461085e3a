/**
 * Shared engine state and supervision of background tasks.
 *
 * @since 1.0.0
 */
package com.threatsentinel.core.runtime;
