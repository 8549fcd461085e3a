/**
 * Jackson configuration shared across modules.
 *
 * @since 1.0.0
 */
package com.threatsentinel.core.json;
