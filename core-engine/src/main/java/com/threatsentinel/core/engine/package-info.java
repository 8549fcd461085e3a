/**
 * Assembly of the engine components.
 *
 * @since 1.0.0
 */
package com.threatsentinel.core.engine;
