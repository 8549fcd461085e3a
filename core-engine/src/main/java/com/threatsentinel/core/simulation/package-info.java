/**
 * Ethical attack simulation against the engine itself.
 *
 * @since 1.0.0
 */
package com.threatsentinel.core.simulation;
