/**
 * Fan-out of typed JSON messages to connected observers.
 *
 * @since 1.0.0
 */
package com.threatsentinel.core.broadcast;
