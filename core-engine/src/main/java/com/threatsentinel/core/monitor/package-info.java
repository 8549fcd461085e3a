/**
 * Supervised health monitoring of external websites.
 *
 * <p>
 * {@link com.threatsentinel.core.monitor.MonitorRegistry} owns one background
 * task per target; the check itself is delegated to a
 * {@link com.threatsentinel.core.monitor.MonitorBackend}.
 * </p>
 *
 * @since 1.0.0
 */
package com.threatsentinel.core.monitor;
