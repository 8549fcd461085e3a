/**
 * HTTP transport and process entry point.
 *
 * <p>
 * {@link com.threatsentinel.server.SentinelMain} wires a
 * {@link com.threatsentinel.core.engine.SentinelEngine} from environment
 * settings and exposes it through
 * {@link com.threatsentinel.server.SentinelServer}, including a
 * server-sent-event stream for live dashboards.
 * </p>
 *
 * @since 1.0.0
 */
package com.threatsentinel.server;
