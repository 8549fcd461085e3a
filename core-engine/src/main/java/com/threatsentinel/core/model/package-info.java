/**
 * Domain model classes shared by the engine and the HTTP transport.
 *
 * <ul>
 * <li>{@link com.threatsentinel.core.model.SecurityEvent}: inbound event</li>
 * <li>{@link com.threatsentinel.core.model.Detection}: one detector hit</li>
 * <li>{@link com.threatsentinel.core.model.RiskScore}: aggregate risk</li>
 * <li>{@link com.threatsentinel.core.model.IncidentReport}: what gets
 * logged and broadcast</li>
 * <li>{@link com.threatsentinel.core.model.MonitorConfig} and
 * {@link com.threatsentinel.core.model.HealthRecord}: endpoint
 * monitoring</li>
 * <li>{@link com.threatsentinel.core.model.DetectionRule}: rule
 * configuration POJO</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.threatsentinel.core.model;
