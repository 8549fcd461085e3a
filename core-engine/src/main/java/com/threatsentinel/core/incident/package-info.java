/**
 * Incident reports: building, fan-out, PII masking and the JSON file log.
 *
 * @since 1.0.0
 */
package com.threatsentinel.core.incident;
