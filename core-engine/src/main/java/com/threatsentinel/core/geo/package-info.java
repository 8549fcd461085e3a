/**
 * Best-effort IP geolocation used to enrich incident broadcasts.
 *
 * @since 1.0.0
 */
package com.threatsentinel.core.geo;
