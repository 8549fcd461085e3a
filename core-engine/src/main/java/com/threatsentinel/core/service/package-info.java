/**
 * Event submission entry point.
 *
 * @since 1.0.0
 */
package com.threatsentinel.core.service;
