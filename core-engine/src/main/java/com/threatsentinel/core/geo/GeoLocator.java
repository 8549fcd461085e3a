package com.threatsentinel.core.geo;

import com.threatsentinel.core.model.GeoLocation;

/**
 * Best-effort IP geolocation.
 */
public interface GeoLocator {

    /**
     * Resolve an IP address. Implementations may block; callers run them on
     * background tasks.
     *
     * @param ip source IP; may be {@code null}
     * @return the location, {@link GeoLocation#LOCAL} for local addresses and
     *         {@link GeoLocation#UNKNOWN} when the lookup fails; never
     *         {@code null}
     */
    GeoLocation locate(String ip);
}
