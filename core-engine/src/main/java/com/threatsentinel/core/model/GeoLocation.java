package com.threatsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Approximate location of an IP address.
 *
 * @since 1.0.0
 */
public final class GeoLocation {

    /** Placeholder carried by a report until enrichment completes. */
    public static final GeoLocation PENDING = new GeoLocation("...", "...", 0.0, 0.0);

    /** Loopback and private-range addresses. */
    public static final GeoLocation LOCAL = new GeoLocation("Local", "Local", 0.0, 0.0);

    /** Lookup unavailable or failed. */
    public static final GeoLocation UNKNOWN = new GeoLocation("Unknown", "Unknown", 0.0, 0.0);

    private final String city;
    private final String country;
    private final double lat;
    private final double lon;

    public GeoLocation(String city, String country, double lat, double lon) {
        this.city = city != null ? city : "Unknown";
        this.country = country != null ? country : "Unknown";
        this.lat = lat;
        this.lon = lon;
    }

    @JsonProperty("city")
    public String getCity() {
        return city;
    }

    @JsonProperty("country")
    public String getCountry() {
        return country;
    }

    @JsonProperty("lat")
    public double getLat() {
        return lat;
    }

    @JsonProperty("lon")
    public double getLon() {
        return lon;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof GeoLocation that))
            return false;
        return Double.compare(lat, that.lat) == 0
                && Double.compare(lon, that.lon) == 0
                && city.equals(that.city)
                && country.equals(that.country);
    }

    @Override
    public int hashCode() {
        return Objects.hash(city, country, lat, lon);
    }

    @Override
    public String toString() {
        return city + ", " + country + " (" + lat + ", " + lon + ")";
    }
}
