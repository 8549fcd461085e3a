package com.threatsentinel.core.geo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.threatsentinel.core.json.JsonSupport;
import com.threatsentinel.core.model.GeoLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.URI;
import java.net.URLEncoder;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * {@link GeoLocator} backed by an ip-api compatible JSON endpoint.
 *
 * <p>
 * The URL template contains {@code {ip}}, e.g.
 * {@code http://ip-api.com/json/{ip}}. The response must carry
 * {@code city}, {@code country}, {@code lat} and {@code lon}; a
 * {@code "status": "fail"} answer counts as a failed lookup. An empty
 * template disables remote lookups.
 * </p>
 *
 * @since 1.0.0
 */
public class HttpGeoLocator implements GeoLocator {

    private static final Logger LOG = LoggerFactory.getLogger(HttpGeoLocator.class);

    static final Duration TIMEOUT = Duration.ofSeconds(5);

    private static final Set<String> LOCAL_NAMES = Set.of("localhost", "unknown");

    private static final Pattern IPV4 = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");

    private final String urlTemplate;
    private final HttpClient client;
    private final ObjectMapper mapper = JsonSupport.newObjectMapper();

    public HttpGeoLocator(String urlTemplate) {
        this(urlTemplate, HttpClient.newBuilder().connectTimeout(TIMEOUT).build());
    }

    /**
     * @param urlTemplate lookup URL containing {@code {ip}}; blank disables
     *                    lookups
     * @param client      HTTP client
     */
    public HttpGeoLocator(String urlTemplate, HttpClient client) {
        this.urlTemplate = urlTemplate == null ? "" : urlTemplate.trim();
        this.client = Objects.requireNonNull(client, "HttpClient must not be null");
        if (!this.urlTemplate.isEmpty() && !this.urlTemplate.contains("{ip}")) {
            throw new IllegalArgumentException("Geolocation URL must contain {ip}: " + urlTemplate);
        }
    }

    @Override
    public GeoLocation locate(String ip) {
        if (isLocal(ip)) {
            return GeoLocation.LOCAL;
        }
        if (urlTemplate.isEmpty()) {
            return GeoLocation.UNKNOWN;
        }
        URI uri = URI.create(urlTemplate.replace("{ip}", URLEncoder.encode(ip, StandardCharsets.UTF_8)));
        try {
            HttpResponse<String> response = client.send(
                    HttpRequest.newBuilder(uri).timeout(TIMEOUT).GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                LOG.warn("Geolocation for {} returned HTTP {}", ip, response.statusCode());
                return GeoLocation.UNKNOWN;
            }
            JsonNode body = mapper.readTree(response.body());
            if ("fail".equals(body.path("status").asText())) {
                LOG.warn("Geolocation for {} failed: {}", ip, body.path("message").asText("no reason"));
                return GeoLocation.UNKNOWN;
            }
            return new GeoLocation(
                    body.path("city").asText("Unknown"),
                    body.path("country").asText("Unknown"),
                    body.path("lat").asDouble(0.0),
                    body.path("lon").asDouble(0.0));
        } catch (IOException e) {
            LOG.warn("Geolocation for {} failed: {}", ip, e.getMessage());
            return GeoLocation.UNKNOWN;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return GeoLocation.UNKNOWN;
        }
    }

    /**
     * @param ip address or name
     * @return {@code true} for blank, loopback, private, link-local or
     *         placeholder addresses
     */
    static boolean isLocal(String ip) {
        if (ip == null || ip.isBlank() || LOCAL_NAMES.contains(ip.toLowerCase(Locale.ROOT))) {
            return true;
        }
        // Only literals are inspected; a host name would trigger DNS.
        if (!IPV4.matcher(ip).matches() && !ip.contains(":")) {
            return false;
        }
        try {
            InetAddress addr = InetAddress.getByName(ip);
            return addr.isLoopbackAddress() || addr.isSiteLocalAddress()
                    || addr.isLinkLocalAddress() || addr.isAnyLocalAddress();
        } catch (UnknownHostException e) {
            return false;
        }
    }
}
