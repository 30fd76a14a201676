package com.nilsson.photostamper.service.geocode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nilsson.photostamper.config.StamperSettings;
import com.nilsson.photostamper.model.GeoCoordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 <h2>NominatimGeocoder</h2>
 <p>
 {@link ReverseGeocoder} backed by the OpenStreetMap Nominatim {@code /reverse} endpoint.
 </p>

 <h3>Contract:</h3>
 <ul>
 <li><b>One request:</b> no retries; the request carries the configured timeout.</li>
 <li><b>Identification:</b> every request sends the configured {@code User-Agent}, as required by the
 Nominatim usage policy, and the configured {@code Accept-Language}.</li>
 <li><b>No match:</b> a body with an {@code error} field or without an {@code address} object
 yields {@link GeocodedAddress#empty()} rather than an exception.</li>
 </ul>
 */
public class NominatimGeocoder implements ReverseGeocoder {

    private static final Logger logger = LoggerFactory.getLogger(NominatimGeocoder.class);

    private static final String[] COMPONENTS = {"province", "city", "town", "village", "suburb"};

    private final ObjectMapper mapper = new ObjectMapper();

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String userAgent;
    private final String language;
    private final Duration timeout;

    @Inject
    public NominatimGeocoder(HttpClient httpClient, StamperSettings settings) {
        this(httpClient, settings.getGeocoderBaseUrl(), settings.getGeocoderUserAgent(),
                settings.getGeocoderLanguage(), settings.getGeocoderTimeout());
    }

    public NominatimGeocoder(HttpClient httpClient, String baseUrl, String userAgent, String language, Duration timeout) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl;
        this.userAgent = userAgent;
        this.language = language;
        this.timeout = timeout;
    }

    @Override
    public GeocodedAddress reverse(GeoCoordinate coordinate) throws GeocodingException {
        HttpRequest request = HttpRequest.newBuilder(buildUri(coordinate))
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept-Language", language)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new GeocodingTimeoutException("Reverse geocoding timed out after " + timeout.toMillis() + "ms", e);
        } catch (IOException e) {
            throw new GeocodingException("Reverse geocoding request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GeocodingException("Reverse geocoding interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new GeocodingException("Reverse geocoding returned HTTP " + response.statusCode());
        }
        return parseAddress(response.body());
    }

    URI buildUri(GeoCoordinate coordinate) {
        String query = String.format(Locale.ROOT,
                "format=jsonv2&addressdetails=1&lat=%.7f&lon=%.7f",
                coordinate.getLatitude(), coordinate.getLongitude());
        return URI.create(baseUrl + "/reverse?" + query);
    }

    GeocodedAddress parseAddress(String body) throws GeocodingException {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new GeocodingException("Unreadable geocoding response: " + e.getMessage(), e);
        }

        if (root == null || root.has("error")) {
            logger.debug("Geocoder found no match: {}", root == null ? "empty body" : root.path("error").asText());
            return GeocodedAddress.empty();
        }

        JsonNode address = root.path("address");
        if (!address.isObject()) {
            return GeocodedAddress.empty();
        }

        Map<String, String> components = new HashMap<>();
        for (String key : COMPONENTS) {
            JsonNode value = address.get(key);
            if (value != null && value.isValueNode()) {
                components.put(key, value.asText());
            }
        }
        return GeocodedAddress.fromComponents(components);
    }
}
