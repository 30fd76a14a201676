package com.nilsson.photostamper.service.geocode;

import com.nilsson.photostamper.model.GeoCoordinate;

/**
 External reverse-geocoding collaborator.
 */
public interface ReverseGeocoder {
    /**
     * Resolves a coordinate to its address components with a single, bounded request.
     * @param coordinate The coordinate to look up.
     * @return The address components; empty if the service knows nothing about the location.
     * @throws GeocodingTimeoutException if the request did not complete within the configured timeout
     * @throws GeocodingException for any other failure (transport, HTTP status, unreadable response)
     */
    GeocodedAddress reverse(GeoCoordinate coordinate) throws GeocodingException;
}
