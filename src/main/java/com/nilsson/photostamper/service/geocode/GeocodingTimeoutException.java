package com.nilsson.photostamper.service.geocode;

/**
 Thrown when the geocoding service did not answer within its timeout.
 Kept separate from {@link GeocodingException} so callers can tell a slow service from a broken one.
 */
public class GeocodingTimeoutException extends GeocodingException {

    public GeocodingTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
