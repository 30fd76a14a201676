package com.nilsson.photostamper.service.geocode;

public class GeocodingException extends Exception {

    public GeocodingException(String message) {
        super(message);
    }

    public GeocodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
