package com.nilsson.photostamper.service;

import com.drew.lang.Rational;
import com.nilsson.photostamper.model.GeoCoordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 Converts the degree/minute/second GPS tags into a signed decimal {@link GeoCoordinate}.
 * <p>Each axis needs its DMS triple and its hemisphere reference. A component may be a
 metadata-extractor {@link Rational}, a two-element numeric pair (numerator, denominator)
 or a plain number. Anything else, including a zero denominator, makes the axis unresolved.
 A coordinate is returned only when both axes resolve.</p>
 */
public class GeoCoordinateDecoder {

    private static final Logger logger = LoggerFactory.getLogger(GeoCoordinateDecoder.class);

    public static final String LATITUDE = "GPSLatitude";
    public static final String LATITUDE_REF = "GPSLatitudeRef";
    public static final String LONGITUDE = "GPSLongitude";
    public static final String LONGITUDE_REF = "GPSLongitudeRef";

    public Optional<GeoCoordinate> decode(Map<String, Object> gpsTags) {
        if (gpsTags == null || gpsTags.isEmpty()) {
            return Optional.empty();
        }
        try {
            OptionalDouble latitude = decodeAxis(gpsTags.get(LATITUDE), gpsTags.get(LATITUDE_REF), "S");
            OptionalDouble longitude = decodeAxis(gpsTags.get(LONGITUDE), gpsTags.get(LONGITUDE_REF), "W");
            if (latitude.isPresent() && longitude.isPresent()) {
                return Optional.of(new GeoCoordinate(latitude.getAsDouble(), longitude.getAsDouble()));
            }
            logger.debug("GPS tags incomplete, latitude={}, longitude={}", latitude, longitude);
        } catch (RuntimeException e) {
            logger.warn("Ignoring malformed GPS tags: {}", e.getMessage());
        }
        return Optional.empty();
    }

    private OptionalDouble decodeAxis(Object dms, Object ref, String negativeRef) {
        if (dms == null || ref == null) return OptionalDouble.empty();

        String hemisphere = ref.toString().trim();
        if (hemisphere.isEmpty()) return OptionalDouble.empty();

        List<Object> parts = asList(dms);
        if (parts.size() < 3) return OptionalDouble.empty();

        OptionalDouble degrees = toDouble(parts.get(0));
        OptionalDouble minutes = toDouble(parts.get(1));
        OptionalDouble seconds = toDouble(parts.get(2));
        if (degrees.isEmpty() || minutes.isEmpty() || seconds.isEmpty()) return OptionalDouble.empty();

        double value = degrees.getAsDouble() + minutes.getAsDouble() / 60 + seconds.getAsDouble() / 3600;
        if (hemisphere.equalsIgnoreCase(negativeRef)) {
            value = -value;
        }
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    private OptionalDouble toDouble(Object component) {
        if (component instanceof Rational) {
            Rational rational = (Rational) component;
            if (rational.getDenominator() == 0) return OptionalDouble.empty();
            return OptionalDouble.of(rational.doubleValue());
        }
        if (component instanceof Number) {
            return OptionalDouble.of(((Number) component).doubleValue());
        }
        if (component != null && component.getClass().isArray()) {
            List<Object> pair = asList(component);
            if (pair.size() != 2) return OptionalDouble.empty();
            if (!(pair.get(0) instanceof Number) || !(pair.get(1) instanceof Number)) return OptionalDouble.empty();
            double denominator = ((Number) pair.get(1)).doubleValue();
            if (denominator == 0) return OptionalDouble.empty();
            return OptionalDouble.of(((Number) pair.get(0)).doubleValue() / denominator);
        }
        return OptionalDouble.empty();
    }

    private List<Object> asList(Object value) {
        if (value instanceof List) {
            @SuppressWarnings("unchecked")
            List<Object> list = (List<Object>) value;
            return list;
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            Object[] copy = new Object[length];
            for (int i = 0; i < length; i++) {
                copy[i] = Array.get(value, i);
            }
            return Arrays.asList(copy);
        }
        return List.of();
    }
}
