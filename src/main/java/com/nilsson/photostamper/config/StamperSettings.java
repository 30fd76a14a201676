package com.nilsson.photostamper.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/**
 Read-only configuration for the annotation pipeline.
 * <p>Values come from {@code photostamper.properties} on the classpath. Any key can be
 overridden by a JVM system property with the same name, e.g.
 {@code -Dgeocoder.timeout-ms=3000}.</p>
 * <p>Malformed values never stop the application: the default is used and a warning is logged.</p>
 */
public class StamperSettings {

    private static final Logger logger = LoggerFactory.getLogger(StamperSettings.class);

    public static final String RESOURCE = "photostamper.properties";

    // --- Keys ---
    public static final String GEOCODER_BASE_URL = "geocoder.base-url";
    public static final String GEOCODER_USER_AGENT = "geocoder.user-agent";
    public static final String GEOCODER_TIMEOUT_MS = "geocoder.timeout-ms";
    public static final String GEOCODER_LANGUAGE = "geocoder.language";
    public static final String WEEKDAY_LOCALE = "overlay.weekday-locale";
    public static final String JPEG_QUALITY = "output.jpeg-quality";

    // --- Defaults ---
    private static final String DEFAULT_BASE_URL = "https://nominatim.openstreetmap.org";
    private static final String DEFAULT_USER_AGENT = "photo-stamper/1.0";
    private static final long DEFAULT_TIMEOUT_MS = 10_000;
    private static final String DEFAULT_LANGUAGE = "ko";
    private static final String DEFAULT_WEEKDAY_LOCALE = "ko-KR";
    private static final float DEFAULT_JPEG_QUALITY = 0.95f;

    private final Properties properties;

    public StamperSettings(Properties properties) {
        this.properties = new Properties();
        this.properties.putAll(properties);
    }

    /**
     Loads the bundled properties file and layers system properties on top.
     */
    public static StamperSettings load() {
        Properties props = new Properties();
        try (InputStream in = StamperSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                    props.load(reader);
                }
            } else {
                logger.warn("{} not found on classpath, using built-in defaults", RESOURCE);
            }
        } catch (IOException e) {
            logger.warn("Failed to read {}, using built-in defaults", RESOURCE, e);
        }

        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("geocoder.") || key.startsWith("overlay.") || key.startsWith("output.")) {
                props.setProperty(key, System.getProperty(key));
            }
        }
        return new StamperSettings(props);
    }

    // --- Typed accessors ---

    public String getGeocoderBaseUrl() {
        String url = get(GEOCODER_BASE_URL, DEFAULT_BASE_URL);
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public String getGeocoderUserAgent() {
        return get(GEOCODER_USER_AGENT, DEFAULT_USER_AGENT);
    }

    public Duration getGeocoderTimeout() {
        String raw = get(GEOCODER_TIMEOUT_MS, null);
        if (raw == null) return Duration.ofMillis(DEFAULT_TIMEOUT_MS);
        try {
            long millis = Long.parseLong(raw);
            if (millis > 0) return Duration.ofMillis(millis);
        } catch (NumberFormatException ignored) {
            // reported below
        }
        logger.warn("Invalid {}='{}', using {}ms", GEOCODER_TIMEOUT_MS, raw, DEFAULT_TIMEOUT_MS);
        return Duration.ofMillis(DEFAULT_TIMEOUT_MS);
    }

    public String getGeocoderLanguage() {
        return get(GEOCODER_LANGUAGE, DEFAULT_LANGUAGE);
    }

    public Locale getWeekdayLocale() {
        Locale locale = Locale.forLanguageTag(get(WEEKDAY_LOCALE, DEFAULT_WEEKDAY_LOCALE));
        if (locale.getLanguage().isEmpty()) {
            logger.warn("Invalid {}, using {}", WEEKDAY_LOCALE, DEFAULT_WEEKDAY_LOCALE);
            return Locale.forLanguageTag(DEFAULT_WEEKDAY_LOCALE);
        }
        return locale;
    }

    public float getJpegQuality() {
        String raw = get(JPEG_QUALITY, null);
        if (raw == null) return DEFAULT_JPEG_QUALITY;
        try {
            float quality = Float.parseFloat(raw);
            if (quality > 0f && quality <= 1f) return quality;
        } catch (NumberFormatException ignored) {
            // reported below
        }
        logger.warn("Invalid {}='{}', using {}", JPEG_QUALITY, raw, DEFAULT_JPEG_QUALITY);
        return DEFAULT_JPEG_QUALITY;
    }

    private String get(String key, String defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) return defaultValue;
        return value.trim();
    }
}
