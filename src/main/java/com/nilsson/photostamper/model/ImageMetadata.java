package com.nilsson.photostamper.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 <h2>ImageMetadata</h2>
 <p>
 Flat view of the capture metadata embedded in an image container. Tag names are canonical
 (letters and digits only, e.g. {@code DateTimeOriginal}); GPS tags live in their own nested
 mapping so they never collide with the primary EXIF tags.
 </p>
 <p>
 Every instance carries an {@link Availability} marker. Callers branch on it instead of
 guessing from an empty map whether the read failed.
 </p>
 */
public final class ImageMetadata {

    // --- Well-known tag names ---
    public static final String ORIENTATION = "Orientation";
    public static final String DATE_TIME = "DateTime";
    public static final String DATE_TIME_ORIGINAL = "DateTimeOriginal";
    public static final String GPS_INFO = "GPSInfo";

    public enum Availability {
        /** All directories were read. */
        AVAILABLE,
        /** Some directories were read before the reader failed. */
        PARTIAL,
        /** Nothing could be read. */
        UNAVAILABLE
    }

    private static final ImageMetadata EMPTY =
            new ImageMetadata(Map.of(), Map.of(), Availability.AVAILABLE, null);

    private final Map<String, Object> tags;
    private final Map<String, Object> gpsTags;
    private final Availability availability;
    private final String failureReason;

    private ImageMetadata(Map<String, Object> tags, Map<String, Object> gpsTags,
                          Availability availability, String failureReason) {
        this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        this.gpsTags = Collections.unmodifiableMap(new LinkedHashMap<>(gpsTags));
        this.availability = availability;
        this.failureReason = failureReason;
    }

    public static ImageMetadata empty() {
        return EMPTY;
    }

    public static ImageMetadata of(Map<String, Object> tags, Map<String, Object> gpsTags) {
        return new ImageMetadata(tags, gpsTags, Availability.AVAILABLE, null);
    }

    public static ImageMetadata partial(Map<String, Object> tags, Map<String, Object> gpsTags, String reason) {
        return new ImageMetadata(tags, gpsTags, Availability.PARTIAL, reason);
    }

    public static ImageMetadata unavailable(String reason) {
        return new ImageMetadata(Map.of(), Map.of(), Availability.UNAVAILABLE, reason);
    }

    // --- Accessors ---

    public Map<String, Object> getTags() {
        return tags;
    }

    /**
     The GPS sub-mapping keyed by canonical GPS tag name ({@code GPSLatitude}, {@code GPSLatitudeRef}, ...).
     Empty when the image carries no GPS directory.
     */
    public Map<String, Object> getGpsTags() {
        return gpsTags;
    }

    public Optional<Object> get(String tagName) {
        return Optional.ofNullable(tags.get(tagName));
    }

    public Optional<String> getString(String tagName) {
        return get(tagName).map(String::valueOf).map(String::trim).filter(s -> !s.isEmpty());
    }

    /**
     Orientation tag value, defaulting to 1 (identity) when the tag is absent or not numeric.
     */
    public int getOrientation() {
        Object value = tags.get(ORIENTATION);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException ignored) {
                // Descriptive values ("Top, left side") are not expected here.
            }
        }
        return 1;
    }

    public Availability getAvailability() {
        return availability;
    }

    public boolean isAvailable() {
        return availability != Availability.UNAVAILABLE;
    }

    public Optional<String> getFailureReason() {
        return Optional.ofNullable(failureReason);
    }

    @Override
    public String toString() {
        return "ImageMetadata{" + availability + ", tags=" + tags.size() + ", gps=" + gpsTags.size() + "}";
    }
}
