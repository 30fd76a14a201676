package com.nilsson.photostamper.service;

import com.nilsson.photostamper.config.StamperSettings;
import com.nilsson.photostamper.image.ImageCodec;
import com.nilsson.photostamper.image.OrientationNormalizer;
import com.nilsson.photostamper.model.GeoCoordinate;
import com.nilsson.photostamper.model.ImageMetadata;
import com.nilsson.photostamper.model.ResolvedAddress;
import com.nilsson.photostamper.render.OverlayContent;
import com.nilsson.photostamper.render.OverlayRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.awt.Font;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 <h2>ImageAnnotator</h2>
 <p>
 The per-file pipeline: read, extract metadata, decode, fix the color model and orientation,
 resolve the place, draw the overlay, write.
 </p>
 <p>
 Metadata and geocoding problems are absorbed by their stages and only degrade the overlay.
 Decode, font and write problems surface as exceptions so the batch can skip the file.
 </p>
 */
public class ImageAnnotator {

    private static final Logger logger = LoggerFactory.getLogger(ImageAnnotator.class);

    static final DateTimeFormatter EXIF_DATE_TIME = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss", Locale.ROOT);
    private static final List<String> CAPTURE_TIME_TAGS =
            List.of(ImageMetadata.DATE_TIME_ORIGINAL, ImageMetadata.DATE_TIME);

    private final MetadataExtractor metadataExtractor;
    private final ImageCodec codec;
    private final OrientationNormalizer orientationNormalizer;
    private final GeoCoordinateDecoder coordinateDecoder;
    private final AddressResolver addressResolver;
    private final OverlayRenderer renderer;
    private final Clock clock;
    private final Locale weekdayLocale;

    @Inject
    public ImageAnnotator(MetadataExtractor metadataExtractor,
                          ImageCodec codec,
                          OrientationNormalizer orientationNormalizer,
                          GeoCoordinateDecoder coordinateDecoder,
                          AddressResolver addressResolver,
                          OverlayRenderer renderer,
                          Clock clock,
                          StamperSettings settings) {
        this(metadataExtractor, codec, orientationNormalizer, coordinateDecoder, addressResolver, renderer,
                clock, settings.getWeekdayLocale());
    }

    public ImageAnnotator(MetadataExtractor metadataExtractor,
                          ImageCodec codec,
                          OrientationNormalizer orientationNormalizer,
                          GeoCoordinateDecoder coordinateDecoder,
                          AddressResolver addressResolver,
                          OverlayRenderer renderer,
                          Clock clock,
                          Locale weekdayLocale) {
        this.metadataExtractor = metadataExtractor;
        this.codec = codec;
        this.orientationNormalizer = orientationNormalizer;
        this.coordinateDecoder = coordinateDecoder;
        this.addressResolver = addressResolver;
        this.renderer = renderer;
        this.clock = clock;
        this.weekdayLocale = weekdayLocale;
    }

    /**
     Annotates {@code input} and writes the result to {@code output}.

     @throws IOException if the file cannot be read, decoded or written
     */
    public Path annotate(Path input, Path output, Font fontFace) throws IOException {
        String name = input.getFileName().toString();
        byte[] bytes = Files.readAllBytes(input);

        ImageMetadata metadata = metadataExtractor.extract(bytes);
        if (!metadata.isAvailable()) {
            logger.info("{}: no readable metadata ({}), using defaults",
                    name, metadata.getFailureReason().orElse("unknown"));
        }

        BufferedImage image = ImageCodec.toRgb(codec.decode(bytes, name));
        image = orientationNormalizer.normalize(image, metadata.getOrientation());

        Optional<GeoCoordinate> coordinate = coordinateDecoder.decode(metadata.getGpsTags());
        ResolvedAddress address = addressResolver.resolve(coordinate);

        LocalDateTime capturedAt = captureTime(metadata, name);
        OverlayContent content = OverlayContent.of(capturedAt, weekdayLocale, address);

        renderer.render(image, content, fontFace);
        codec.write(image, output);

        logger.debug("{}: orientation={}, gps={}, address={}", name, metadata.getOrientation(),
                coordinate.map(GeoCoordinate::toString).orElse("none"), address);
        return output;
    }

    /**
     Capture time from {@code DateTimeOriginal}, then {@code DateTime}; the current time when neither parses.
     */
    LocalDateTime captureTime(ImageMetadata metadata, String name) {
        for (String tag : CAPTURE_TIME_TAGS) {
            Optional<String> raw = metadata.getString(tag);
            if (raw.isEmpty()) continue;
            try {
                return LocalDateTime.parse(raw.get(), EXIF_DATE_TIME);
            } catch (DateTimeParseException e) {
                logger.warn("{}: unparsable {} '{}'", name, tag, raw.get());
            }
        }
        logger.debug("{}: no capture time, using current time", name);
        return LocalDateTime.now(clock);
    }
}
