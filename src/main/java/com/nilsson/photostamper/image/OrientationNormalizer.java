package com.nilsson.photostamper.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.Map;

/**
 Rotates and mirrors decoded pixels so they display upright, according to the EXIF orientation tag.
 * <p>The dispatch is a fixed table from the eight tag values to {@link ImageTransform}s.
 Values outside 1..8 are treated as 1.</p>
 */
public class OrientationNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(OrientationNormalizer.class);

    static final Map<Integer, ImageTransform> CORRECTIONS = Map.of(
            1, ImageTransform.IDENTITY,
            2, ImageTransform.FLIP_HORIZONTAL,
            3, ImageTransform.ROTATE_180,
            4, ImageTransform.FLIP_VERTICAL,
            5, ImageTransform.TRANSPOSE,
            6, ImageTransform.ROTATE_CW_90,
            7, ImageTransform.TRANSVERSE,
            8, ImageTransform.ROTATE_CCW_90
    );

    public BufferedImage normalize(BufferedImage image, int orientation) {
        return correctionFor(orientation).apply(image);
    }

    public ImageTransform correctionFor(int orientation) {
        ImageTransform transform = CORRECTIONS.get(orientation);
        if (transform == null) {
            logger.debug("Unknown orientation value {}, leaving pixels as stored", orientation);
            return ImageTransform.IDENTITY;
        }
        return transform;
    }
}
