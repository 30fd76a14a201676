package com.nilsson.photostamper.image;

import java.awt.image.BufferedImage;
import java.util.function.UnaryOperator;

/**
 The eight pixel-exact geometric operations needed to undo any EXIF orientation.
 * <p>Every constant maps a source pixel {@code (x, y)} of a {@code w x h} image to exactly one
 destination pixel, so applying a transform and then its {@link #inverse()} restores the
 original pixels bit for bit. {@link #IDENTITY} returns its input unchanged.</p>
 * <p>The output is {@code TYPE_INT_RGB} or {@code TYPE_INT_ARGB} matching the source; any other
 source type is widened to {@code TYPE_INT_ARGB}.</p>
 */
public enum ImageTransform implements UnaryOperator<BufferedImage> {

    IDENTITY(false) {
        @Override
        int destIndex(int x, int y, int w, int h) {
            return y * w + x;
        }
    },
    FLIP_HORIZONTAL(false) {
        @Override
        int destIndex(int x, int y, int w, int h) {
            return y * w + (w - 1 - x);
        }
    },
    FLIP_VERTICAL(false) {
        @Override
        int destIndex(int x, int y, int w, int h) {
            return (h - 1 - y) * w + x;
        }
    },
    ROTATE_180(false) {
        @Override
        int destIndex(int x, int y, int w, int h) {
            return (h - 1 - y) * w + (w - 1 - x);
        }
    },
    /** Mirror across the main diagonal: flip horizontally, then rotate 90 degrees counter-clockwise. */
    TRANSPOSE(true) {
        @Override
        int destIndex(int x, int y, int w, int h) {
            // destination is h wide
            return x * h + y;
        }
    },
    /** Mirror across the anti-diagonal: flip horizontally, then rotate 90 degrees clockwise. */
    TRANSVERSE(true) {
        @Override
        int destIndex(int x, int y, int w, int h) {
            return (w - 1 - x) * h + (h - 1 - y);
        }
    },
    ROTATE_CW_90(true) {
        @Override
        int destIndex(int x, int y, int w, int h) {
            return x * h + (h - 1 - y);
        }
    },
    ROTATE_CCW_90(true) {
        @Override
        int destIndex(int x, int y, int w, int h) {
            return (w - 1 - x) * h + y;
        }
    };

    private final boolean swapsAxes;

    ImageTransform(boolean swapsAxes) {
        this.swapsAxes = swapsAxes;
    }

    /**
     Row-major index of the destination pixel for source pixel {@code (x, y)}.
     */
    abstract int destIndex(int x, int y, int w, int h);

    public boolean swapsAxes() {
        return swapsAxes;
    }

    public ImageTransform inverse() {
        switch (this) {
            case ROTATE_CW_90:
                return ROTATE_CCW_90;
            case ROTATE_CCW_90:
                return ROTATE_CW_90;
            default:
                return this;
        }
    }

    @Override
    public BufferedImage apply(BufferedImage src) {
        if (this == IDENTITY) return src;

        int w = src.getWidth();
        int h = src.getHeight();
        int[] in = src.getRGB(0, 0, w, h, null, 0, w);
        int[] out = new int[in.length];

        for (int y = 0; y < h; y++) {
            int row = y * w;
            for (int x = 0; x < w; x++) {
                out[destIndex(x, y, w, h)] = in[row + x];
            }
        }

        int dw = swapsAxes ? h : w;
        int dh = swapsAxes ? w : h;
        int type = src.getType() == BufferedImage.TYPE_INT_RGB ? BufferedImage.TYPE_INT_RGB : BufferedImage.TYPE_INT_ARGB;
        BufferedImage dst = new BufferedImage(dw, dh, type);
        dst.setRGB(0, 0, dw, dh, out, 0, dw);
        return dst;
    }
}
