package com.nilsson.photostamper.image;

import com.nilsson.photostamper.config.StamperSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.NodeList;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import javax.imageio.stream.MemoryCacheImageInputStream;
import javax.inject.Inject;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.Locale;

/**
 <h2>ImageCodec</h2>
 <p>
 Decoding and re-encoding of the images flowing through the pipeline.
 </p>
 <ul>
 <li><b>Decode:</b> works on bytes already in memory through {@link MemoryCacheImageInputStream},
 picking the first ImageIO reader that accepts the stream (TwelveMonkeys plugins included).</li>
 <li><b>Color model:</b> {@link #toRgb(BufferedImage)} fixes every image to {@code TYPE_INT_RGB}
 before anything is drawn on it.</li>
 <li><b>Encode:</b> JPEG at the configured quality with 4:4:4 sampling (no chroma subsampling),
 PNG lossless. The file is written next to the target and moved into place, so a reader never
 sees a half-written image.</li>
 </ul>
 */
public class ImageCodec {

    private static final Logger logger = LoggerFactory.getLogger(ImageCodec.class);
    private static final String JPEG_METADATA_FORMAT = "javax_imageio_jpeg_image_1.0";

    static {
        ImageIO.scanForPlugins();
        ImageIO.setUseCache(false);
    }

    private final float jpegQuality;

    @Inject
    public ImageCodec(StamperSettings settings) {
        this(settings.getJpegQuality());
    }

    public ImageCodec(float jpegQuality) {
        this.jpegQuality = jpegQuality;
    }

    // --- Decode ---

    public BufferedImage decode(byte[] data, String name) throws IOException {
        try (ImageInputStream iis = new MemoryCacheImageInputStream(new ByteArrayInputStream(data))) {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
            if (!readers.hasNext()) {
                throw new IOException("No image reader accepts " + name);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(iis, true, true);
                BufferedImage image = reader.read(0);
                if (image == null) {
                    throw new IOException("Reader returned no image for " + name);
                }
                return image;
            } finally {
                reader.dispose();
            }
        }
    }

    /**
     Copies the image into {@code TYPE_INT_RGB}. Alpha is dropped and the stored color of each
     pixel is kept, so fully transparent areas keep whatever color they were saved with.
     Images already in that model are returned as-is.
     */
    public static BufferedImage toRgb(BufferedImage src) {
        if (src.getType() == BufferedImage.TYPE_INT_RGB) return src;

        int width = src.getWidth();
        int height = src.getHeight();
        BufferedImage rgb = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            src.getRGB(0, y, width, 1, row, 0, width);
            rgb.setRGB(0, y, width, 1, row, 0, width);
        }
        return rgb;
    }

    // --- Encode ---

    /**
     Writes the image to {@code target}; the format follows the target's extension.
     */
    public void write(BufferedImage image, Path target) throws IOException {
        String format = formatFor(target);
        Path dir = target.toAbsolutePath().getParent();
        Path temp = Files.createTempFile(dir, ".stamp-", ".tmp");
        try {
            try (ImageOutputStream out = ImageIO.createImageOutputStream(temp.toFile())) {
                if (out == null) {
                    throw new IOException("Cannot open output stream for " + temp);
                }
                if ("jpeg".equals(format)) {
                    writeJpeg(image, out);
                } else if (!ImageIO.write(image, format, out)) {
                    throw new IOException("No image writer for format " + format);
                }
            }
            moveIntoPlace(temp, target);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }

    private void writeJpeg(BufferedImage image, ImageOutputStream out) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        try {
            ImageWriteParam param = jpegWriteParam(writer);
            IIOMetadata metadata = writer.getDefaultImageMetadata(new ImageTypeSpecifier(image), param);
            disableChromaSubsampling(metadata);

            writer.setOutput(out);
            writer.write(null, new IIOImage(image, null, metadata), param);
        } finally {
            writer.dispose();
        }
    }

    ImageWriteParam jpegWriteParam(ImageWriter writer) {
        ImageWriteParam param = writer.getDefaultWriteParam();
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        param.setCompressionQuality(jpegQuality);
        return param;
    }

    /**
     Sets every component's sampling factors to 1x1 (4:4:4). Leaves the writer's default
     when the metadata does not expose the native JPEG tree.
     */
    private void disableChromaSubsampling(IIOMetadata metadata) {
        if (metadata == null || metadata.isReadOnly()) return;
        try {
            IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree(JPEG_METADATA_FORMAT);
            NodeList components = root.getElementsByTagName("componentSpec");
            for (int i = 0; i < components.getLength(); i++) {
                IIOMetadataNode component = (IIOMetadataNode) components.item(i);
                component.setAttribute("HsamplingFactor", "1");
                component.setAttribute("VsamplingFactor", "1");
            }
            metadata.setFromTree(JPEG_METADATA_FORMAT, root);
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Could not disable chroma subsampling, writer default applies: {}", e.getMessage());
        }
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static String formatFor(Path target) {
        String name = target.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".jpg") || name.endsWith(".jpeg")) return "jpeg";
        if (name.endsWith(".png")) return "png";
        throw new IllegalArgumentException("Unsupported output format: " + target.getFileName());
    }
}
