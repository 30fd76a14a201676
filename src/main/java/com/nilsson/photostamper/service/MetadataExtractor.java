package com.nilsson.photostamper.service;

import com.drew.imaging.ImageMetadataReader;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.Tag;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;
import com.nilsson.photostamper.model.ImageMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 <h2>MetadataExtractor</h2>
 <p>
 Reads the capture metadata (EXIF orientation, capture time, GPS) embedded in an image.
 The heavy lifting is done by metadata-extractor; this class flattens its directory tree
 into an {@link ImageMetadata}.
 </p>

 <h3>Rules:</h3>
 <ul>
 <li><b>Precedence:</b> the primary EXIF directories (IFD0, then Sub-IFD) are read first, so their
 values win over thumbnail or container directories that reuse a tag name.</li>
 <li><b>GPS:</b> tags of the GPS directory go into the nested GPS mapping, never into the flat one.</li>
 <li><b>Failure:</b> nothing escapes. A broken container yields {@code UNAVAILABLE}, directory-level
 errors yield {@code PARTIAL} with whatever was read.</li>
 </ul>
 */
public class MetadataExtractor {

    private static final Logger logger = LoggerFactory.getLogger(MetadataExtractor.class);

    public ImageMetadata extract(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            return ImageMetadata.unavailable("no image data");
        }

        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(new ByteArrayInputStream(imageBytes), imageBytes.length);
        } catch (Exception e) {
            logger.warn("Could not read embedded metadata: {}", e.getMessage());
            return ImageMetadata.unavailable(e.getMessage());
        }
        return collect(metadata);
    }

    ImageMetadata collect(Metadata metadata) {
        Map<String, Object> tags = new LinkedHashMap<>();
        Map<String, Object> gpsTags = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();

        try {
            for (Directory directory : orderedDirectories(metadata)) {
                for (String error : directory.getErrors()) {
                    errors.add(directory.getName() + ": " + error);
                }
                Map<String, Object> target = directory instanceof GpsDirectory ? gpsTags : tags;
                for (Tag tag : directory.getTags()) {
                    Object value = directory.getObject(tag.getTagType());
                    if (value == null) continue;
                    target.putIfAbsent(canonicalName(tag.getTagName()), value);
                }
            }
        } catch (RuntimeException e) {
            logger.warn("Metadata extraction stopped early: {}", e.getMessage());
            attachGpsInfo(tags, gpsTags);
            return ImageMetadata.partial(tags, gpsTags, e.getMessage());
        }

        attachGpsInfo(tags, gpsTags);

        if (!errors.isEmpty()) {
            logger.debug("Metadata directories reported errors: {}", errors);
            return ImageMetadata.partial(tags, gpsTags, errors.get(0));
        }

        logger.debug("Extracted {} tags ({} GPS)", tags.size(), gpsTags.size());
        return ImageMetadata.of(tags, gpsTags);
    }

    /**
     Turns a metadata-extractor tag name into its compact form:
     {@code "Date/Time Original"} becomes {@code "DateTimeOriginal"},
     {@code "GPS Latitude Ref"} becomes {@code "GPSLatitudeRef"}.
     */
    static String canonicalName(String tagName) {
        if (tagName == null) return "";
        StringBuilder sb = new StringBuilder(tagName.length());
        for (int i = 0; i < tagName.length(); i++) {
            char c = tagName.charAt(i);
            if (Character.isLetterOrDigit(c)) sb.append(c);
        }
        return sb.toString();
    }

    private static void attachGpsInfo(Map<String, Object> tags, Map<String, Object> gpsTags) {
        if (!gpsTags.isEmpty()) {
            tags.put(ImageMetadata.GPS_INFO, Map.copyOf(gpsTags));
        }
    }

    private List<Directory> orderedDirectories(Metadata metadata) {
        List<Directory> ordered = new ArrayList<>();
        ordered.addAll(metadata.getDirectoriesOfType(ExifIFD0Directory.class));
        ordered.addAll(metadata.getDirectoriesOfType(ExifSubIFDDirectory.class));
        for (Directory directory : metadata.getDirectories()) {
            if (!ordered.contains(directory)) {
                ordered.add(directory);
            }
        }
        return ordered;
    }
}
