package com.nilsson.photostamper.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Font;
import java.awt.FontFormatException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 Loads a TrueType/OpenType font face from a file.
 */
public class FontFaceLoader {

    private static final Logger logger = LoggerFactory.getLogger(FontFaceLoader.class);

    /**
     Loads the face and sizes it to {@code nominalSize}.

     @throws IOException if the file is missing, unreadable or not a font
     */
    public Font load(Path fontPath, int nominalSize) throws IOException {
        if (fontPath == null || !Files.isRegularFile(fontPath)) {
            throw new IOException("Font file not found: " + fontPath);
        }
        try (InputStream in = Files.newInputStream(fontPath)) {
            Font face = Font.createFont(Font.TRUETYPE_FONT, in);
            logger.info("Loaded font '{}' from {}", face.getFontName(), fontPath.getFileName());
            return face.deriveFont((float) Math.max(1, nominalSize));
        } catch (FontFormatException e) {
            throw new IOException("Not a usable font file: " + fontPath.getFileName(), e);
        }
    }
}
