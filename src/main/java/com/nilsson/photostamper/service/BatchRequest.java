package com.nilsson.photostamper.service;

import java.nio.file.Path;
import java.util.Objects;

/**
 Fully resolved parameters of one batch run. Resolving them (remembered folders, font
 discovery) is the caller's business.
 */
public final class BatchRequest {

    private final Path inputDir;
    private final Path outputDir;
    private final Path fontPath;
    private final int fontSize;

    public BatchRequest(Path inputDir, Path outputDir, Path fontPath, int fontSize) {
        this.inputDir = Objects.requireNonNull(inputDir, "inputDir");
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
        this.fontPath = Objects.requireNonNull(fontPath, "fontPath");
        this.fontSize = fontSize;
    }

    public Path getInputDir() {
        return inputDir;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public Path getFontPath() {
        return fontPath;
    }

    public int getFontSize() {
        return fontSize;
    }

    @Override
    public String toString() {
        return "BatchRequest{input=" + inputDir + ", output=" + outputDir + ", font=" + fontPath + ", size=" + fontSize + "}";
    }
}
