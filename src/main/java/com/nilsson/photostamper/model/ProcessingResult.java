package com.nilsson.photostamper.model;

import java.nio.file.Path;
import java.util.Optional;

/**
 Outcome of one input file within a batch: either the annotated output was written,
 or the file was skipped and the reason recorded.
 */
public final class ProcessingResult {

    private final Path input;
    private final Path output;
    private final String skipReason;

    private ProcessingResult(Path input, Path output, String skipReason) {
        this.input = input;
        this.output = output;
        this.skipReason = skipReason;
    }

    public static ProcessingResult succeeded(Path input, Path output) {
        return new ProcessingResult(input, output, null);
    }

    public static ProcessingResult skipped(Path input, String reason) {
        return new ProcessingResult(input, null, reason == null ? "unknown error" : reason);
    }

    public Path getInput() {
        return input;
    }

    public Optional<Path> getOutput() {
        return Optional.ofNullable(output);
    }

    public Optional<String> getSkipReason() {
        return Optional.ofNullable(skipReason);
    }

    public boolean isSucceeded() {
        return output != null;
    }

    @Override
    public String toString() {
        return isSucceeded()
                ? "succeeded(" + input.getFileName() + " -> " + output + ")"
                : "skipped(" + input.getFileName() + ": " + skipReason + ")";
    }
}
