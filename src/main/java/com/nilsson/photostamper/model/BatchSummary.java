package com.nilsson.photostamper.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 Container for everything a finished (or cancelled) batch produced.
 */
public class BatchSummary {

    private final List<ProcessingResult> results;
    private final int totalFiles;
    private final boolean cancelled;

    public BatchSummary(List<ProcessingResult> results, int totalFiles, boolean cancelled) {
        this.results = List.copyOf(results);
        this.totalFiles = totalFiles;
        this.cancelled = cancelled;
    }

    public List<ProcessingResult> getResults() {
        return results;
    }

    /**
     Output paths of the files that were annotated, in processing order.
     */
    public List<Path> getOutputPaths() {
        return results.stream()
                .map(ProcessingResult::getOutput)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
    }

    public int getSuccessCount() {
        return (int) results.stream().filter(ProcessingResult::isSucceeded).count();
    }

    public int getSkippedCount() {
        return results.size() - getSuccessCount();
    }

    public int getTotalFiles() {
        return totalFiles;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public String toString() {
        return "BatchSummary{succeeded=" + getSuccessCount() + ", skipped=" + getSkippedCount()
                + ", total=" + totalFiles + (cancelled ? ", cancelled" : "") + "}";
    }
}
