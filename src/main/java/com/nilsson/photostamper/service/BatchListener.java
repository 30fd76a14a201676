package com.nilsson.photostamper.service;

import com.nilsson.photostamper.model.BatchSummary;

import java.nio.file.Path;

/**
 Receives notifications from a running batch, on the batch worker thread.
 * <p>Progress values never decrease within a run. {@link #onFinished(BatchSummary)} is called
 exactly once, after every other notification.</p>
 */
public interface BatchListener {

    BatchListener NONE = new BatchListener() {
    };

    /**
     * @param percent completed files over total files, 0..100
     */
    default void onProgress(int percent) {
    }

    default void onFileSkipped(Path file, Exception error) {
    }

    default void onFinished(BatchSummary summary) {
    }
}
