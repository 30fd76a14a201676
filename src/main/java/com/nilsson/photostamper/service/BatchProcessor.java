package com.nilsson.photostamper.service;

import com.nilsson.photostamper.model.BatchSummary;
import com.nilsson.photostamper.model.ProcessingResult;
import com.nilsson.photostamper.render.FontFaceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.awt.Font;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 <h2>BatchProcessor</h2>
 <p>
 Annotates every image of an input folder into an output folder, one file at a time.
 </p>

 <h3>Core Responsibilities:</h3>
 <ul>
 <li><b>Fail fast:</b> the input folder, the font and the output folder are checked before any image is
 touched; a problem there raises {@link BatchConfigurationException}.</li>
 <li><b>Isolation:</b> an exception while processing one file is logged with its name and the file is
 skipped. The batch itself never fails because of a file.</li>
 <li><b>Progress:</b> after each file the listener receives {@code completed * 100 / total}; once more at
 the end, followed by the summary.</li>
 </ul>

 <h3>Concurrency Model:</h3>
 <p>
 {@link #start} hands the run to the injected single-thread executor so the caller stays responsive.
 {@link #process} runs on the calling thread. Images never share state, and cancellation is
 checked at file boundaries only.
 </p>
 */
public class BatchProcessor {

    private static final Logger logger = LoggerFactory.getLogger(BatchProcessor.class);

    static final Set<String> EXTENSIONS = Set.of("png", "jpg", "jpeg");

    // --- Dependencies ---
    private final ImageAnnotator annotator;
    private final FontFaceLoader fontLoader;
    private final ExecutorService executor;

    @Inject
    public BatchProcessor(ImageAnnotator annotator, FontFaceLoader fontLoader, ExecutorService executor) {
        this.annotator = annotator;
        this.fontLoader = fontLoader;
        this.executor = executor;
    }

    // --- Entry Points ---

    /**
     Validates the request on the calling thread, then runs the batch in the background.

     @throws BatchConfigurationException if the request cannot be run at all
     */
    public BatchJob start(BatchRequest request, BatchListener listener) throws BatchConfigurationException {
        PreparedBatch batch = prepare(request);
        BatchJob job = new BatchJob();
        try {
            executor.execute(() -> {
                try {
                    job.complete(run(batch, listener, job::isCancelRequested));
                } catch (Throwable t) {
                    logger.error("Batch worker failed unexpectedly", t);
                    job.fail(t);
                }
            });
        } catch (RejectedExecutionException e) {
            throw new BatchConfigurationException("Batch worker is not accepting work", e);
        }
        return job;
    }

    /**
     Runs the whole batch on the calling thread.
     */
    public BatchSummary process(BatchRequest request, BatchListener listener) throws BatchConfigurationException {
        return run(prepare(request), listener, () -> false);
    }

    // --- Preparation ---

    PreparedBatch prepare(BatchRequest request) throws BatchConfigurationException {
        Path inputDir = request.getInputDir();
        if (!Files.isDirectory(inputDir)) {
            throw new BatchConfigurationException("Input folder does not exist: " + inputDir);
        }

        Font font;
        try {
            font = fontLoader.load(request.getFontPath(), request.getFontSize());
        } catch (IOException e) {
            throw new BatchConfigurationException("Cannot load font " + request.getFontPath() + ": " + e.getMessage(), e);
        }

        try {
            Files.createDirectories(request.getOutputDir());
        } catch (IOException e) {
            throw new BatchConfigurationException("Cannot create output folder " + request.getOutputDir(), e);
        }

        List<Path> files;
        try {
            files = listImages(inputDir);
        } catch (IOException e) {
            throw new BatchConfigurationException("Cannot list input folder " + inputDir, e);
        }

        logger.info("Prepared batch of {} image(s) from {}", files.size(), inputDir);
        return new PreparedBatch(files, request.getOutputDir(), font);
    }

    /**
     Regular files whose extension is in the allow-list, case-insensitively. Sorted by name
     for readable logs; callers must not rely on the order.
     */
    static List<Path> listImages(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(BatchProcessor::isImageFile)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }

    static boolean isImageFile(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) return false;
        return EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    // --- Core Processing Logic ---

    private BatchSummary run(PreparedBatch batch, BatchListener listener, BooleanSupplier cancelled) {
        List<Path> files = batch.files;
        int total = files.size();
        List<ProcessingResult> results = new ArrayList<>(total);
        int lastProgress = 0;
        boolean stoppedEarly = false;

        for (int i = 0; i < total; i++) {
            if (cancelled.getAsBoolean()) {
                logger.info("Batch cancelled after {} of {} file(s)", i, total);
                stoppedEarly = true;
                break;
            }

            Path input = files.get(i);
            Path output = batch.outputDir.resolve(input.getFileName().toString());
            try {
                annotator.annotate(input, output, batch.font);
                results.add(ProcessingResult.succeeded(input, output));
                logger.info("Stamped {}", input.getFileName());
            } catch (Exception e) {
                logger.error("Error processing {}: {}", input.getFileName(), e.getMessage(), e);
                results.add(ProcessingResult.skipped(input, e.getMessage()));
                notify(() -> listener.onFileSkipped(input, e));
            }

            lastProgress = (int) ((i + 1) * 100L / total);
            int progress = lastProgress;
            notify(() -> listener.onProgress(progress));
        }

        int finalProgress = stoppedEarly ? lastProgress : 100;
        notify(() -> listener.onProgress(finalProgress));

        BatchSummary summary = new BatchSummary(results, total, stoppedEarly);
        logger.info("Batch finished: {}", summary);
        notify(() -> listener.onFinished(summary));
        return summary;
    }

    /**
     Listener code belongs to the caller; a failing callback must not abort the batch.
     */
    private void notify(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.warn("Batch listener threw, continuing", e);
        }
    }

    // --- Internal State ---

    static final class PreparedBatch {
        final List<Path> files;
        final Path outputDir;
        final Font font;

        PreparedBatch(List<Path> files, Path outputDir, Font font) {
            this.files = List.copyOf(files);
            this.outputDir = outputDir;
            this.font = font;
        }
    }
}
