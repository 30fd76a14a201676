package com.nilsson.photostamper.main;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.nilsson.photostamper.model.BatchSummary;
import com.nilsson.photostamper.service.BatchConfigurationException;
import com.nilsson.photostamper.service.BatchJob;
import com.nilsson.photostamper.service.BatchListener;
import com.nilsson.photostamper.service.BatchProcessor;
import com.nilsson.photostamper.service.BatchRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 <h2>Launcher</h2>
 <p>
 Command-line entry point of <b>Photo Stamper</b>.
 </p>
 <pre>
 photostamper &lt;inputDir&gt; &lt;outputDir&gt; &lt;fontPath&gt; [fontSize]
 </pre>
 <h3>Execution Flow:</h3>
 <ul>
 <li>Bootstraps Guice with {@link AppModule}.</li>
 <li>Submits the batch to the background worker and logs progress as it arrives.</li>
 <li>Exits with {@code 0} once the batch completes, whatever the number of skipped files;
 {@code 2} for bad arguments or a rejected configuration; {@code 1} if the worker itself crashed.</li>
 <li>On JVM shutdown, cancels the running batch and waits for the current file to be written.</li>
 </ul>
 */
public class Launcher {

    private static final Logger logger = LoggerFactory.getLogger(Launcher.class);

    static final int DEFAULT_FONT_SIZE = 200;
    static final long SHUTDOWN_GRACE_SECONDS = 30;

    private static final ShutdownCanceller SHUTDOWN = new ShutdownCanceller(SHUTDOWN_GRACE_SECONDS);
    private static final AtomicBoolean hookInstalled = new AtomicBoolean(false);

    // ------------------------------------------------------------------------
    // Entry Point
    // ------------------------------------------------------------------------

    public static void main(String[] args) {
        System.exit(run(args, Guice.createInjector(new AppModule())));
    }

    static int run(String[] args, Injector injector) {
        BatchRequest request;
        try {
            request = parseArgs(args);
        } catch (IllegalArgumentException e) {
            logger.error(e.getMessage());
            logger.error("Usage: photostamper <inputDir> <outputDir> <fontPath> [fontSize]");
            return 2;
        }

        BatchProcessor processor = injector.getInstance(BatchProcessor.class);
        try {
            BatchJob job = processor.start(request, new LoggingListener());
            installShutdownHook();
            SHUTDOWN.track(job);
            try {
                BatchSummary summary = job.await();
                logger.info("Done: {} image(s) stamped, {} skipped", summary.getSuccessCount(), summary.getSkippedCount());
                return 0;
            } finally {
                SHUTDOWN.untrack(job);
            }
        } catch (BatchConfigurationException e) {
            logger.error("Batch rejected: {}", e.getMessage());
            return 2;
        } catch (ExecutionException e) {
            logger.error("Batch worker crashed", e.getCause());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for the batch");
            return 1;
        }
    }

    /**
     Registers the JVM shutdown hook on first use only.

     @return {@code true} if this call installed it
     */
    static boolean installShutdownHook() {
        if (!hookInstalled.compareAndSet(false, true)) {
            return false;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(SHUTDOWN, "Batch-Shutdown"));
        return true;
    }

    static BatchRequest parseArgs(String[] args) {
        if (args == null || args.length < 3 || args.length > 4) {
            throw new IllegalArgumentException("Expected 3 or 4 arguments");
        }
        Path input = Paths.get(args[0]);
        Path output = Paths.get(args[1]);
        Path font = Paths.get(args[2]);
        int size = DEFAULT_FONT_SIZE;
        if (args.length == 4) {
            try {
                size = Integer.parseInt(args[3]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Font size is not a number: " + args[3]);
            }
            if (size <= 0) {
                throw new IllegalArgumentException("Font size must be positive: " + size);
            }
        }
        return new BatchRequest(input, output, font, size);
    }

    // ------------------------------------------------------------------------
    // Progress Reporting
    // ------------------------------------------------------------------------

    static class LoggingListener implements BatchListener {

        private int lastReported = -1;

        @Override
        public void onProgress(int percent) {
            if (percent != lastReported) {
                logger.info("Progress: {}%", percent);
                lastReported = percent;
            }
        }

        @Override
        public void onFileSkipped(Path file, Exception error) {
            logger.warn("Skipped {}", file.getFileName());
        }

        @Override
        public void onFinished(BatchSummary summary) {
            summary.getOutputPaths().forEach(p -> logger.debug("Wrote {}", p));
        }
    }

    // ------------------------------------------------------------------------
    // Shutdown
    // ------------------------------------------------------------------------

    /**
     Cancels the tracked batch and waits, up to the grace period, for the file in progress to
     finish. The batch worker is a daemon thread, so without the wait the JVM would halt it mid-write.
     */
    static class ShutdownCanceller implements Runnable {

        private final AtomicReference<BatchJob> current = new AtomicReference<>();
        private final long graceSeconds;

        ShutdownCanceller(long graceSeconds) {
            this.graceSeconds = graceSeconds;
        }

        void track(BatchJob job) {
            current.set(job);
        }

        void untrack(BatchJob job) {
            current.compareAndSet(job, null);
        }

        @Override
        public void run() {
            BatchJob job = current.get();
            if (job == null || job.isDone()) return;

            logger.warn("Shutdown requested, finishing the current file");
            job.cancel();
            try {
                BatchSummary summary = job.await(graceSeconds, TimeUnit.SECONDS);
                logger.info("Batch stopped: {}", summary);
            } catch (TimeoutException e) {
                logger.error("Current file did not finish within {}s, output may be incomplete", graceSeconds);
            } catch (ExecutionException e) {
                logger.error("Batch worker failed during shutdown", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for the batch to stop");
            }
        }
    }
}
