package com.nilsson.photostamper.service;

import com.nilsson.photostamper.image.ImageCodec;
import com.nilsson.photostamper.image.OrientationNormalizer;
import com.nilsson.photostamper.model.BatchSummary;
import com.nilsson.photostamper.render.FontFaceLoader;
import com.nilsson.photostamper.render.OverlayRenderer;
import com.nilsson.photostamper.service.geocode.GeocodedAddress;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 <h2>BatchProcessorTest</h2>
 <p>
 Runs whole batches over temporary folders with the real per-file pipeline. Only the geocoder
 is replaced, by a stub that never finds a place, so no network is involved.
 </p>

 <h3>Covered behaviour:</h3>
 <ul>
 <li>Progress is monotonic and ends at 100.</li>
 <li>Corrupt files are skipped without stopping the batch.</li>
 <li>Configuration problems are rejected before any file is touched.</li>
 <li>Background runs complete through {@link BatchJob} and honour cancellation.</li>
 </ul>
 */
class BatchProcessorTest {

    @TempDir
    Path tempDir;

    private Path inputDir;
    private Path outputDir;
    private Path fontPath;
    private ExecutorService executor;
    private BatchProcessor processor;

    @BeforeEach
    void setUp() throws Exception {
        inputDir = Files.createDirectory(tempDir.resolve("in"));
        outputDir = tempDir.resolve("out");
        fontPath = Paths.get(getClass().getResource("/fonts/DejaVuSans.ttf").toURI());
        executor = Executors.newSingleThreadExecutor();
        processor = new BatchProcessor(annotator(), new FontFaceLoader(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    // --- Synchronous runs ---

    @Test
    void stampsEveryValidImageAndSkipsCorruptOnes() throws Exception {
        for (int i = 1; i <= 3; i++) {
            writeImage(inputDir.resolve("photo" + i + ".jpg"), "jpeg");
        }
        writeImage(inputDir.resolve("shot4.PNG"), "png");
        writeImage(inputDir.resolve("shot5.jpeg"), "jpeg");
        Files.writeString(inputDir.resolve("broken.jpg"), "not really a jpeg");
        Files.writeString(inputDir.resolve("notes.txt"), "ignored");

        RecordingListener listener = new RecordingListener();
        BatchSummary summary = processor.process(request(inputDir, outputDir), listener);

        assertEquals(6, summary.getTotalFiles(), "Only allow-listed extensions count");
        assertEquals(5, summary.getSuccessCount());
        assertEquals(1, summary.getSkippedCount());
        assertFalse(summary.isCancelled());

        assertEquals(List.of("broken.jpg"), listener.skipped);
        assertSame(summary, listener.summary);
        assertProgressWellFormed(listener.progress);

        List<String> written = listNames(outputDir);
        assertEquals(5, written.size());
        assertFalse(written.contains("broken.jpg"));
        assertFalse(written.contains("notes.txt"));
        for (String name : written) {
            assertNotNull(ImageIO.read(outputDir.resolve(name).toFile()), name + " should be a readable image");
        }
    }

    @Test
    void emptyFolderFinishesAtHundred() throws Exception {
        RecordingListener listener = new RecordingListener();

        BatchSummary summary = processor.process(request(inputDir, outputDir), listener);

        assertEquals(0, summary.getTotalFiles());
        assertEquals(List.of(100), listener.progress);
        assertTrue(Files.isDirectory(outputDir), "Output folder is created even for an empty batch");
    }

    @Test
    void outputFolderCanBeReprocessed() throws Exception {
        writeImage(inputDir.resolve("a.jpg"), "jpeg");
        writeImage(inputDir.resolve("b.png"), "png");
        processor.process(request(inputDir, outputDir), BatchListener.NONE);

        Path secondPass = tempDir.resolve("out2");
        BatchSummary summary = processor.process(request(outputDir, secondPass), BatchListener.NONE);

        assertEquals(2, summary.getSuccessCount());
        assertEquals(List.of("a.jpg", "b.png"), listNames(secondPass));
    }

    @Test
    void failingListenerDoesNotAbortBatch() throws Exception {
        writeImage(inputDir.resolve("a.jpg"), "jpeg");
        BatchListener throwing = new BatchListener() {
            @Override
            public void onProgress(int percent) {
                throw new IllegalStateException("listener bug");
            }
        };

        BatchSummary summary = processor.process(request(inputDir, outputDir), throwing);

        assertEquals(1, summary.getSuccessCount());
    }

    // --- Configuration errors ---

    @Test
    void missingInputFolderIsRejected() {
        BatchRequest request = request(tempDir.resolve("nope"), outputDir);

        assertThrows(BatchConfigurationException.class, () -> processor.process(request, BatchListener.NONE));
        assertFalse(Files.exists(outputDir), "Nothing is created for a rejected batch");
    }

    @Test
    void unusableFontIsRejected() throws IOException {
        writeImage(inputDir.resolve("a.jpg"), "jpeg");
        Path bogusFont = Files.writeString(tempDir.resolve("font.ttf"), "garbage");
        BatchRequest request = new BatchRequest(inputDir, outputDir, bogusFont, 200);

        BatchConfigurationException e = assertThrows(BatchConfigurationException.class,
                () -> processor.start(request, BatchListener.NONE));
        assertTrue(e.getMessage().contains("font"));
    }

    // --- Background runs ---

    @Test
    void startRunsInBackground() throws Exception {
        writeImage(inputDir.resolve("a.jpg"), "jpeg");
        writeImage(inputDir.resolve("b.jpg"), "jpeg");
        RecordingListener listener = new RecordingListener();

        BatchJob job = processor.start(request(inputDir, outputDir), listener);
        BatchSummary summary = job.await(30, TimeUnit.SECONDS);

        assertTrue(job.isDone());
        assertEquals(2, summary.getSuccessCount());
        assertProgressWellFormed(listener.progress);
        assertNotEquals(Thread.currentThread().getName(), listener.threadName);
    }

    @Test
    void cancelStopsAtNextFileBoundary() throws Exception {
        for (String name : List.of("a.jpg", "b.jpg", "c.jpg")) {
            Files.writeString(inputDir.resolve(name), "x");
        }
        ImageAnnotator blocking = mock(ImageAnnotator.class);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(blocking.annotate(any(), any(), any())).thenAnswer(invocation -> {
            entered.countDown();
            release.await(10, TimeUnit.SECONDS);
            return invocation.getArgument(1);
        });
        BatchProcessor cancellable = new BatchProcessor(blocking, new FontFaceLoader(), executor);

        BatchJob job = cancellable.start(request(inputDir, outputDir), BatchListener.NONE);
        assertTrue(entered.await(10, TimeUnit.SECONDS), "First file should start");
        job.cancel();
        release.countDown();
        BatchSummary summary = job.await(10, TimeUnit.SECONDS);

        assertTrue(summary.isCancelled());
        assertEquals(1, summary.getResults().size());
        assertEquals(3, summary.getTotalFiles());
        verify(blocking, times(1)).annotate(any(), any(), any());
    }

    // --- Discovery ---

    @Test
    void imageFilterIsCaseInsensitive() {
        assertTrue(BatchProcessor.isImageFile(Paths.get("a.JPG")));
        assertTrue(BatchProcessor.isImageFile(Paths.get("b.Jpeg")));
        assertTrue(BatchProcessor.isImageFile(Paths.get("c.png")));
        assertFalse(BatchProcessor.isImageFile(Paths.get("d.gif")));
        assertFalse(BatchProcessor.isImageFile(Paths.get("jpg")));
        assertFalse(BatchProcessor.isImageFile(Paths.get("e.")));
    }

    @Test
    void listingSkipsDirectories() throws IOException {
        Files.createDirectory(inputDir.resolve("folder.jpg"));
        writeImage(inputDir.resolve("z.png"), "png");

        List<Path> images = BatchProcessor.listImages(inputDir);

        assertEquals(1, images.size());
        assertEquals("z.png", images.get(0).getFileName().toString());
    }

    // --- Helpers ---

    private static ImageAnnotator annotator() {
        AddressResolver resolver = new AddressResolver(coordinate -> GeocodedAddress.empty());
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T03:00:00Z"), ZoneId.of("Asia/Seoul"));
        return new ImageAnnotator(new MetadataExtractor(), new ImageCodec(0.95f), new OrientationNormalizer(),
                new GeoCoordinateDecoder(), resolver, new OverlayRenderer(), clock, Locale.KOREA);
    }

    private BatchRequest request(Path in, Path out) {
        return new BatchRequest(in, out, fontPath, 200);
    }

    private static void writeImage(Path target, String format) throws IOException {
        BufferedImage img = new BufferedImage(160, 120, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < img.getHeight(); y++) {
            for (int x = 0; x < img.getWidth(); x++) {
                img.setRGB(x, y, (x * 255 / img.getWidth()) << 8 | (y * 255 / img.getHeight()));
            }
        }
        assertTrue(ImageIO.write(img, format, target.toFile()), "No writer for " + format);
    }

    private static List<String> listNames(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }

    private static void assertProgressWellFormed(List<Integer> progress) {
        assertFalse(progress.isEmpty(), "Progress must be reported");
        for (int i = 1; i < progress.size(); i++) {
            assertTrue(progress.get(i) >= progress.get(i - 1), "Progress went backwards: " + progress);
        }
        assertTrue(progress.stream().allMatch(p -> p >= 0 && p <= 100), "Out of range: " + progress);
        assertEquals(100, progress.get(progress.size() - 1));
    }

    private static class RecordingListener implements BatchListener {
        final List<Integer> progress = Collections.synchronizedList(new ArrayList<>());
        final List<String> skipped = Collections.synchronizedList(new ArrayList<>());
        volatile BatchSummary summary;
        volatile String threadName;

        @Override
        public void onProgress(int percent) {
            threadName = Thread.currentThread().getName();
            progress.add(percent);
        }

        @Override
        public void onFileSkipped(Path file, Exception error) {
            skipped.add(file.getFileName().toString());
        }

        @Override
        public void onFinished(BatchSummary result) {
            summary = result;
        }
    }
}
