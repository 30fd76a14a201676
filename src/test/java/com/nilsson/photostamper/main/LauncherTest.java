package com.nilsson.photostamper.main;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.nilsson.photostamper.config.StamperSettings;
import com.nilsson.photostamper.model.BatchSummary;
import com.nilsson.photostamper.render.FontFaceLoader;
import com.nilsson.photostamper.service.BatchJob;
import com.nilsson.photostamper.service.BatchListener;
import com.nilsson.photostamper.service.BatchProcessor;
import com.nilsson.photostamper.service.BatchRequest;
import com.nilsson.photostamper.service.ImageAnnotator;
import com.nilsson.photostamper.service.geocode.NominatimGeocoder;
import com.nilsson.photostamper.service.geocode.ReverseGeocoder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 Tests for the command-line surface and the Guice wiring behind it.
 */
class LauncherTest {

    @TempDir
    Path tempDir;

    // --- Argument parsing ---

    @Test
    void parsesThreeArgumentsWithDefaultSize() {
        BatchRequest request = Launcher.parseArgs(new String[]{"in", "out", "font.ttf"});

        assertEquals(Paths.get("in"), request.getInputDir());
        assertEquals(Paths.get("out"), request.getOutputDir());
        assertEquals(Paths.get("font.ttf"), request.getFontPath());
        assertEquals(Launcher.DEFAULT_FONT_SIZE, request.getFontSize());
    }

    @Test
    void parsesExplicitFontSize() {
        assertEquals(64, Launcher.parseArgs(new String[]{"in", "out", "font.ttf", "64"}).getFontSize());
    }

    @Test
    void rejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> Launcher.parseArgs(new String[]{"in", "out"}));
        assertThrows(IllegalArgumentException.class, () -> Launcher.parseArgs(new String[]{"in", "out", "f", "big"}));
        assertThrows(IllegalArgumentException.class, () -> Launcher.parseArgs(new String[]{"in", "out", "f", "0"}));
        assertThrows(IllegalArgumentException.class, () -> Launcher.parseArgs(new String[]{"a", "b", "c", "1", "x"}));
    }

    // --- Wiring and exit codes ---

    @Test
    void moduleWiresSingletons() {
        Injector injector = Guice.createInjector(new AppModule(new StamperSettings(new Properties())));

        assertSame(injector.getInstance(BatchProcessor.class), injector.getInstance(BatchProcessor.class));
        assertTrue(injector.getInstance(ReverseGeocoder.class) instanceof NominatimGeocoder);
    }

    @Test
    void exitCodeTwoForUsageAndConfigurationErrors() {
        Injector injector = Guice.createInjector(new AppModule(new StamperSettings(new Properties())));

        assertEquals(2, Launcher.run(new String[]{"only-one"}, injector));
        assertEquals(2, Launcher.run(new String[]{tempDir.resolve("missing").toString(),
                tempDir.resolve("out").toString(), tempDir.resolve("font.ttf").toString()}, injector));
    }

    @Test
    void exitCodeZeroAfterSuccessfulRun() throws Exception {
        Path in = Files.createDirectory(tempDir.resolve("in"));
        ImageIO.write(new BufferedImage(80, 60, BufferedImage.TYPE_INT_RGB), "png", in.resolve("a.png").toFile());
        Path font = Paths.get(getClass().getResource("/fonts/DejaVuSans.ttf").toURI());
        Injector injector = Guice.createInjector(new AppModule(new StamperSettings(new Properties())));

        int code = Launcher.run(new String[]{in.toString(), tempDir.resolve("out").toString(), font.toString()}, injector);

        assertEquals(0, code);
        assertTrue(Files.exists(tempDir.resolve("out").resolve("a.png")));
    }

    // --- Shutdown ---

    @Test
    void shutdownHookIsInstalledOncePerJvm() {
        Launcher.installShutdownHook();

        assertFalse(Launcher.installShutdownHook(), "A second install must be a no-op");
        assertFalse(Launcher.installShutdownHook());
    }

    @Test
    void shutdownWaitsForFileInProgress() throws Exception {
        Path in = Files.createDirectory(tempDir.resolve("in"));
        for (String name : List.of("a.jpg", "b.jpg", "c.jpg")) {
            Files.writeString(in.resolve(name), "x");
        }
        Path font = Paths.get(getClass().getResource("/fonts/DejaVuSans.ttf").toURI());
        ImageAnnotator slow = mock(ImageAnnotator.class);
        CountDownLatch entered = new CountDownLatch(1);
        when(slow.annotate(any(), any(), any())).thenAnswer(invocation -> {
            entered.countDown();
            Thread.sleep(300);
            return invocation.getArgument(1);
        });
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            BatchProcessor processor = new BatchProcessor(slow, new FontFaceLoader(), executor);
            BatchJob job = processor.start(new BatchRequest(in, tempDir.resolve("out"), font, 64), BatchListener.NONE);
            assertTrue(entered.await(10, TimeUnit.SECONDS), "First file should start");

            Launcher.ShutdownCanceller canceller = new Launcher.ShutdownCanceller(10);
            canceller.track(job);
            canceller.run();

            assertTrue(job.isDone(), "Shutdown returns only after the worker stopped");
            BatchSummary summary = job.await(1, TimeUnit.SECONDS);
            assertTrue(summary.isCancelled());
            assertEquals(1, summary.getResults().size(), "The file in progress is finished, the rest are not started");
            verify(slow, times(1)).annotate(any(), any(), any());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shutdownWithoutRunningBatchIsNoOp() {
        Launcher.ShutdownCanceller canceller = new Launcher.ShutdownCanceller(1);
        assertDoesNotThrow(canceller::run);

        BatchJob finished = mock(BatchJob.class);
        when(finished.isDone()).thenReturn(true);
        canceller.track(finished);
        canceller.run();

        verify(finished, never()).cancel();
    }
}
