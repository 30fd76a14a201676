package com.nilsson.photostamper.main;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.nilsson.photostamper.config.StamperSettings;
import com.nilsson.photostamper.image.ImageCodec;
import com.nilsson.photostamper.image.OrientationNormalizer;
import com.nilsson.photostamper.render.FontFaceLoader;
import com.nilsson.photostamper.render.OverlayRenderer;
import com.nilsson.photostamper.service.AddressResolver;
import com.nilsson.photostamper.service.BatchProcessor;
import com.nilsson.photostamper.service.GeoCoordinateDecoder;
import com.nilsson.photostamper.service.ImageAnnotator;
import com.nilsson.photostamper.service.MetadataExtractor;
import com.nilsson.photostamper.service.geocode.NominatimGeocoder;
import com.nilsson.photostamper.service.geocode.ReverseGeocoder;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public class AppModule extends AbstractModule {

    private final StamperSettings settings;

    public AppModule() {
        this(StamperSettings.load());
    }

    public AppModule(StamperSettings settings) {
        this.settings = settings;
    }

    @Override
    protected void configure() {
        bind(StamperSettings.class).toInstance(settings);
        bind(MetadataExtractor.class).in(Singleton.class);
        bind(OrientationNormalizer.class).in(Singleton.class);
        bind(GeoCoordinateDecoder.class).in(Singleton.class);
        bind(AddressResolver.class).in(Singleton.class);
        bind(ImageCodec.class).in(Singleton.class);
        bind(FontFaceLoader.class).in(Singleton.class);
        bind(OverlayRenderer.class).in(Singleton.class);
        bind(ImageAnnotator.class).in(Singleton.class);
        bind(BatchProcessor.class).in(Singleton.class);
        bind(ReverseGeocoder.class).to(NominatimGeocoder.class).in(Singleton.class);
    }

    @Provides
    @Singleton
    public HttpClient provideHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(settings.getGeocoderTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Provides
    @Singleton
    public Clock provideClock() {
        return Clock.systemDefaultZone();
    }

    /**
     * The single background worker that runs batches, one at a time.
     * Daemon thread so a running batch does not keep the JVM alive on its own.
     */
    @Provides
    @Singleton
    public ExecutorService provideExecutorService() {
        return Executors.newSingleThreadExecutor(
                new ThreadFactory() {
                    private final AtomicInteger count = new AtomicInteger(1);
                    @Override
                    public Thread newThread(Runnable r) {
                        Thread t = new Thread(r);
                        t.setDaemon(true);
                        t.setName("Batch-Worker-" + count.getAndIncrement());
                        return t;
                    }
                }
        );
    }
}
