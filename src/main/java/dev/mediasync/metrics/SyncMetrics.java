package dev.mediasync.metrics;

import dev.mediasync.exception.DownloadErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

@Component
@RequiredArgsConstructor
@Slf4j
public class SyncMetrics {

    /** Every {@code sync.media} counter carries the same tag keys; this is the kind of a non-failure. */
    private static final String NO_FAILURE = "none";

    private final MeterRegistry meterRegistry;

    private final AtomicLong pendingMedia = new AtomicLong(0);

    // Cached counter references to avoid registry lookup on every call
    private Counter itemsInsertedCounter;
    private Counter itemsUpdatedCounter;
    private Counter sourcesSyncedCounter;
    private Counter sourcesFailedCounter;
    private Counter mediaDownloadedCounter;
    private Counter mediaSkippedCounter;
    private Timer runTimer;

    @PostConstruct
    public void init() {
        Gauge.builder("sync.media.pending", pendingMedia, AtomicLong::get)
                .description("Items with a media locator and no stored media after the last run")
                .register(meterRegistry);

        itemsInsertedCounter = meterRegistry.counter("sync.items", "result", "inserted");
        itemsUpdatedCounter = meterRegistry.counter("sync.items", "result", "updated");
        sourcesSyncedCounter = meterRegistry.counter("sync.sources", "result", "synced");
        sourcesFailedCounter = meterRegistry.counter("sync.sources", "result", "failed");
        mediaDownloadedCounter = meterRegistry.counter("sync.media", "result", "downloaded", "kind", NO_FAILURE);
        mediaSkippedCounter = meterRegistry.counter("sync.media", "result", "skipped", "kind", NO_FAILURE);
        runTimer = Timer.builder("sync.run.duration")
                .description("Wall time of one full sync run")
                .register(meterRegistry);
    }

    public void recordItemInserted() {
        itemsInsertedCounter.increment();
    }

    public void recordItemUpdated() {
        itemsUpdatedCounter.increment();
    }

    public void recordSourceSynced() {
        sourcesSyncedCounter.increment();
    }

    public void recordSourceFailed() {
        sourcesFailedCounter.increment();
    }

    public void recordMediaDownloaded() {
        mediaDownloadedCounter.increment();
    }

    public void recordMediaSkipped() {
        mediaSkippedCounter.increment();
    }

    /**
     * @param kind failure kind, or null for failures outside the download taxonomy
     */
    public void recordMediaFailed(DownloadErrorKind kind) {
        meterRegistry.counter("sync.media", "result", "failed",
                "kind", kind == null ? "other" : kind.name().toLowerCase(Locale.ROOT)).increment();
    }

    public Timer.Sample startRun() {
        return Timer.start(meterRegistry);
    }

    public void stopRun(Timer.Sample sample) {
        sample.stop(runTimer);
    }

    public void updatePendingMedia(long count) {
        pendingMedia.set(count);
    }
}
