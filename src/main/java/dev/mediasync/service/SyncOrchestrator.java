package dev.mediasync.service;

import dev.mediasync.config.SyncSettings;
import dev.mediasync.entity.ContentItem;
import dev.mediasync.entity.MediaAsset;
import dev.mediasync.entity.Subscription;
import dev.mediasync.exception.PersistenceUnavailableException;
import dev.mediasync.metrics.SyncMetrics;
import dev.mediasync.service.storage.MediaStorage;
import dev.mediasync.service.store.ContentStore;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one full sync: every subscribed source is polled in listing order under a global item
 * budget, then all items still waiting for media are downloaded.
 * <p>
 * A failing source or a failing download is logged, counted and skipped. Only
 * {@link PersistenceUnavailableException} ends the run with an error.
 * </p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SyncOrchestrator {

    private final ContentStore contentStore;
    private final FeedPoller feedPoller;
    private final DownloadCoordinator downloadCoordinator;
    private final MediaStorage mediaStorage;
    private final SyncSettings settings;
    private final SyncMetrics metrics;

    /**
     * Sync with the configured {@code sync.max-items-per-run}.
     */
    public Mono<SyncReport> syncAll() {
        return syncAll(settings.getMaxItemsPerRun());
    }

    /**
     * @param maxItemsThisRun global cap on feed entries handled in this run; null for no cap,
     *                        in which case each source is read up to the per-source default
     */
    public Mono<SyncReport> syncAll(Integer maxItemsThisRun) {
        return Mono.defer(() -> {
            RunTally tally = new RunTally();
            Timer.Sample sample = metrics.startRun();
            return contentStore.listSubscriptions()
                    .collectList()
                    .onErrorMap(e -> !(e instanceof PersistenceUnavailableException),
                            e -> new PersistenceUnavailableException("Could not load subscriptions: " + e.getMessage(), e))
                    .doOnNext(subscriptions -> log.info("Starting sync of {} subscription(s), item budget {}",
                            subscriptions.size(), maxItemsThisRun == null ? "unbounded" : maxItemsThisRun))
                    .flatMapMany(Flux::fromIterable)
                    .concatMap(subscription -> syncSource(subscription, maxItemsThisRun, tally))
                    .then(Mono.defer(() -> syncPendingMedia(tally)))
                    .then(Mono.fromSupplier(tally::toReport))
                    .doOnSuccess(report -> log.info("Sync finished: {}", report.summary()))
                    .doOnError(e -> log.error("Sync aborted: {}", e.getMessage()))
                    .doFinally(signal -> metrics.stopRun(sample));
        });
    }

    // ──────────────────────────────────────────────
    // Feed phase
    // ──────────────────────────────────────────────

    private Mono<Void> syncSource(Subscription subscription, Integer maxItemsThisRun, RunTally tally) {
        String sourceId = subscription.getSourceId();
        int limit = maxItemsThisRun == null
                ? settings.getDefaultSourceLimit()
                : maxItemsThisRun - tally.itemsProcessed.get();
        if (limit <= 0) {
            log.info("Item budget exhausted, skipping {}", sourceId);
            return Mono.empty();
        }
        log.debug("Syncing {} (limit {})", sourceId, limit);
        int before = tally.itemsProcessed.get();
        return feedPoller.poll(sourceId, limit)
                .concatMap(item -> storeItem(item, tally))
                .then()
                .doOnSuccess(done -> {
                    tally.sourcesSynced.incrementAndGet();
                    metrics.recordSourceSynced();
                    log.info("Synced {}: {} item(s)", sourceId, tally.itemsProcessed.get() - before);
                })
                .onErrorResume(e -> !(e instanceof PersistenceUnavailableException), e -> {
                    tally.sourcesFailed.incrementAndGet();
                    metrics.recordSourceFailed();
                    log.warn("Sync of {} failed, continuing with next source: {}", sourceId, e.getMessage());
                    return Mono.empty();
                });
    }

    /**
     * Known items only get their popularity metrics refreshed. An insert that loses a race
     * against another writer is treated the same way.
     */
    private Mono<Void> storeItem(ContentItem item, RunTally tally) {
        String externalId = item.getExternalId();
        int score = item.getScore() == null ? 0 : item.getScore();
        int commentCount = item.getCommentCount() == null ? 0 : item.getCommentCount();
        return contentStore.contentItemExists(externalId)
                .flatMap(exists -> exists ? Mono.just(false) : contentStore.insertContentItem(item))
                .flatMap(inserted -> inserted
                        ? Mono.just(true)
                        : contentStore.updateMetrics(externalId, score, commentCount).thenReturn(false))
                .doOnNext(inserted -> {
                    tally.itemsProcessed.incrementAndGet();
                    if (inserted) {
                        tally.itemsInserted.incrementAndGet();
                        metrics.recordItemInserted();
                        log.debug("Stored new item {} from {}", externalId, item.getSourceId());
                    } else {
                        tally.itemsUpdated.incrementAndGet();
                        metrics.recordItemUpdated();
                    }
                })
                .then();
    }

    // ──────────────────────────────────────────────
    // Media phase
    // ──────────────────────────────────────────────

    private Mono<Void> syncPendingMedia(RunTally tally) {
        Path mediaDir = settings.getMediaDir();
        Flux<DownloadRequest> requests = contentStore.listPendingMedia()
                .collectList()
                .doOnNext(pending -> log.info("{} item(s) waiting for media", pending.size()))
                .flatMapMany(Flux::fromIterable)
                .map(item -> new DownloadRequest(item.getExternalId(), item.getMediaUrl(), mediaDir));
        return downloadCoordinator.downloadAll(requests, settings.getMaxConcurrentDownloads(), settings.getMaxMediaSizeBytes())
                .concatMap(outcome -> recordOutcome(outcome, tally))
                .then(Mono.defer(this::refreshPendingGauge))
                .onErrorResume(e -> !(e instanceof PersistenceUnavailableException), e -> {
                    log.error("Media phase stopped: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<Void> recordOutcome(DownloadOutcome outcome, RunTally tally) {
        switch (outcome.status()) {
            case SKIPPED -> {
                tally.mediaSkipped.incrementAndGet();
                metrics.recordMediaSkipped();
                return Mono.empty();
            }
            case FAILED -> {
                tally.mediaFailed.incrementAndGet();
                metrics.recordMediaFailed(outcome.errorKind());
                return Mono.empty();
            }
            default -> {
                return persistDownload(outcome.request(), outcome.result(), tally);
            }
        }
    }

    /**
     * Records the asset first. The asset table allows one row per item, so a download that
     * lost a race to another writer is detected here and its file removed.
     */
    private Mono<Void> persistDownload(DownloadRequest request, DownloadedMedia media, RunTally tally) {
        String externalId = request.externalId();
        Path file = request.destinationDir().resolve(media.uidFilename());
        MediaAsset asset = MediaAsset.builder()
                .uidFilename(media.uidFilename())
                .originalUrl(media.originalUrl())
                .contentType(media.contentType())
                .sizeBytes(media.sizeBytes())
                .savedAt(LocalDateTime.now(ZoneOffset.UTC))
                .contentItemId(externalId)
                .build();
        return contentStore.insertMediaAsset(asset)
                .flatMap(inserted -> {
                    if (!inserted) {
                        log.info("Media for {} was already stored, discarding {}", externalId, media.uidFilename());
                        tally.mediaSkipped.incrementAndGet();
                        metrics.recordMediaSkipped();
                        return mediaStorage.delete(file).then();
                    }
                    return contentStore.setContentItemMediaRef(externalId, media.uidFilename())
                            .doOnNext(updated -> {
                                tally.mediaDownloaded.incrementAndGet();
                                metrics.recordMediaDownloaded();
                                log.info("Stored media {} for item {} ({} bytes)",
                                        media.uidFilename(), externalId, media.sizeBytes());
                            })
                            .then();
                })
                .onErrorResume(e -> !(e instanceof PersistenceUnavailableException), e -> {
                    log.warn("Could not record media {} for item {}: {}", media.uidFilename(), externalId, e.getMessage());
                    tally.mediaFailed.incrementAndGet();
                    metrics.recordMediaFailed(null);
                    return mediaStorage.delete(file).then();
                });
    }

    private Mono<Void> refreshPendingGauge() {
        return contentStore.countPendingMedia()
                .doOnNext(metrics::updatePendingMedia)
                .onErrorResume(e -> {
                    log.debug("Could not count pending media: {}", e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    private static final class RunTally {
        private final AtomicInteger itemsProcessed = new AtomicInteger();
        private final AtomicInteger itemsInserted = new AtomicInteger();
        private final AtomicInteger itemsUpdated = new AtomicInteger();
        private final AtomicInteger sourcesSynced = new AtomicInteger();
        private final AtomicInteger sourcesFailed = new AtomicInteger();
        private final AtomicInteger mediaDownloaded = new AtomicInteger();
        private final AtomicInteger mediaSkipped = new AtomicInteger();
        private final AtomicInteger mediaFailed = new AtomicInteger();

        SyncReport toReport() {
            return new SyncReport(itemsProcessed.get(), itemsInserted.get(), itemsUpdated.get(),
                    sourcesSynced.get(), sourcesFailed.get(),
                    mediaDownloaded.get(), mediaSkipped.get(), mediaFailed.get());
        }
    }
}
