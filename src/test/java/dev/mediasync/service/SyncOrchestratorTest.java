package dev.mediasync.service;

import dev.mediasync.config.SyncSettings;
import dev.mediasync.entity.MediaAsset;
import dev.mediasync.entity.MediaState;
import dev.mediasync.exception.MediaDownloadException;
import dev.mediasync.exception.PersistenceUnavailableException;
import dev.mediasync.exception.SourceUnavailableException;
import dev.mediasync.metrics.SyncMetrics;
import dev.mediasync.service.feed.FeedApi;
import dev.mediasync.service.feed.FeedEntry;
import dev.mediasync.service.feed.MediaCandidate;
import dev.mediasync.service.storage.LocalMediaStorage;
import dev.mediasync.service.store.InMemoryContentStore;
import dev.mediasync.util.MediaHosts;
import dev.mediasync.util.MediaUrlNormalizer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SyncOrchestrator")
class SyncOrchestratorTest {

    private static final long MAX_SIZE = 1_000L;

    @TempDir
    Path mediaDir;

    @Mock
    private MediaDownloader downloader;

    private InMemoryContentStore store;
    private SimpleMeterRegistry meterRegistry;
    private SyncOrchestrator orchestrator;

    /** Entries served per source; a source mapped to an exception fails when polled. */
    private final Map<String, List<FeedEntry>> feeds = new HashMap<>();
    private final Map<String, RuntimeException> brokenFeeds = new HashMap<>();
    private final List<String> polledLimits = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        store = new InMemoryContentStore();
        meterRegistry = new SimpleMeterRegistry();
        SyncMetrics metrics = new SyncMetrics(meterRegistry);
        metrics.init();

        FeedApi feedApi = (sourceId, limit) -> {
            polledLimits.add(sourceId + ":" + limit);
            if (brokenFeeds.containsKey(sourceId)) {
                return Flux.error(brokenFeeds.get(sourceId));
            }
            return Flux.fromIterable(feeds.getOrDefault(sourceId, List.of())).take(limit);
        };
        FeedPoller poller = new FeedPoller(feedApi, Duration.ZERO, Clock.systemUTC());
        MediaHosts hosts = new MediaHosts("gallery.test", "img.gallery.test", List.of("site.test"),
                "video.cdn", "raw.cdn", "preview.cdn");
        DownloadCoordinator coordinator = new DownloadCoordinator(new MediaUrlNormalizer(hosts), downloader);
        SyncSettings settings = new SyncSettings(2, MAX_SIZE, null, 100, mediaDir.toString(), 0, false, new String[0]);

        orchestrator = new SyncOrchestrator(store, poller, coordinator, new LocalMediaStorage(), settings, metrics);
    }

    private static FeedEntry entry(String id, int score, MediaCandidate... candidates) {
        return new FeedEntry(id, "author", Instant.parse("2024-03-01T10:00:00Z"), "title " + id, "",
                List.of(candidates), score, 0, "{}");
    }

    private static List<FeedEntry> entries(String prefix, int count) {
        List<FeedEntry> result = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            result.add(entry(prefix + i, 1));
        }
        return result;
    }

    private static DownloadedMedia media(String uid, String url) {
        return new DownloadedMedia(uid, url, "image/jpeg", 42);
    }

    // ──────────────────────────────────────────────
    // Feed + media phases together
    // ──────────────────────────────────────────────
    @Nested
    @DisplayName("full run")
    class FullRun {

        @Test
        @DisplayName("should store both items and fetch media only for the one that has it")
        void twoSubscriptions_shouldEndWithOneAsset() {
            store.subscribe("siteA", "siteB");
            feeds.put("siteA", List.of(entry("p1", 3, new MediaCandidate.PreviewImage("https://preview.cdn/x?width=100"))));
            feeds.put("siteB", List.of(entry("p2", 1)));
            when(downloader.download(eq("https://raw.cdn/x"), eq(mediaDir), eq(MAX_SIZE)))
                    .thenReturn(Mono.just(media("u1.jpg", "https://raw.cdn/x")));

            StepVerifier.create(orchestrator.syncAll(null))
                    .assertNext(report -> {
                        assertThat(report.itemsInserted()).isEqualTo(2);
                        assertThat(report.sourcesSynced()).isEqualTo(2);
                        assertThat(report.mediaDownloaded()).isEqualTo(1);
                        assertThat(report.mediaFailed()).isZero();
                    })
                    .verifyComplete();

            assertThat(store.items()).hasSize(2);
            assertThat(store.item("p1").mediaState()).isEqualTo(MediaState.MEDIA_READY);
            assertThat(store.item("p1").getMediaUid()).isEqualTo("u1.jpg");
            assertThat(store.item("p2").mediaState()).isEqualTo(MediaState.NO_MEDIA);
            assertThat(store.assets()).singleElement().satisfies(asset -> {
                assertThat(asset.getContentItemId()).isEqualTo("p1");
                assertThat(asset.getSizeBytes()).isEqualTo(42L);
            });
            assertThat(meterRegistry.get("sync.items").tag("result", "inserted").counter().count()).isEqualTo(2.0);
            assertThat(meterRegistry.get("sync.run.duration").timer().count()).isEqualTo(1L);
        }

        @Test
        @DisplayName("should update metrics on re-run instead of inserting again")
        void rerun_shouldUpdateInsteadOfInsert() {
            store.subscribe("siteA");
            feeds.put("siteA", List.of(entry("p1", 3, new MediaCandidate.PlainUrl("https://cdn.test/a.jpg"))));
            when(downloader.download(eq("https://cdn.test/a.jpg"), any(), anyLong()))
                    .thenReturn(Mono.just(media("a1.jpg", "https://cdn.test/a.jpg")));

            orchestrator.syncAll(null).block();
            feeds.put("siteA", List.of(entry("p1", 99, new MediaCandidate.PlainUrl("https://cdn.test/a.jpg"))));

            StepVerifier.create(orchestrator.syncAll(null))
                    .assertNext(report -> {
                        assertThat(report.itemsProcessed()).isEqualTo(1);
                        assertThat(report.itemsInserted()).isZero();
                        assertThat(report.itemsUpdated()).isEqualTo(1);
                        assertThat(report.mediaDownloaded()).isZero();
                    })
                    .verifyComplete();

            assertThat(store.items()).hasSize(1);
            assertThat(store.item("p1").getScore()).isEqualTo(99);
            verify(downloader, times(1)).download(anyString(), any(), anyLong());
        }
    }

    // ──────────────────────────────────────────────
    // Failure isolation
    // ──────────────────────────────────────────────
    @Nested
    @DisplayName("failure isolation")
    class FailureIsolation {

        @Test
        @DisplayName("should keep syncing other sources when one source fails")
        void failingSource_shouldNotStopRun() {
            store.subscribe("siteA", "siteB");
            brokenFeeds.put("siteA", new SourceUnavailableException("siteA", "HTTP 503", null));
            feeds.put("siteB", List.of(entry("b1", 1)));

            StepVerifier.create(orchestrator.syncAll(null))
                    .assertNext(report -> {
                        assertThat(report.sourcesFailed()).isEqualTo(1);
                        assertThat(report.sourcesSynced()).isEqualTo(1);
                        assertThat(report.itemsInserted()).isEqualTo(1);
                    })
                    .verifyComplete();

            assertThat(store.item("b1")).isNotNull();
            assertThat(meterRegistry.get("sync.sources").tag("result", "failed").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should treat a store error on one item as a failure of that source only")
        void failingInsert_shouldFailOnlyItsSource() {
            store.subscribe("siteA", "siteB");
            feeds.put("siteA", List.of(entry("a1", 1), entry("a2", 1)));
            feeds.put("siteB", List.of(entry("b1", 1)));
            store.failInsertOf("a1");

            StepVerifier.create(orchestrator.syncAll(null))
                    .assertNext(report -> {
                        assertThat(report.sourcesFailed()).isEqualTo(1);
                        assertThat(report.sourcesSynced()).isEqualTo(1);
                    })
                    .verifyComplete();

            assertThat(store.item("b1")).isNotNull();
        }

        @Test
        @DisplayName("should count a failed download and leave the item pending")
        void failedDownload_shouldLeaveItemPending() {
            store.subscribe("siteA");
            feeds.put("siteA", List.of(
                    entry("p1", 1, new MediaCandidate.PlainUrl("https://cdn.test/broken.jpg")),
                    entry("p2", 1, new MediaCandidate.PlainUrl("https://cdn.test/fine.jpg"))));
            when(downloader.download(eq("https://cdn.test/broken.jpg"), any(), anyLong()))
                    .thenReturn(Mono.error(MediaDownloadException.sizeLimitExceeded("https://cdn.test/broken.jpg", 2_000, MAX_SIZE)));
            when(downloader.download(eq("https://cdn.test/fine.jpg"), any(), anyLong()))
                    .thenReturn(Mono.just(media("f.jpg", "https://cdn.test/fine.jpg")));

            StepVerifier.create(orchestrator.syncAll(null))
                    .assertNext(report -> {
                        assertThat(report.mediaFailed()).isEqualTo(1);
                        assertThat(report.mediaDownloaded()).isEqualTo(1);
                    })
                    .verifyComplete();

            assertThat(store.item("p1").mediaState()).isEqualTo(MediaState.PENDING_MEDIA);
            assertThat(store.item("p2").mediaState()).isEqualTo(MediaState.MEDIA_READY);
            assertThat(meterRegistry.get("sync.media").tag("kind", "size_limit_exceeded").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("should discard its file when another writer already stored media for the item")
        void lostRace_shouldDeleteDownloadedFile() throws IOException {
            store.subscribe("siteA");
            feeds.put("siteA", List.of(entry("p1", 1, new MediaCandidate.PlainUrl("https://cdn.test/r.jpg"))));
            store.putAsset(MediaAsset.builder()
                    .uidFilename("winner.jpg")
                    .contentItemId("p1")
                    .sizeBytes(1L)
                    .savedAt(LocalDateTime.now())
                    .build());
            Path loserFile = Files.writeString(mediaDir.resolve("loser.jpg"), "bytes");
            when(downloader.download(eq("https://cdn.test/r.jpg"), any(), anyLong()))
                    .thenReturn(Mono.just(media("loser.jpg", "https://cdn.test/r.jpg")));

            StepVerifier.create(orchestrator.syncAll(null))
                    .assertNext(report -> {
                        assertThat(report.mediaDownloaded()).isZero();
                        assertThat(report.mediaSkipped()).isEqualTo(1);
                    })
                    .verifyComplete();

            assertThat(loserFile).doesNotExist();
            assertThat(store.assets()).extracting(MediaAsset::getUidFilename).containsExactly("winner.jpg");
        }

        @Test
        @DisplayName("should abort when subscriptions cannot be loaded")
        void subscriptionsUnavailable_shouldAbort() {
            store.failSubscriptionListing(new DataAccessResourceFailureException("connection refused"));

            StepVerifier.create(orchestrator.syncAll(null))
                    .expectError(PersistenceUnavailableException.class)
                    .verify();

            verify(downloader, never()).download(anyString(), any(), anyLong());
        }
    }

    // ──────────────────────────────────────────────
    // Item budget
    // ──────────────────────────────────────────────
    @Nested
    @DisplayName("item budget")
    class Budget {

        @Test
        @DisplayName("should shrink each source's limit by what earlier sources used and stop at zero")
        void budget_shouldBeSharedAcrossSources() {
            store.subscribe("siteA", "siteB", "siteC");
            feeds.put("siteA", entries("a", 2));
            feeds.put("siteB", entries("b", 5));
            feeds.put("siteC", entries("c", 5));

            StepVerifier.create(orchestrator.syncAll(3))
                    .assertNext(report -> assertThat(report.itemsProcessed()).isEqualTo(3))
                    .verifyComplete();

            assertThat(polledLimits).containsExactly("siteA:3", "siteB:1");
            assertThat(store.items()).hasSize(3);
        }

        @Test
        @DisplayName("should read every source up to the default limit when unbounded")
        void unbounded_shouldUseDefaultSourceLimit() {
            store.subscribe("siteA", "siteB");

            StepVerifier.create(orchestrator.syncAll(null))
                    .assertNext(report -> assertThat(report.sourcesSynced()).isEqualTo(2))
                    .verifyComplete();

            assertThat(polledLimits).containsExactly("siteA:100", "siteB:100");
        }
    }
}
