package dev.mediasync.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Values the sync run consumes. Validated once at startup so a bad deployment fails before
 * any source is polled.
 */
@Component
@Getter
@Slf4j
public class SyncSettings {

    private final int maxConcurrentDownloads;
    private final long maxMediaSizeBytes;
    private final Integer maxItemsPerRun;
    private final int defaultSourceLimit;
    private final Path mediaDir;
    private final Duration pollPacing;
    private final boolean runOnStartup;
    private final List<String> defaultSubscriptions;

    public SyncSettings(
            @Value("${sync.max-concurrent-downloads:5}") int maxConcurrentDownloads,
            @Value("${sync.max-media-size-bytes:52428800}") long maxMediaSizeBytes,
            @Value("${sync.max-items-per-run:#{null}}") Integer maxItemsPerRun,
            @Value("${sync.default-source-limit:100}") int defaultSourceLimit,
            @Value("${sync.media-dir:media}") String mediaDir,
            @Value("${sync.poll-pacing-ms:100}") long pollPacingMs,
            @Value("${sync.run-on-startup:true}") boolean runOnStartup,
            @Value("${sync.default-subscriptions:}") String[] defaultSubscriptions) {
        if (maxConcurrentDownloads < 1) {
            throw new IllegalArgumentException("sync.max-concurrent-downloads must be at least 1");
        }
        if (maxMediaSizeBytes < 1) {
            throw new IllegalArgumentException("sync.max-media-size-bytes must be positive");
        }
        if (maxItemsPerRun != null && maxItemsPerRun < 1) {
            throw new IllegalArgumentException("sync.max-items-per-run must be positive when set");
        }
        if (defaultSourceLimit < 1) {
            throw new IllegalArgumentException("sync.default-source-limit must be at least 1");
        }
        if (mediaDir == null || mediaDir.isBlank()) {
            throw new IllegalArgumentException("sync.media-dir is required");
        }
        if (pollPacingMs < 0) {
            throw new IllegalArgumentException("sync.poll-pacing-ms must not be negative");
        }
        this.maxConcurrentDownloads = maxConcurrentDownloads;
        this.maxMediaSizeBytes = maxMediaSizeBytes;
        this.maxItemsPerRun = maxItemsPerRun;
        this.defaultSourceLimit = defaultSourceLimit;
        this.mediaDir = Path.of(mediaDir);
        this.pollPacing = Duration.ofMillis(pollPacingMs);
        this.runOnStartup = runOnStartup;
        this.defaultSubscriptions = defaultSubscriptions == null ? List.of() : Arrays.stream(defaultSubscriptions)
                .map(String::trim)
                .filter(entry -> !entry.isEmpty())
                .toList();
        log.info("Sync settings: {}", getConfigSummary());
    }

    /**
     * Settings summary for startup logging.
     */
    public String getConfigSummary() {
        return String.format("concurrency=%d, maxMediaSize=%d bytes, maxItemsPerRun=%s, mediaDir=%s, pacing=%dms",
                maxConcurrentDownloads,
                maxMediaSizeBytes,
                maxItemsPerRun == null ? "unbounded" : maxItemsPerRun.toString(),
                mediaDir,
                pollPacing.toMillis());
    }
}
