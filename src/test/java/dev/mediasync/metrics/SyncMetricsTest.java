package dev.mediasync.metrics;

import dev.mediasync.exception.DownloadErrorKind;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SyncMetricsTest {

    private SimpleMeterRegistry registry;
    private SyncMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SyncMetrics(registry);
        metrics.init();
    }

    @Test
    void itemAndSourceCounters_shouldBeTaggedByResult() {
        metrics.recordItemInserted();
        metrics.recordItemInserted();
        metrics.recordItemUpdated();
        metrics.recordSourceFailed();

        assertThat(registry.get("sync.items").tag("result", "inserted").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("sync.items").tag("result", "updated").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("sync.sources").tag("result", "failed").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("sync.sources").tag("result", "synced").counter().count()).isZero();
    }

    @Test
    void mediaFailures_shouldBeTaggedByKind() {
        metrics.recordMediaFailed(DownloadErrorKind.DEADLINE_EXCEEDED);
        metrics.recordMediaFailed(DownloadErrorKind.DEADLINE_EXCEEDED);
        metrics.recordMediaFailed(null);

        assertThat(registry.get("sync.media").tags("result", "failed", "kind", "deadline_exceeded").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("sync.media").tags("result", "failed", "kind", "other").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void mediaCounters_shouldShareTagKeys() {
        metrics.recordMediaDownloaded();
        metrics.recordMediaSkipped();
        metrics.recordMediaFailed(DownloadErrorKind.REJECTED);

        assertThat(registry.get("sync.media").counters())
                .hasSize(3)
                .allSatisfy(counter -> assertThat(counter.getId().getTags())
                        .extracting(Tag::getKey)
                        .containsExactlyInAnyOrder("result", "kind"));
        assertThat(registry.get("sync.media").tags("result", "downloaded", "kind", "none").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void pendingGauge_shouldReflectLastUpdate() {
        metrics.updatePendingMedia(7);
        metrics.updatePendingMedia(3);

        assertThat(registry.get("sync.media.pending").gauge().value()).isEqualTo(3.0);
    }

    @Test
    void runTimer_shouldRecordEachRun() {
        Timer.Sample sample = metrics.startRun();
        metrics.stopRun(sample);

        assertThat(registry.get("sync.run.duration").timer().count()).isEqualTo(1L);
    }
}
