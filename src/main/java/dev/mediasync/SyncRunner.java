package dev.mediasync;

import dev.mediasync.config.SyncSettings;
import dev.mediasync.exception.PersistenceUnavailableException;
import dev.mediasync.service.SubscriptionService;
import dev.mediasync.service.SyncOrchestrator;
import dev.mediasync.service.SyncReport;
import dev.mediasync.service.storage.MediaStorage;
import dev.mediasync.service.store.ContentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.nio.file.Path;

/**
 * Runs one sync when the application is ready: checks the store and the media directory,
 * seeds the default subscriptions, then syncs everything. The exit code reported to
 * {@code SpringApplication.exit} is 1 when the startup sync did not complete.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SyncRunner implements ExitCodeGenerator {

    private final ContentStore contentStore;
    private final MediaStorage mediaStorage;
    private final SubscriptionService subscriptionService;
    private final SyncOrchestrator syncOrchestrator;
    private final SyncSettings settings;

    private volatile int exitCode = 0;

    @EventListener(ApplicationReadyEvent.class)
    public void runOnStartup() {
        if (!settings.isRunOnStartup()) {
            log.debug("Startup sync skipped - sync.run-on-startup is false");
            return;
        }
        try {
            SyncReport report = run().block();
            log.info("Startup sync completed: {}", report == null ? "no report" : report.summary());
        } catch (PersistenceUnavailableException e) {
            exitCode = 1;
            log.error("Startup sync failed, store unavailable: {}", e.getMessage());
        } catch (RuntimeException e) {
            exitCode = 1;
            log.error("Startup sync failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Preflight checks followed by one full sync.
     */
    public Mono<SyncReport> run() {
        Path mediaDir = settings.getMediaDir();
        return contentStore.verifyAvailable()
                .then(mediaStorage.isWritable(mediaDir))
                .flatMap(writable -> writable
                        ? Mono.just(mediaDir)
                        : Mono.error(new IllegalStateException("Media directory is not writable: " + mediaDir.toAbsolutePath())))
                .doOnNext(dir -> log.info("Media directory ready: {} ({} storage)", dir.toAbsolutePath(), mediaStorage.getType()))
                .then(Mono.defer(() -> subscriptionService.seedDefaults(settings.getDefaultSubscriptions())))
                .then(Mono.defer(syncOrchestrator::syncAll));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
