package dev.mediasync.service;

import dev.mediasync.util.MediaUrlNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Fans a batch of pending media out to the {@link MediaDownloader} with bounded concurrency.
 * Outcomes are emitted in completion order; a failed item becomes a {@code FAILED} outcome and
 * never cancels the rest of the batch.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DownloadCoordinator {

    private final MediaUrlNormalizer normalizer;
    private final MediaDownloader downloader;

    public Flux<DownloadOutcome> downloadAll(Flux<DownloadRequest> requests, int maxConcurrency, long maxSizeBytes) {
        if (maxConcurrency < 1) {
            return Flux.error(new IllegalArgumentException("maxConcurrency must be at least 1"));
        }
        return requests.flatMap(request -> Mono.defer(() -> downloadOne(request, maxSizeBytes))
                .onErrorResume(e -> {
                    log.warn("Media download failed for item {} ({}): {}",
                            request.externalId(), request.locator(), e.getMessage());
                    return Mono.just(DownloadOutcome.failed(request, e));
                }), maxConcurrency);
    }

    private Mono<DownloadOutcome> downloadOne(DownloadRequest request, long maxSizeBytes) {
        Optional<String> url = normalizer.normalize(request.locator());
        if (url.isEmpty()) {
            log.debug("Nothing to download for item {}", request.externalId());
            return Mono.just(DownloadOutcome.skipped(request));
        }
        return downloader.download(url.get(), request.destinationDir(), maxSizeBytes)
                .map(media -> DownloadOutcome.downloaded(request, media))
                .switchIfEmpty(Mono.fromSupplier(() -> DownloadOutcome.skipped(request)));
    }
}
