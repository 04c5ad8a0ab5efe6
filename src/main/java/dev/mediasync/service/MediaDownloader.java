package dev.mediasync.service;

import dev.mediasync.config.ResilienceConfig;
import dev.mediasync.exception.MediaDownloadException;
import dev.mediasync.service.storage.MediaStorage;
import dev.mediasync.util.MediaFileTypes;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.reactivestreams.Subscription;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.BaseSubscriber;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fetches one media URL into a new file under a byte budget.
 * <p>
 * Each URL is probed first: status, declared length and content type are checked from the
 * headers alone and the probe's body is cancelled unread. HTML answers are treated as loader pages and resolved through
 * their {@code og:image} / {@code twitter:image} meta tag, at most once. The body is then
 * fetched with a second request and streamed to disk while the budget is enforced again,
 * since servers may omit or understate {@code Content-Length}.
 * </p>
 * <p>
 * The probe and the body fetch each run inside {@link ResilienceConfig#downloadRetry(String)};
 * only {@link dev.mediasync.exception.DownloadErrorKind#TRANSIENT_TRANSPORT} failures are
 * retried. The whole item is bounded by the configured deadline.
 * </p>
 */
@Service
@Slf4j
public class MediaDownloader {

    static final int MAX_INTERSTITIAL_DEPTH = 1;
    static final int HTML_SNIFF_BYTES = 1024;

    private static final String EMBEDDED_IMAGE_SELECTOR =
            "meta[property=og:image], meta[name=og:image], meta[property=twitter:image], meta[name=twitter:image]";

    private final WebClient webClient;
    private final MediaStorage mediaStorage;
    private final ResilienceConfig resilience;

    public MediaDownloader(WebClient.Builder webClientBuilder, MediaStorage mediaStorage, ResilienceConfig resilience) {
        this.webClient = webClientBuilder.clone().build();
        this.mediaStorage = mediaStorage;
        this.resilience = resilience;
    }

    /**
     * Download {@code url} into {@code destinationDir}.
     *
     * @param url            canonical URL, as produced by the normalizer
     * @param destinationDir directory the file is created in; created when missing
     * @param maxSizeBytes   hard upper bound for the stored file
     * @return metadata of the written file, or a {@link MediaDownloadException}
     */
    public Mono<DownloadedMedia> download(String url, Path destinationDir, long maxSizeBytes) {
        return mediaStorage.ensureDirectory(destinationDir)
                .then(download(url, destinationDir, maxSizeBytes, 0))
                .timeout(resilience.getDownloadItemDeadline())
                .onErrorMap(TimeoutException.class, e -> MediaDownloadException.deadlineExceeded(url, e));
    }

    private Mono<DownloadedMedia> download(String url, Path destinationDir, long maxSizeBytes, int depth) {
        return probe(url, maxSizeBytes)
                .retryWhen(resilience.downloadRetry(url))
                .flatMap(probe -> {
                    if (probe.embeddedUrl() == null) {
                        return fetchBody(url, probe.contentType(), destinationDir, maxSizeBytes)
                                .retryWhen(resilience.downloadRetry(url));
                    }
                    if (depth >= MAX_INTERSTITIAL_DEPTH) {
                        return Mono.error(MediaDownloadException.interstitialUnresolved(url,
                                "loader page leads to another loader page"));
                    }
                    log.debug("Resolved loader page {} to {}", url, probe.embeddedUrl());
                    return download(probe.embeddedUrl(), destinationDir, maxSizeBytes, depth + 1);
                });
    }

    // ──────────────────────────────────────────────
    // Probe
    // ──────────────────────────────────────────────

    private Mono<Probe> probe(String url, long maxSizeBytes) {
        return Mono.defer(() -> webClient.get()
                        .uri(toUri(url))
                        .exchangeToMono(response -> inspect(url, response, maxSizeBytes)))
                .onErrorMap(e -> classify(url, e));
    }

    private Mono<Probe> inspect(String url, ClientResponse response, long maxSizeBytes) {
        Mono<Probe> rejection = checkResponse(url, response, maxSizeBytes);
        if (rejection != null) {
            return rejection;
        }
        Optional<MediaType> mediaType = response.headers().contentType();
        String contentType = mediaType.map(MediaDownloader::bareType).orElse(null);
        if (mediaType.isPresent() && mediaType.get().isCompatibleWith(MediaType.TEXT_HTML)) {
            return readPrefix(response).flatMap(prefix -> resolveLoaderPage(url, prefix, contentType));
        }
        return discardBody(response).thenReturn(Probe.media(contentType));
    }

    private Mono<String> readPrefix(ClientResponse response) {
        Flux<DataBuffer> head = DataBufferUtils.takeUntilByteCount(response.bodyToFlux(DataBuffer.class), HTML_SNIFF_BYTES);
        return DataBufferUtils.join(head)
                .map(buffer -> {
                    try {
                        return buffer.toString(StandardCharsets.UTF_8);
                    } finally {
                        DataBufferUtils.release(buffer);
                    }
                })
                .defaultIfEmpty("");
    }

    private Mono<Probe> resolveLoaderPage(String url, String prefix, String contentType) {
        String lower = prefix.toLowerCase(Locale.ROOT);
        if (!lower.contains("<!doctype html") && !lower.contains("<html")) {
            // HTML content type but no document markers: store the bytes as they are
            return Mono.just(Probe.media(contentType));
        }
        return findEmbeddedImage(url, prefix)
                .map(embedded -> Mono.just(Probe.loaderPage(embedded)))
                .orElseGet(() -> Mono.error(MediaDownloadException.interstitialUnresolved(url,
                        "no og:image or twitter:image meta tag")));
    }

    static Optional<String> findEmbeddedImage(String pageUrl, String html) {
        Document document = Jsoup.parse(html, pageUrl);
        Element meta = document.selectFirst(EMBEDDED_IMAGE_SELECTOR);
        if (meta == null) {
            return Optional.empty();
        }
        String absolute = meta.absUrl("content");
        String content = absolute.isEmpty() ? meta.attr("content").trim() : absolute;
        return content.isEmpty() ? Optional.empty() : Optional.of(content);
    }

    // ──────────────────────────────────────────────
    // Body
    // ──────────────────────────────────────────────

    private Mono<DownloadedMedia> fetchBody(String url, String probedContentType, Path destinationDir, long maxSizeBytes) {
        return Mono.defer(() -> {
            String uidFilename = UUID.randomUUID().toString().replace("-", "")
                    + "." + MediaFileTypes.extensionFor(url, probedContentType);
            Path target = destinationDir.resolve(uidFilename);
            return webClient.get()
                    .uri(toUri(url))
                    .exchangeToMono(response -> {
                        Mono<DownloadedMedia> rejection = checkResponse(url, response, maxSizeBytes);
                        if (rejection != null) {
                            return rejection;
                        }
                        String contentType = response.headers().contentType()
                                .map(MediaDownloader::bareType)
                                .orElse(probedContentType);
                        return mediaStorage.write(target, limited(url, response.bodyToFlux(DataBuffer.class), maxSizeBytes))
                                .map(size -> new DownloadedMedia(uidFilename, url, contentType, size));
                    });
        })
        .doOnNext(media -> log.debug("Downloaded {} -> {} ({} bytes)", url, media.uidFilename(), media.sizeBytes()))
        .onErrorMap(e -> classify(url, e));
    }

    private static Flux<DataBuffer> limited(String url, Flux<DataBuffer> body, long maxSizeBytes) {
        AtomicLong received = new AtomicLong();
        return body.handle((buffer, sink) -> {
            long total = received.addAndGet(buffer.readableByteCount());
            if (total > maxSizeBytes) {
                DataBufferUtils.release(buffer);
                sink.error(MediaDownloadException.sizeLimitExceeded(url, total, maxSizeBytes));
            } else {
                sink.next(buffer);
            }
        });
    }

    // ──────────────────────────────────────────────
    // Helpers
    // ──────────────────────────────────────────────

    /**
     * Status and declared-length checks shared by probe and body fetch.
     *
     * @return an error publisher when the response must not be consumed, otherwise null
     */
    private static <T> Mono<T> checkResponse(String url, ClientResponse response, long maxSizeBytes) {
        HttpStatusCode status = response.statusCode();
        if (status.is5xxServerError()) {
            return discardBody(response).then(Mono.error(
                    MediaDownloadException.transientTransport(url, "HTTP " + status.value(), null)));
        }
        if (!status.is2xxSuccessful()) {
            return discardBody(response).then(Mono.error(MediaDownloadException.rejected(url, status.value())));
        }
        long declared = response.headers().contentLength().orElse(-1L);
        if (declared > maxSizeBytes) {
            return discardBody(response).then(Mono.error(
                    MediaDownloadException.sizeLimitExceeded(url, declared, maxSizeBytes)));
        }
        return null;
    }

    /**
     * Cancels the body without reading it, so the connection is closed instead of drained.
     * Only the headers of a probe or a rejected response are ever looked at.
     */
    private static Mono<Void> discardBody(ClientResponse response) {
        return Mono.fromRunnable(() -> response.bodyToFlux(DataBuffer.class).subscribe(new BaseSubscriber<DataBuffer>() {
            @Override
            protected void hookOnSubscribe(Subscription subscription) {
                subscription.cancel();
            }

            @Override
            protected void hookOnNext(DataBuffer buffer) {
                DataBufferUtils.release(buffer);
            }
        }));
    }

    /**
     * Maps transport-level failures into the download taxonomy. Anything already classified,
     * and programming errors, pass through untouched.
     */
    private static Throwable classify(String url, Throwable error) {
        if (error instanceof MediaDownloadException) {
            return error;
        }
        if (error instanceof WebClientRequestException
                || error instanceof IOException
                || error instanceof io.netty.handler.timeout.TimeoutException) {
            return MediaDownloadException.transientTransport(url, String.valueOf(error.getMessage()), error);
        }
        return error;
    }

    private static URI toUri(String url) {
        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            // Feed URLs are not always properly escaped
            return UriComponentsBuilder.fromUriString(url).encode().build().toUri();
        }
    }

    private static String bareType(MediaType mediaType) {
        return mediaType.getType() + "/" + mediaType.getSubtype();
    }

    private record Probe(String contentType, String embeddedUrl) {

        static Probe media(String contentType) {
            return new Probe(contentType, null);
        }

        static Probe loaderPage(String embeddedUrl) {
            return new Probe(null, embeddedUrl);
        }
    }
}
