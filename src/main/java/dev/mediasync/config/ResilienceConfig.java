package dev.mediasync.config;

import dev.mediasync.exception.MediaDownloadException;
import io.r2dbc.spi.R2dbcTransientResourceException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised resilience settings: timeouts and retry strategies.
 *
 * <pre>
 * return downloadOnce(url)
 *         .retryWhen(resilience.downloadRetry(url));
 * </pre>
 */
@Component
@Getter
@Slf4j
public class ResilienceConfig {

    private final Duration databaseTimeout;
    private final int databaseRetryMaxAttempts;
    private final Duration databaseRetryMinBackoff;
    private final Duration databaseRetryMaxBackoff;
    private final int downloadMaxAttempts;
    private final Duration downloadMinBackoff;
    private final Duration downloadMaxBackoff;
    private final Duration downloadItemDeadline;

    public ResilienceConfig(
            @Value("${resilience.database.timeout-seconds:10}") int databaseTimeoutSeconds,
            @Value("${resilience.database.retry-max-attempts:3}") int databaseRetryMaxAttempts,
            @Value("${resilience.database.retry-min-backoff-ms:100}") long databaseRetryMinBackoffMs,
            @Value("${resilience.database.retry-max-backoff-ms:1000}") long databaseRetryMaxBackoffMs,
            @Value("${resilience.download.max-attempts:3}") int downloadMaxAttempts,
            @Value("${resilience.download.min-backoff-ms:4000}") long downloadMinBackoffMs,
            @Value("${resilience.download.max-backoff-ms:10000}") long downloadMaxBackoffMs,
            @Value("${resilience.download.item-deadline-seconds:300}") long downloadItemDeadlineSeconds
    ) {
        if (downloadMaxAttempts < 1) {
            throw new IllegalArgumentException("resilience.download.max-attempts must be at least 1");
        }
        this.databaseTimeout = Duration.ofSeconds(databaseTimeoutSeconds);
        this.databaseRetryMaxAttempts = databaseRetryMaxAttempts;
        this.databaseRetryMinBackoff = Duration.ofMillis(databaseRetryMinBackoffMs);
        this.databaseRetryMaxBackoff = Duration.ofMillis(databaseRetryMaxBackoffMs);
        this.downloadMaxAttempts = downloadMaxAttempts;
        this.downloadMinBackoff = Duration.ofMillis(downloadMinBackoffMs);
        this.downloadMaxBackoff = Duration.ofMillis(downloadMaxBackoffMs);
        this.downloadItemDeadline = Duration.ofSeconds(downloadItemDeadlineSeconds);
        log.info("Resilience configuration initialized (download attempts={}, backoff={}..{}, deadline={})",
                downloadMaxAttempts, downloadMinBackoff, downloadMaxBackoff, downloadItemDeadline);
    }

    /**
     * Retry strategy for transient database failures.
     * Uses exponential backoff with jitter to prevent thundering herd.
     */
    public Retry databaseRetry() {
        return Retry.backoff(databaseRetryMaxAttempts, databaseRetryMinBackoff)
                .maxBackoff(databaseRetryMaxBackoff)
                .jitter(0.5)
                .filter(this::isRetryableDatabaseException)
                .doBeforeRetry(signal -> log.warn("Retrying database operation, attempt {}/{}: {}",
                        signal.totalRetries() + 1,
                        databaseRetryMaxAttempts,
                        signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    /**
     * Retry envelope for a single download step. {@code max-attempts} counts the first try,
     * so the backoff handed to Reactor allows {@code max-attempts - 1} retries. Only failures whose
     * kind is flagged retryable are retried; the last failure is rethrown as-is when attempts
     * run out.
     */
    public RetryBackoffSpec downloadRetry(String url) {
        return Retry.backoff(downloadMaxAttempts - 1L, downloadMinBackoff)
                .maxBackoff(downloadMaxBackoff)
                .jitter(0.5)
                .filter(ResilienceConfig::isRetryableDownloadFailure)
                .doBeforeRetry(signal -> log.warn("Retrying download of {}, attempt {}/{}: {}",
                        url,
                        signal.totalRetries() + 2,
                        downloadMaxAttempts,
                        signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    static boolean isRetryableDownloadFailure(Throwable throwable) {
        return throwable instanceof MediaDownloadException downloadException && downloadException.isRetryable();
    }

    /**
     * Determines if a database exception is retryable (transient errors only).
     * Constraint violations are never retried: the store absorbs them as duplicates.
     */
    private boolean isRetryableDatabaseException(Throwable throwable) {
        if (throwable instanceof TransientDataAccessException
                || throwable instanceof R2dbcTransientResourceException) {
            return true;
        }

        String message = throwable.getMessage();
        if (message == null) return false;

        String lowerMessage = message.toLowerCase(Locale.ROOT);

        // Retry on connection issues
        if (lowerMessage.contains("connection refused") ||
            lowerMessage.contains("connection reset") ||
            lowerMessage.contains("temporarily unavailable") ||
            lowerMessage.contains("too many connections")) {
            return true;
        }

        // Retry on deadlocks
        return lowerMessage.contains("deadlock") || lowerMessage.contains("lock wait timeout");
    }
}
