package dev.mediasync.exception;

/**
 * Closed set of reasons a single media download can fail. Only {@link #TRANSIENT_TRANSPORT}
 * is worth another attempt; every other kind is a deterministic outcome of examining the
 * same resource.
 */
public enum DownloadErrorKind {

    /** Connection failure, transport timeout or 5xx response. */
    TRANSIENT_TRANSPORT(true),

    /** Declared or streamed size is above the configured byte budget. */
    SIZE_LIMIT_EXCEEDED(false),

    /** An HTML loader page came back and no direct asset URL could be recovered from it. */
    INTERSTITIAL_UNRESOLVED(false),

    /** Any other non-2xx response (404, 403, 410...). */
    REJECTED(false),

    /** The per-item deadline elapsed across all attempts. */
    DEADLINE_EXCEEDED(false);

    private final boolean retryable;

    DownloadErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
