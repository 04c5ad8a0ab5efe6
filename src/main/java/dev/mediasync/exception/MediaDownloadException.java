package dev.mediasync.exception;

import lombok.Getter;

/**
 * Failure of a single media download, tagged with the {@link DownloadErrorKind} the retry
 * envelope and the metrics use.
 */
@Getter
public class MediaDownloadException extends RuntimeException {

    private final DownloadErrorKind kind;
    private final String url;

    public MediaDownloadException(DownloadErrorKind kind, String url, String message) {
        super(message);
        this.kind = kind;
        this.url = url;
    }

    public MediaDownloadException(DownloadErrorKind kind, String url, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.url = url;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    public static MediaDownloadException transientTransport(String url, String reason, Throwable cause) {
        return new MediaDownloadException(DownloadErrorKind.TRANSIENT_TRANSPORT, url,
                "Transient failure fetching " + url + ": " + reason, cause);
    }

    public static MediaDownloadException sizeLimitExceeded(String url, long size, long maxSizeBytes) {
        return new MediaDownloadException(DownloadErrorKind.SIZE_LIMIT_EXCEEDED, url,
                "File too large: " + size + " bytes (limit " + maxSizeBytes + ") for " + url);
    }

    public static MediaDownloadException interstitialUnresolved(String url, String reason) {
        return new MediaDownloadException(DownloadErrorKind.INTERSTITIAL_UNRESOLVED, url,
                "Received HTML loading page instead of media content for " + url + ": " + reason);
    }

    public static MediaDownloadException rejected(String url, int status) {
        return new MediaDownloadException(DownloadErrorKind.REJECTED, url,
                "Server answered " + status + " for " + url);
    }

    public static MediaDownloadException deadlineExceeded(String url, Throwable cause) {
        return new MediaDownloadException(DownloadErrorKind.DEADLINE_EXCEEDED, url,
                "Download deadline exceeded for " + url, cause);
    }
}
