package dev.mediasync.service;

import dev.mediasync.exception.DownloadErrorKind;
import dev.mediasync.exception.MediaDownloadException;

/**
 * Result of one {@link DownloadRequest}: a written file, a skip (nothing fetchable) or a failure.
 */
public record DownloadOutcome(DownloadRequest request, Status status, DownloadedMedia result, Throwable error) {

    public enum Status {
        DOWNLOADED,
        SKIPPED,
        FAILED
    }

    public static DownloadOutcome downloaded(DownloadRequest request, DownloadedMedia result) {
        return new DownloadOutcome(request, Status.DOWNLOADED, result, null);
    }

    public static DownloadOutcome skipped(DownloadRequest request) {
        return new DownloadOutcome(request, Status.SKIPPED, null, null);
    }

    public static DownloadOutcome failed(DownloadRequest request, Throwable error) {
        return new DownloadOutcome(request, Status.FAILED, null, error);
    }

    /**
     * Error kind used for metric tags; failures outside the download taxonomy report as null.
     */
    public DownloadErrorKind errorKind() {
        return error instanceof MediaDownloadException downloadException ? downloadException.getKind() : null;
    }
}
