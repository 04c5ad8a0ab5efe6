package dev.mediasync.service;

/**
 * Counts of one sync run. Items processed are all feed entries handled, new or already known.
 */
public record SyncReport(
        int itemsProcessed,
        int itemsInserted,
        int itemsUpdated,
        int sourcesSynced,
        int sourcesFailed,
        int mediaDownloaded,
        int mediaSkipped,
        int mediaFailed) {

    public String summary() {
        return String.format("items=%d (new=%d, updated=%d), sources=%d ok/%d failed, media=%d downloaded/%d skipped/%d failed",
                itemsProcessed, itemsInserted, itemsUpdated, sourcesSynced, sourcesFailed,
                mediaDownloaded, mediaSkipped, mediaFailed);
    }
}
