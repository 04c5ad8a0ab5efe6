package dev.mediasync.service;

/**
 * Metadata of one file written by {@link MediaDownloader}.
 *
 * @param uidFilename generated file name inside the destination directory
 * @param originalUrl URL the bytes were fetched from (the direct URL when a loader page was resolved)
 * @param contentType media type reported by the server, without parameters; may be null
 * @param sizeBytes   bytes actually written
 */
public record DownloadedMedia(String uidFilename, String originalUrl, String contentType, long sizeBytes) {
}
