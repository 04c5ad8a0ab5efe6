package dev.mediasync.service;

import java.nio.file.Path;

/**
 * One pending media fetch.
 *
 * @param externalId     id of the content item the media belongs to
 * @param locator        raw media locator as stored on the item
 * @param destinationDir directory the file is written to
 */
public record DownloadRequest(String externalId, String locator, Path destinationDir) {
}
