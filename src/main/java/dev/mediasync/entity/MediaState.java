package dev.mediasync.entity;

/**
 * Media lifecycle of a {@link ContentItem}, derived from its locator and reference columns.
 */
public enum MediaState {
    /** No media locator; nothing will ever be downloaded. */
    NO_MEDIA,
    /** Locator present, no asset stored yet. */
    PENDING_MEDIA,
    /** Asset stored and referenced. */
    MEDIA_READY
}
