package dev.mediasync.service.store;

import dev.mediasync.entity.ContentItem;
import dev.mediasync.entity.MediaAsset;
import dev.mediasync.entity.Subscription;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence operations the sync pipeline relies on.
 * <p>
 * Inserts keyed by a natural id are idempotent: inserting a row whose key already exists
 * completes with {@code false} instead of an error. Failures that remain after the
 * database retry policy surface as errors of the returned publisher.
 * </p>
 */
public interface ContentStore {

    // ── Subscriptions ──

    /** All subscriptions in listing order (creation time, then id). */
    Flux<Subscription> listSubscriptions();

    /** @return true if the subscription was created, false if it already existed */
    Mono<Boolean> addSubscription(String sourceId, String title);

    /** @return true if a subscription was removed */
    Mono<Boolean> removeSubscription(String sourceId);

    // ── Content items ──

    Mono<Boolean> contentItemExists(String externalId);

    /** @return true if inserted, false if an item with the same external id already exists */
    Mono<Boolean> insertContentItem(ContentItem item);

    /** @return true if the item exists and was updated */
    Mono<Boolean> updateMetrics(String externalId, int score, int commentCount);

    /**
     * Points the item at its stored media file. The reference is write-once.
     *
     * @return true if the reference was set by this call
     */
    Mono<Boolean> setContentItemMediaRef(String externalId, String uidFilename);

    /** Items that carry a media locator but no stored media yet, oldest ingestion first. */
    Flux<ContentItem> listPendingMedia();

    Mono<Long> countPendingMedia();

    /** Newest items of one source. Read by browsing tools over the mirrored store, not by the sync. */
    Flux<ContentItem> listItemsBySource(String sourceId, int limit);

    // ── Media assets ──

    /** @return true if inserted, false if the file name or the owning item is already recorded */
    Mono<Boolean> insertMediaAsset(MediaAsset asset);

    /** Metadata of one stored file, for tools serving the media directory. */
    Mono<MediaAsset> findMediaAsset(String uidFilename);

    // ── Health ──

    /**
     * Completes empty when the store answers a trivial query, otherwise fails with
     * {@link dev.mediasync.exception.PersistenceUnavailableException}.
     */
    Mono<Void> verifyAvailable();
}
