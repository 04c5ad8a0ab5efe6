package dev.mediasync.service.store;

import dev.mediasync.config.ResilienceConfig;
import dev.mediasync.entity.ContentItem;
import dev.mediasync.entity.MediaAsset;
import dev.mediasync.entity.Subscription;
import dev.mediasync.exception.PersistenceUnavailableException;
import dev.mediasync.repository.ContentItemRepository;
import dev.mediasync.repository.MediaAssetRepository;
import dev.mediasync.repository.SubscriptionRepository;
import io.r2dbc.spi.R2dbcDataIntegrityViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * {@link ContentStore} on Spring Data R2DBC. Every call is bounded by the database timeout and
 * wrapped in the database retry policy; unique-key conflicts on insert are reported as
 * {@code false}, since a concurrent or earlier writer already stored the same row.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class R2dbcContentStore implements ContentStore {

    private final SubscriptionRepository subscriptionRepository;
    private final ContentItemRepository contentItemRepository;
    private final MediaAssetRepository mediaAssetRepository;
    private final DatabaseClient databaseClient;
    private final ResilienceConfig resilience;

    @Override
    public Flux<Subscription> listSubscriptions() {
        return subscriptionRepository.findAllInListingOrder()
                .timeout(resilience.getDatabaseTimeout())
                .retryWhen(resilience.databaseRetry());
    }

    @Override
    public Mono<Boolean> addSubscription(String sourceId, String title) {
        Subscription subscription = Subscription.builder()
                .sourceId(sourceId)
                .title(title)
                .createdAt(LocalDateTime.now(ZoneOffset.UTC))
                .build();
        return insert(subscriptionRepository.save(subscription), "subscription", sourceId);
    }

    @Override
    public Mono<Boolean> removeSubscription(String sourceId) {
        return guarded(subscriptionRepository.deleteBySourceId(sourceId))
                .map(rows -> rows > 0);
    }

    @Override
    public Mono<Boolean> contentItemExists(String externalId) {
        return guarded(contentItemRepository.existsById(externalId));
    }

    @Override
    public Mono<Boolean> insertContentItem(ContentItem item) {
        return insert(contentItemRepository.save(item), "content item", item.getExternalId());
    }

    @Override
    public Mono<Boolean> updateMetrics(String externalId, int score, int commentCount) {
        return guarded(contentItemRepository.updateMetrics(externalId, score, commentCount))
                .map(rows -> rows > 0);
    }

    @Override
    public Mono<Boolean> setContentItemMediaRef(String externalId, String uidFilename) {
        return guarded(contentItemRepository.setMediaUidIfAbsent(externalId, uidFilename))
                .map(rows -> rows > 0)
                .doOnNext(updated -> {
                    if (!updated) {
                        log.debug("Media reference of {} already set or item missing, kept as is", externalId);
                    }
                });
    }

    @Override
    public Flux<ContentItem> listPendingMedia() {
        return contentItemRepository.findPendingMedia()
                .timeout(resilience.getDatabaseTimeout())
                .retryWhen(resilience.databaseRetry());
    }

    @Override
    public Mono<Long> countPendingMedia() {
        return guarded(contentItemRepository.countPendingMedia());
    }

    @Override
    public Flux<ContentItem> listItemsBySource(String sourceId, int limit) {
        return contentItemRepository.findBySourceNewestFirst(sourceId, limit)
                .timeout(resilience.getDatabaseTimeout())
                .retryWhen(resilience.databaseRetry());
    }

    @Override
    public Mono<Boolean> insertMediaAsset(MediaAsset asset) {
        return insert(mediaAssetRepository.save(asset), "media asset", asset.getUidFilename());
    }

    @Override
    public Mono<MediaAsset> findMediaAsset(String uidFilename) {
        return guarded(mediaAssetRepository.findById(uidFilename));
    }

    @Override
    public Mono<Void> verifyAvailable() {
        return databaseClient.sql("SELECT 1")
                .fetch()
                .first()
                .timeout(resilience.getDatabaseTimeout())
                .onErrorMap(e -> new PersistenceUnavailableException("Store did not answer: " + e.getMessage(), e))
                .then();
    }

    private <T> Mono<T> guarded(Mono<T> operation) {
        return operation
                .timeout(resilience.getDatabaseTimeout())
                .retryWhen(resilience.databaseRetry());
    }

    private <T> Mono<Boolean> insert(Mono<T> save, String what, String key) {
        return guarded(save)
                .thenReturn(true)
                .onErrorResume(R2dbcContentStore::isDuplicateKey, e -> {
                    log.debug("Duplicate {} {} ignored", what, key);
                    return Mono.just(false);
                });
    }

    static boolean isDuplicateKey(Throwable error) {
        return error instanceof DataIntegrityViolationException
                || error instanceof R2dbcDataIntegrityViolationException;
    }
}
