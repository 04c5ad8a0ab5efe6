package dev.mediasync.service;

import dev.mediasync.entity.Subscription;
import dev.mediasync.service.store.ContentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Operator-facing subscription management. Source ids are stored trimmed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SubscriptionService {

    private final ContentStore contentStore;

    public Flux<Subscription> list() {
        return contentStore.listSubscriptions();
    }

    /**
     * @return true if created, false if the source was already subscribed
     */
    public Mono<Boolean> subscribe(String sourceId, String title) {
        String id = normalize(sourceId);
        if (id.isEmpty()) {
            return Mono.error(new IllegalArgumentException("Source id is required"));
        }
        String displayTitle = title == null || title.isBlank() ? id : title.trim();
        return contentStore.addSubscription(id, displayTitle)
                .doOnNext(created -> {
                    if (created) {
                        log.info("Subscribed to {}", id);
                    } else {
                        log.debug("Already subscribed to {}", id);
                    }
                });
    }

    public Mono<Boolean> unsubscribe(String sourceId) {
        String id = normalize(sourceId);
        return contentStore.removeSubscription(id)
                .doOnNext(removed -> {
                    if (removed) {
                        log.info("Unsubscribed from {}", id);
                    }
                });
    }

    /**
     * Makes sure each configured default source is subscribed.
     *
     * @return number of subscriptions created
     */
    public Mono<Long> seedDefaults(List<String> sourceIds) {
        return Flux.fromIterable(sourceIds)
                .concatMap(sourceId -> subscribe(sourceId, null))
                .filter(Boolean::booleanValue)
                .count()
                .doOnNext(created -> {
                    if (created > 0) {
                        log.info("Seeded {} default subscription(s)", created);
                    }
                });
    }

    static String normalize(String sourceId) {
        return sourceId == null ? "" : sourceId.trim();
    }
}
