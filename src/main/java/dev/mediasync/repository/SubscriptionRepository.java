package dev.mediasync.repository;

import dev.mediasync.entity.Subscription;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface SubscriptionRepository extends R2dbcRepository<Subscription, String> {

    @Query("SELECT * FROM subscriptions ORDER BY created_at, source_id")
    Flux<Subscription> findAllInListingOrder();

    @Modifying
    @Query("DELETE FROM subscriptions WHERE source_id = :sourceId")
    Mono<Integer> deleteBySourceId(String sourceId);
}
