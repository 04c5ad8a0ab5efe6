package dev.mediasync.repository;

import dev.mediasync.entity.ContentItem;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface ContentItemRepository extends R2dbcRepository<ContentItem, String> {

    @Modifying
    @Query("UPDATE content_items SET score = :score, comment_count = :commentCount WHERE external_id = :externalId")
    Mono<Integer> updateMetrics(String externalId, int score, int commentCount);

    /**
     * Sets the media reference only while it is still unset; returns the number of rows changed.
     */
    @Modifying
    @Query("UPDATE content_items SET media_uid = :mediaUid WHERE external_id = :externalId AND media_uid IS NULL")
    Mono<Integer> setMediaUidIfAbsent(String externalId, String mediaUid);

    @Query("SELECT * FROM content_items WHERE media_url IS NOT NULL AND media_url <> '' AND media_uid IS NULL ORDER BY ingested_at, external_id")
    Flux<ContentItem> findPendingMedia();

    @Query("SELECT * FROM content_items WHERE source_id = :sourceId ORDER BY posted_at DESC LIMIT :limit")
    Flux<ContentItem> findBySourceNewestFirst(String sourceId, int limit);

    @Query("SELECT COUNT(*) FROM content_items WHERE media_url IS NOT NULL AND media_url <> '' AND media_uid IS NULL")
    Mono<Long> countPendingMedia();
}
