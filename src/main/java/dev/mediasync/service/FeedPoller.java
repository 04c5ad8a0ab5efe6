package dev.mediasync.service;

import dev.mediasync.config.SyncSettings;
import dev.mediasync.entity.ContentItem;
import dev.mediasync.service.feed.FeedApi;
import dev.mediasync.service.feed.FeedEntry;
import dev.mediasync.service.feed.MediaCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Reads the newest entries of one source and turns them into unsaved {@link ContentItem}s.
 * Entries are emitted in feed order with a fixed pause between them to stay under the
 * source's rate limit.
 */
@Service
@Slf4j
public class FeedPoller {

    private final FeedApi feedApi;
    private final Duration pacing;
    private final Clock clock;

    @Autowired
    public FeedPoller(FeedApi feedApi, SyncSettings settings) {
        this(feedApi, settings.getPollPacing(), Clock.systemUTC());
    }

    FeedPoller(FeedApi feedApi, Duration pacing, Clock clock) {
        this.feedApi = feedApi;
        this.pacing = pacing;
        this.clock = clock;
    }

    /**
     * @param sourceId source to read
     * @param limit    maximum number of items; zero or less yields nothing
     */
    public Flux<ContentItem> poll(String sourceId, int limit) {
        if (limit <= 0) {
            return Flux.empty();
        }
        return feedApi.listRecent(sourceId, limit)
                .take(limit)
                .index()
                .concatMap(indexed -> {
                    ContentItem item = toContentItem(sourceId, indexed.getT2());
                    if (indexed.getT1() == 0 || pacing.isZero()) {
                        return Mono.just(item);
                    }
                    return Mono.delay(pacing).thenReturn(item);
                })
                .doOnComplete(() -> log.debug("Finished polling {}", sourceId));
    }

    ContentItem toContentItem(String sourceId, FeedEntry entry) {
        return ContentItem.builder()
                .externalId(entry.id())
                .sourceId(sourceId)
                .author(entry.author())
                .postedAt(entry.createdAt() == null ? null : LocalDateTime.ofInstant(entry.createdAt(), ZoneOffset.UTC))
                .title(entry.title())
                .body(entry.body())
                .mediaUrl(MediaCandidate.select(entry.mediaCandidates()).orElse(null))
                .score(entry.score())
                .commentCount(entry.commentCount())
                .rawPayload(entry.rawPayload())
                .ingestedAt(LocalDateTime.now(clock))
                .build();
    }
}
