package dev.mediasync.service.feed;

import reactor.core.publisher.Flux;

/**
 * Remote feed source. Implementations must emit at most {@code limit} entries, newest first,
 * and signal {@link dev.mediasync.exception.SourceUnavailableException} when the source cannot
 * be read.
 */
public interface FeedApi {

    Flux<FeedEntry> listRecent(String sourceId, int limit);
}
