package dev.mediasync.service.feed;

import java.time.Instant;
import java.util.List;

/**
 * One entry as returned by a {@link FeedApi}, before it becomes a content item.
 *
 * @param rawPayload the entry exactly as the source sent it, stored verbatim
 */
public record FeedEntry(
        String id,
        String author,
        Instant createdAt,
        String title,
        String body,
        List<MediaCandidate> mediaCandidates,
        int score,
        int commentCount,
        String rawPayload) {

    public FeedEntry {
        mediaCandidates = mediaCandidates == null ? List.of() : List.copyOf(mediaCandidates);
    }
}
