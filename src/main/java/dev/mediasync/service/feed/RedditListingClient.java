package dev.mediasync.service.feed;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mediasync.exception.SourceUnavailableException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * {@link FeedApi} backed by the public Reddit JSON listing of a subreddit's newest posts.
 * <p>
 * Listings are capped at 100 children per request, so larger limits follow the {@code after}
 * cursor. An access token, when configured, is sent as a bearer token; acquiring or refreshing
 * it is left to the operator.
 * </p>
 */
@Service
@Slf4j
public class RedditListingClient implements FeedApi {

    static final int PAGE_SIZE = 100;

    private final WebClient webClient;
    private final CircuitBreaker circuitBreaker;

    public RedditListingClient(
            WebClient.Builder webClientBuilder,
            @Value("${feed.reddit.base-url:https://www.reddit.com}") String baseUrl,
            @Value("${feed.reddit.access-token:}") String accessToken) {
        WebClient.Builder builder = webClientBuilder.clone()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (accessToken != null && !accessToken.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken);
        }
        this.webClient = builder.build();

        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .build();
        this.circuitBreaker = CircuitBreaker.of("reddit-listing", cbConfig);
        log.info("Reddit listing client initialised (baseUrl={}, authenticated={})",
                baseUrl, accessToken != null && !accessToken.isBlank());
    }

    @Override
    public Flux<FeedEntry> listRecent(String sourceId, int limit) {
        if (limit <= 0) {
            return Flux.empty();
        }
        return fetchPage(sourceId, null, limit, 0)
                .expand(page -> page.hasMore(limit)
                        ? fetchPage(sourceId, page.after(), limit, page.fetchedSoFar())
                        : Mono.empty())
                .concatMapIterable(Page::entries)
                .take(limit);
    }

    private Mono<Page> fetchPage(String sourceId, String after, int limit, int fetchedSoFar) {
        int pageSize = Math.min(PAGE_SIZE, limit - fetchedSoFar);
        return webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path("/r/{source}/new.json")
                            .queryParam("limit", pageSize)
                            .queryParam("raw_json", 1);
                    if (after != null) {
                        uriBuilder.queryParam("after", after);
                    }
                    return uriBuilder.build(sourceId);
                })
                .retrieve()
                .bodyToMono(JsonNode.class)
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .map(listing -> parsePage(listing, fetchedSoFar))
                .doOnNext(page -> log.debug("Fetched {} entries from r/{} (after={})", page.entries().size(), sourceId, after))
                .onErrorMap(e -> !(e instanceof SourceUnavailableException),
                        e -> new SourceUnavailableException(sourceId, "Listing request failed: " + e.getMessage(), e));
    }

    private Page parsePage(JsonNode listing, int fetchedSoFar) {
        JsonNode data = listing.path("data");
        List<FeedEntry> entries = new ArrayList<>();
        for (JsonNode child : data.path("children")) {
            if ("t3".equals(child.path("kind").asText())) {
                entries.add(toEntry(child.path("data")));
            }
        }
        String after = data.path("after").isTextual() ? data.path("after").asText() : null;
        return new Page(entries, after, fetchedSoFar + entries.size());
    }

    static FeedEntry toEntry(JsonNode post) {
        return new FeedEntry(
                post.path("id").asText(),
                post.path("author").asText(null),
                Instant.ofEpochSecond(post.path("created_utc").asLong()),
                post.path("title").asText(null),
                post.path("selftext").asText(""),
                mediaCandidates(post),
                post.path("score").asInt(0),
                post.path("num_comments").asInt(0),
                post.toString());
    }

    static List<MediaCandidate> mediaCandidates(JsonNode post) {
        List<MediaCandidate> candidates = new ArrayList<>();
        if (post.path("is_gallery").asBoolean(false)) {
            galleryImages(post.path("media_metadata")).ifPresent(candidates::add);
        }
        if (post.path("is_video").asBoolean(false)) {
            JsonNode video = post.path("secure_media").path("reddit_video");
            if (video.hasNonNull("fallback_url")) {
                candidates.add(new MediaCandidate.VideoFallback(video.get("fallback_url").asText()));
            }
        }
        JsonNode previewSource = post.path("preview").path("images").path(0).path("source");
        if (previewSource.hasNonNull("url")) {
            candidates.add(new MediaCandidate.PreviewImage(previewSource.get("url").asText()));
        }
        if (post.hasNonNull("url_overridden_by_dest")) {
            candidates.add(new MediaCandidate.OverrideUrl(post.get("url_overridden_by_dest").asText()));
        }
        // A text post's url is its own permalink
        if (post.hasNonNull("url") && !post.path("is_self").asBoolean(false)) {
            candidates.add(new MediaCandidate.PlainUrl(post.get("url").asText()));
        }
        return candidates;
    }

    /**
     * First gallery item that lists any resolution; {@code p} holds the previews and {@code s}
     * the source image.
     */
    private static Optional<MediaCandidate> galleryImages(JsonNode mediaMetadata) {
        Iterator<JsonNode> items = mediaMetadata.elements();
        while (items.hasNext()) {
            JsonNode item = items.next();
            List<MediaCandidate.GalleryImage> images = new ArrayList<>();
            for (JsonNode resolution : item.path("p")) {
                addImage(images, resolution);
            }
            addImage(images, item.path("s"));
            if (!images.isEmpty()) {
                return Optional.of(new MediaCandidate.GalleryImages(images));
            }
        }
        return Optional.empty();
    }

    private static void addImage(List<MediaCandidate.GalleryImage> images, JsonNode resolution) {
        if (resolution.hasNonNull("u")) {
            images.add(new MediaCandidate.GalleryImage(resolution.get("u").asText(), resolution.path("x").asInt(0)));
        }
    }

    private record Page(List<FeedEntry> entries, String after, int fetchedSoFar) {

        boolean hasMore(int limit) {
            return after != null && !entries.isEmpty() && fetchedSoFar < limit;
        }
    }
}
