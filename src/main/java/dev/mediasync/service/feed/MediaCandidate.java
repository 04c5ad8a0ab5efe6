package dev.mediasync.service.feed;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * A place a feed entry may keep its media. An entry can offer several; the one with the lowest
 * {@link #priority()} that yields a locator wins.
 */
public sealed interface MediaCandidate {

    int priority();

    Optional<String> locator();

    /**
     * Picks the locator of the best candidate, or empty when none has one.
     */
    static Optional<String> select(List<MediaCandidate> candidates) {
        return candidates.stream()
                .sorted(Comparator.comparingInt(MediaCandidate::priority))
                .map(MediaCandidate::locator)
                .flatMap(Optional::stream)
                .findFirst();
    }

    private static Optional<String> nonBlank(String url) {
        return url == null || url.isBlank() ? Optional.empty() : Optional.of(url.trim());
    }

    /** Image resolution listed for a gallery item. */
    record GalleryImage(String url, int width) {
    }

    /** Gallery post: the widest listed resolution is used. */
    record GalleryImages(List<GalleryImage> images) implements MediaCandidate {

        public GalleryImages {
            images = images == null ? List.of() : List.copyOf(images);
        }

        @Override
        public int priority() {
            return 0;
        }

        @Override
        public Optional<String> locator() {
            return images.stream()
                    .filter(image -> image.url() != null && !image.url().isBlank())
                    .max(Comparator.comparingInt(GalleryImage::width))
                    .flatMap(image -> nonBlank(image.url()));
        }
    }

    /** Platform-hosted video, progressive fallback stream. */
    record VideoFallback(String url) implements MediaCandidate {

        @Override
        public int priority() {
            return 1;
        }

        @Override
        public Optional<String> locator() {
            return nonBlank(url);
        }
    }

    /** Source image of the platform preview. */
    record PreviewImage(String url) implements MediaCandidate {

        @Override
        public int priority() {
            return 2;
        }

        @Override
        public Optional<String> locator() {
            return nonBlank(url);
        }
    }

    /** Link target the submitter pointed the entry at. */
    record OverrideUrl(String url) implements MediaCandidate {

        @Override
        public int priority() {
            return 3;
        }

        @Override
        public Optional<String> locator() {
            return nonBlank(url);
        }
    }

    record PlainUrl(String url) implements MediaCandidate {

        @Override
        public int priority() {
            return 4;
        }

        @Override
        public Optional<String> locator() {
            return nonBlank(url);
        }
    }
}
