package dev.mediasync.util;

import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Optional;

/**
 * Turns a raw media locator taken from a feed entry into a URL that can be fetched directly.
 * <p>
 * Pure and idempotent: {@code normalize(normalize(u)).equals(normalize(u))}. An empty result
 * means there is nothing to download. Rules are tried in order and the first match wins:
 * </p>
 * <ol>
 *   <li>gallery host without an image suffix: rewritten to the direct image of the trailing id</li>
 *   <li>platform raw-video CDN: unchanged, the downloader sniffs the content</li>
 *   <li>platform raw-image CDN: query stripped</li>
 *   <li>platform preview CDN: entities decoded, host moved to the raw-image CDN, then rule 3</li>
 *   <li>platform link with a {@code /media/} segment: raw-image CDN URL of the trailing id</li>
 *   <li>anything else: query stripped when the path ends in a media suffix, otherwise unchanged</li>
 * </ol>
 */
public class MediaUrlNormalizer {

    private static final String DEFAULT_SCHEME = "https";

    private final MediaHosts hosts;

    public MediaUrlNormalizer(MediaHosts hosts) {
        this.hosts = hosts;
    }

    public Optional<String> normalize(String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            return Optional.empty();
        }
        String url = rawUrl.trim();
        try {
            return Optional.of(applyRules(url));
        } catch (IllegalArgumentException | IllegalStateException e) {
            // Unparseable locators (bad port, broken escapes) go to the downloader unchanged
            return Optional.of(url);
        }
    }

    private String applyRules(String url) {
        UriComponents uri = UriComponentsBuilder.fromUriString(url).build();
        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            return url;
        }
        String path = uri.getPath() == null ? "" : uri.getPath();

        if (MediaHosts.matches(host, hosts.galleryDomain()) && !MediaFileTypes.hasImageSuffix(path)) {
            return galleryImage(url, path);
        }
        if (host.equalsIgnoreCase(hosts.rawVideoHost())) {
            return url;
        }
        if (host.equalsIgnoreCase(hosts.rawImageHost())) {
            return withoutQuery(uri);
        }
        if (host.equalsIgnoreCase(hosts.previewImageHost())) {
            return previewToRaw(url);
        }
        if (isPlatformHost(host) && path.contains("/media/")) {
            String mediaId = lastSegment(path);
            return mediaId == null ? url : DEFAULT_SCHEME + "://" + hosts.rawImageHost() + "/" + mediaId;
        }
        if (MediaFileTypes.hasMediaSuffix(path)) {
            return withoutQuery(uri);
        }
        return url;
    }

    /**
     * Albums ({@code /a/id}, {@code /gallery/id}) and single images ({@code /id}) both end in the
     * id of the image to fetch; for an album that is the id of its first image.
     */
    private String galleryImage(String url, String path) {
        String id = lastSegment(path);
        if (id == null) {
            return url;
        }
        int dot = id.indexOf('.');
        if (dot > 0) {
            id = id.substring(0, dot);
        }
        return DEFAULT_SCHEME + "://" + hosts.galleryDirectHost() + "/" + id + ".jpg";
    }

    private String previewToRaw(String url) {
        String decoded = url.replace("&amp;", "&");
        UriComponents preview = UriComponentsBuilder.fromUriString(decoded).build();
        UriComponents raw = UriComponentsBuilder.newInstance()
                .scheme(preview.getScheme() == null ? DEFAULT_SCHEME : preview.getScheme())
                .host(hosts.rawImageHost())
                .path(preview.getPath())
                .build();
        // The raw-image rule drops sizing parameters along with the rest of the query.
        return withoutQuery(raw);
    }

    private boolean isPlatformHost(String host) {
        List<String> domains = hosts.platformDomains();
        for (String domain : domains) {
            if (MediaHosts.matches(host, domain)) {
                return true;
            }
        }
        return false;
    }

    private static String withoutQuery(UriComponents uri) {
        StringBuilder sb = new StringBuilder();
        sb.append(uri.getScheme() == null ? DEFAULT_SCHEME : uri.getScheme())
                .append("://")
                .append(uri.getHost());
        if (uri.getPort() != -1) {
            sb.append(':').append(uri.getPort());
        }
        if (uri.getPath() != null) {
            sb.append(uri.getPath());
        }
        return sb.toString();
    }

    private static String lastSegment(String path) {
        String[] segments = path.split("/");
        for (int i = segments.length - 1; i >= 0; i--) {
            if (!segments[i].isEmpty()) {
                return segments[i];
            }
        }
        return null;
    }
}
