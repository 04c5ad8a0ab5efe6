package dev.mediasync.util;

import java.util.List;
import java.util.Locale;

/**
 * Host names the URL normalizer recognises. Defaults describe the feed platform the sync
 * mirrors by default (reddit) and the image host most often linked from it (imgur).
 *
 * @param galleryDomain        image-gallery hosting domain, matched with its subdomains
 * @param galleryDirectHost    host serving gallery images directly
 * @param platformDomains      domains of the feed platform itself
 * @param rawVideoHost         platform CDN serving raw video
 * @param rawImageHost         platform CDN serving raw images
 * @param previewImageHost     platform CDN serving resized previews
 */
public record MediaHosts(
        String galleryDomain,
        String galleryDirectHost,
        List<String> platformDomains,
        String rawVideoHost,
        String rawImageHost,
        String previewImageHost) {

    public MediaHosts {
        platformDomains = platformDomains == null ? List.of() : List.copyOf(platformDomains);
    }

    public static MediaHosts defaults() {
        return new MediaHosts(
                "imgur.com",
                "i.imgur.com",
                List.of("reddit.com", "redd.it"),
                "v.redd.it",
                "i.redd.it",
                "preview.redd.it");
    }

    /**
     * True when {@code host} is {@code domain} itself or one of its subdomains.
     */
    static boolean matches(String host, String domain) {
        if (host == null || domain == null || domain.isEmpty()) {
            return false;
        }
        String h = host.toLowerCase(Locale.ROOT);
        String d = domain.toLowerCase(Locale.ROOT);
        return h.equals(d) || h.endsWith("." + d);
    }
}
