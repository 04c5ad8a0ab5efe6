package dev.mediasync.util;

import org.springframework.web.util.UriComponentsBuilder;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File extension rules shared by the URL normalizer and the downloader.
 */
public final class MediaFileTypes {

    public static final String GENERIC_EXTENSION = "bin";

    private static final Pattern MEDIA_SUFFIX = Pattern.compile("\\.(jpg|jpeg|png|gif|mp4|webm|webp)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern IMAGE_SUFFIX = Pattern.compile("\\.(jpg|jpeg|png|gif)$", Pattern.CASE_INSENSITIVE);

    private static final Map<String, String> EXTENSION_BY_CONTENT_TYPE = Map.of(
            "image/jpeg", "jpg",
            "image/png", "png",
            "image/gif", "gif",
            "image/webp", "webp",
            "video/mp4", "mp4",
            "video/webm", "webm"
    );

    private MediaFileTypes() {}

    /**
     * Extension for a downloaded file: the media suffix of the URL path if there is one,
     * otherwise the content-type mapping, otherwise {@value #GENERIC_EXTENSION}.
     */
    public static String extensionFor(String url, String contentType) {
        String path = pathOf(url);
        if (path != null) {
            Matcher matcher = MEDIA_SUFFIX.matcher(path);
            if (matcher.find()) {
                return matcher.group(1).toLowerCase(Locale.ROOT);
            }
        }
        if (contentType != null) {
            String bare = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
            return EXTENSION_BY_CONTENT_TYPE.getOrDefault(bare, GENERIC_EXTENSION);
        }
        return GENERIC_EXTENSION;
    }

    public static boolean hasMediaSuffix(String path) {
        return path != null && MEDIA_SUFFIX.matcher(path).find();
    }

    public static boolean hasImageSuffix(String path) {
        return path != null && IMAGE_SUFFIX.matcher(path).find();
    }

    private static String pathOf(String url) {
        if (url == null) {
            return null;
        }
        try {
            return UriComponentsBuilder.fromUriString(url).build().getPath();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
