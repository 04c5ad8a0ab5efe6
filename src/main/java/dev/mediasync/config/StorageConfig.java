package dev.mediasync.config;

import dev.mediasync.service.storage.LocalMediaStorage;
import dev.mediasync.service.storage.MediaStorage;
import dev.mediasync.util.MediaHosts;
import dev.mediasync.util.MediaUrlNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;

@Configuration(proxyBeanMethods = false)
@Slf4j
public class StorageConfig {

    /**
     * Local filesystem storage for downloaded media. The target directory comes from
     * {@code sync.media-dir} and is created on first use.
     */
    @Bean
    public MediaStorage mediaStorage() {
        log.info("Configuring LOCAL media storage");
        return new LocalMediaStorage();
    }

    /**
     * Locator normalizer. Host names default to the reddit/imgur layout and can be pointed
     * at any platform with the same CDN split.
     */
    @Bean
    public MediaUrlNormalizer mediaUrlNormalizer(
            @Value("${media.hosts.gallery-domain:imgur.com}") String galleryDomain,
            @Value("${media.hosts.gallery-direct-host:i.imgur.com}") String galleryDirectHost,
            @Value("${media.hosts.platform-domains:reddit.com,redd.it}") String[] platformDomains,
            @Value("${media.hosts.raw-video-host:v.redd.it}") String rawVideoHost,
            @Value("${media.hosts.raw-image-host:i.redd.it}") String rawImageHost,
            @Value("${media.hosts.preview-image-host:preview.redd.it}") String previewImageHost) {
        MediaHosts hosts = new MediaHosts(galleryDomain, galleryDirectHost, Arrays.asList(platformDomains),
                rawVideoHost, rawImageHost, previewImageHost);
        log.info("Media URL normalizer configured: {}", hosts);
        return new MediaUrlNormalizer(hosts);
    }
}
