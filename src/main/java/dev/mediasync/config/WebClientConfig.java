package dev.mediasync.config;

import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Shared transport for the feed client and the media downloader: redirects are followed and
 * every attempt is bounded by the connect and response timeouts.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class WebClientConfig {

    @Bean
    public WebClient.Builder webClientBuilder(
            @Value("${http.connect-timeout-ms:10000}") int connectTimeoutMs,
            @Value("${http.response-timeout-seconds:30}") int responseTimeoutSeconds,
            @Value("${http.user-agent:feed-media-sync/0.1}") String userAgent) {
        HttpClient httpClient = HttpClient.create()
                .followRedirect(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                .responseTimeout(Duration.ofSeconds(responseTimeoutSeconds));
        log.info("HTTP transport configured (connectTimeout={}ms, responseTimeout={}s)",
                connectTimeoutMs, responseTimeoutSeconds);
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent);
    }
}
