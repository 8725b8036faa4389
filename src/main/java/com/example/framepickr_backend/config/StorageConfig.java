package com.example.framepickr_backend.config;

import com.example.framepickr_backend.service.LocalImageStore;
import com.example.framepickr_backend.service.RemoteObjectImageStore;
import com.example.framepickr_backend.service.Interfaces.ImageStore;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

@EnableConfigurationProperties(StorageProperties.class)
@Configuration
public class StorageConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    public ImageStore imageStore(StorageProperties properties, WebClient.Builder builder) {
        String backend = properties.getBackend() == null ? "local" : properties.getBackend().trim().toLowerCase(Locale.ROOT);
        switch (backend) {
            case "local" -> {
                StorageProperties.Local local = properties.getLocal();
                Path base = Path.of(local.getBaseDir());
                LOGGER.info("Storage wired: backend=local base={}, uploadsPrefix={}, publicPath={}",
                        base, local.getUploadsPrefix(), local.getPublicPath());
                return new LocalImageStore(base, local.getUploadsPrefix(), local.getPublicPath());
            }
            case "remote" -> {
                StorageProperties.Remote remote = properties.getRemote();
                LOGGER.info("Storage wired: backend=remote endpoint={}, bucket={}, publicBaseUrl={}",
                        remote.getEndpoint(), remote.getBucket(), remote.getPublicBaseUrl());
                return new RemoteObjectImageStore(objectStorageWebClient(builder, remote), remote.getBucket(),
                        remote.getPublicBaseUrl(), remote.getTimeout());
            }
            default -> throw new IllegalStateException("Unknown storage.backend: " + properties.getBackend());
        }
    }

    /** Stamps stored names; always UTC. */
    @Bean
    public Clock storageClock() {
        return Clock.systemUTC();
    }

    private static WebClient objectStorageWebClient(WebClient.Builder builder, StorageProperties.Remote remote) {
        Duration timeout = remote.getTimeout() == null ? Duration.ofSeconds(30) : remote.getTimeout();
        HttpClient http = HttpClient.create()
                .compress(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Duration.ofSeconds(5).toMillis())
                .responseTimeout(timeout);

        WebClient.Builder b = builder.clone()
                .baseUrl(remote.getEndpoint())
                .clientConnector(new ReactorClientHttpConnector(http));
        if (remote.getBearerToken() != null && !remote.getBearerToken().isBlank()) {
            b.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + remote.getBearerToken());
        }
        return b.build();
    }
}
