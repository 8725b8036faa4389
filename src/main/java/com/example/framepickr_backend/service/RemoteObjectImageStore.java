package com.example.framepickr_backend.service;

import com.example.framepickr_backend.exception.StorageException;
import com.example.framepickr_backend.service.Interfaces.ImageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Object-storage store using the media upload endpoint
 * ({@code POST /upload/storage/v1/b/{bucket}/o?uploadType=media&name=...}).
 * Locators are absolute URLs of the form {@code <publicBaseUrl>/<bucket>/<name>}.
 */
public class RemoteObjectImageStore implements ImageStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteObjectImageStore.class);

    private final WebClient client;
    private final String bucket;
    private final String publicBaseUrl;
    private final Duration timeout;

    public RemoteObjectImageStore(WebClient client, String bucket, String publicBaseUrl, Duration timeout) {
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("bucket is required for the remote image store");
        }
        this.client = client;
        this.bucket = bucket;
        this.publicBaseUrl = publicBaseUrl.endsWith("/") ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1) : publicBaseUrl;
        this.timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
    }

    @Override
    public String store(byte[] bytes, String storedName, String contentType) {
        if (storedName == null || storedName.isBlank()) {
            throw new StorageException("storedName is blank");
        }
        MediaType type = contentType == null || contentType.isBlank()
                ? MediaType.APPLICATION_OCTET_STREAM
                : MediaType.parseMediaType(contentType);
        try {
            client.post()
                    .uri(b -> b.path("/upload/storage/v1/b/{bucket}/o")
                            .queryParam("uploadType", "media")
                            .queryParam("name", storedName)
                            .build(bucket))
                    .contentType(type)
                    .bodyValue(bytes)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(body -> new StorageException("Object storage error %s for %s: %s"
                                            .formatted(resp.statusCode(), storedName, truncate(body, 300)))))
                    .toBodilessEntity()
                    .block(timeout);
        } catch (StorageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StorageException("Object storage upload failed for " + storedName, e);
        }
        String url = publicBaseUrl + "/" + bucket + "/" + storedName;
        LOGGER.debug("RemoteObjectImageStore stored name={} bytes={} url={}", storedName, bytes.length, url);
        return url;
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
