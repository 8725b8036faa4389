package com.example.framepickr_backend.service;

import com.example.framepickr_backend.model.NormalizedImage;
import com.example.framepickr_backend.model.PersistOutcome;
import com.example.framepickr_backend.model.ScoredCandidate;
import com.example.framepickr_backend.service.Interfaces.ImageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Writes the selected images to the configured {@link ImageStore}. Each item gets a unique name,
 * so concurrent writes never target the same key; one failed write does not stop the others.
 */
@Service
public class ImagePersister {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImagePersister.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS").withZone(ZoneOffset.UTC);
    private static final int MAX_BASE_LENGTH = 60;
    private static final String DEFAULT_EXT = ".jpg";

    private final ImageStore store;
    private final Executor executor;
    private final Clock clock;

    public ImagePersister(ImageStore store, @Qualifier("persistTaskExecutor") Executor executor, Clock clock) {
        this.store = store;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * @param selected ranked selection; only OK candidates with an image are written.
     * @return outcome per candidate index, in selection order.
     */
    public Map<Integer, PersistOutcome> persist(List<ScoredCandidate> selected) {
        Map<Integer, CompletableFuture<PersistOutcome>> pending = new LinkedHashMap<>();
        for (ScoredCandidate candidate : selected) {
            if (candidate == null || !candidate.isOk() || candidate.image() == null) {
                continue;
            }
            pending.put(candidate.index(), CompletableFuture.supplyAsync(() -> persistOne(candidate), executor));
        }

        Map<Integer, PersistOutcome> outcomes = new LinkedHashMap<>();
        pending.forEach((index, future) -> outcomes.put(index, await(index, future)));
        return outcomes;
    }

    PersistOutcome persistOne(ScoredCandidate candidate) {
        NormalizedImage image = candidate.image();
        String name = storageName(candidate.filename(), extensionFor(image));
        try {
            String locator = store.store(image.encoded(), name, image.contentType());
            LOGGER.info("Persist stored index={} file={} as={} locator={}", candidate.index(), candidate.filename(), name, locator);
            return PersistOutcome.stored(name, locator);
        } catch (RuntimeException e) {
            LOGGER.warn("Persist failed index={} file={} as={} cause={}", candidate.index(), candidate.filename(), name, e.toString());
            return PersistOutcome.failed(name, e.getMessage());
        }
    }

    /**
     * Builds {@code <base>-<utc timestamp>-<random>.<ext>} from the original filename.
     */
    String storageName(String originalFilename, String extension) {
        String base = baseName(originalFilename)
                .replaceAll("[^A-Za-z0-9._-]", "_")
                .replaceAll("^[._-]+", "");
        if (base.length() > MAX_BASE_LENGTH) {
            base = base.substring(0, MAX_BASE_LENGTH);
        }
        if (base.isBlank()) {
            base = "image";
        }
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        return base + "-" + STAMP.format(clock.instant()) + "-" + random + extension;
    }

    /**
     * Extension of the bytes actually written: the decoded format, never the client's filename.
     */
    private static String extensionFor(NormalizedImage image) {
        String ext = image.fileExtension();
        return ext == null || ext.isBlank() ? DEFAULT_EXT : ext;
    }

    private static String baseName(String filename) {
        if (filename == null) {
            return "";
        }
        String name = filename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static PersistOutcome await(int index, CompletableFuture<PersistOutcome> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOGGER.warn("Persist task failed index={} cause={}", index, cause.toString());
            return PersistOutcome.failed(null, cause.getMessage());
        }
    }
}
