package com.example.framepickr_backend.service;

import com.example.framepickr_backend.exception.StorageException;
import com.example.framepickr_backend.service.Interfaces.ImageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * Filesystem store: {@code <baseDir>/<uploadsPrefix>/<name>}, served back as {@code <publicPath>/<name>}.
 */
public class LocalImageStore implements ImageStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalImageStore.class);

    private final Path uploadsDir;
    private final String publicPath;

    public LocalImageStore(Path baseDir, String uploadsPrefix, String publicPath) {
        Path base = baseDir.toAbsolutePath().normalize();
        this.uploadsDir = base.resolve(uploadsPrefix == null ? "" : uploadsPrefix).normalize();
        this.publicPath = trimTrailingSlash(publicPath == null || publicPath.isBlank() ? "/uploads" : publicPath);
        try {
            Files.createDirectories(uploadsDir);
            LOGGER.info("LocalImageStore ready. uploads={}, publicPath={}", uploadsDir, this.publicPath);
        } catch (IOException e) {
            throw new StorageException("Cannot create uploads directory " + uploadsDir, e);
        }
    }

    @Override
    public String store(byte[] bytes, String storedName, String contentType) {
        Path target = safeResolve(storedName);
        try {
            Files.createDirectories(target.getParent());
            // never overwrite an earlier upload
            Files.write(target, bytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new StorageException("Write failed to " + target, e);
        }
        LOGGER.debug("LocalImageStore stored name={} bytes={}", storedName, bytes.length);
        return publicPath + "/" + uploadsDir.relativize(target).toString().replace('\\', '/');
    }

    @Override
    public Optional<Path> resolve(String storedName) {
        Path p = safeResolve(storedName);
        return Files.isRegularFile(p) ? Optional.of(p) : Optional.empty();
    }

    public Path root() {
        return uploadsDir;
    }

    private Path safeResolve(String storedName) {
        if (storedName == null || storedName.isBlank()) {
            throw new StorageException("storedName is blank");
        }
        String normalizedKey = storedName.replace('\\', '/').replaceAll("^/+", "");
        Path p = uploadsDir.resolve(normalizedKey).normalize();
        if (!p.startsWith(uploadsDir) || p.equals(uploadsDir)) {
            throw new StorageException("Invalid storedName (path traversal?): " + storedName);
        }
        return p;
    }

    private static String trimTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
