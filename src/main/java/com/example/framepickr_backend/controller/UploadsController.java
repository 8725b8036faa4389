package com.example.framepickr_backend.controller;

import com.example.framepickr_backend.exception.StorageException;
import com.example.framepickr_backend.service.Interfaces.ImageStore;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Serves images written by the local store under the relative locators it hands out.
 */
@RestController
public class UploadsController {

    private final ImageStore store;

    public UploadsController(ImageStore store) {
        this.store = store;
    }

    @GetMapping(value = "${storage.local.public-path:/uploads}/{name}", produces = MediaType.ALL_VALUE)
    public ResponseEntity<Resource> get(@PathVariable("name") String name) {
        Path file;
        try {
            file = store.resolve(name)
                    .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "IMAGE_NOT_FOUND"));
        } catch (StorageException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_NAME", e);
        }
        MediaType type = MediaTypeFactory.getMediaType(file.getFileName().toString())
                .orElse(MediaType.APPLICATION_OCTET_STREAM);
        // stored names are unique and never rewritten
        return ResponseEntity.ok()
                .contentType(type)
                .cacheControl(CacheControl.maxAge(365, TimeUnit.DAYS).cachePublic().immutable())
                .body(new FileSystemResource(file));
    }
}
