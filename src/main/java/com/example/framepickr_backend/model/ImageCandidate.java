package com.example.framepickr_backend.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * One uploaded photo as received from the caller.
 *
 * @param index       position in the submitted batch; identity and ranking tie-breaker.
 * @param filename    original filename as sent by the client.
 * @param contentType declared content type, may be {@code null}.
 * @param payload     raw bytes of the upload.
 */
public record ImageCandidate(int index, String filename, String contentType, byte[] payload) {

    public ImageCandidate {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
        filename = (filename == null || filename.isBlank()) ? "image-" + index : filename;
        payload = payload == null ? new byte[0] : Arrays.copyOf(payload, payload.length);
    }

    @Override
    public byte[] payload() {
        return Arrays.copyOf(payload, payload.length);
    }

    public int sizeBytes() {
        return payload.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImageCandidate that)) return false;
        return index == that.index
                && Objects.equals(filename, that.filename)
                && Objects.equals(contentType, that.contentType)
                && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(index, filename, contentType);
        return 31 * result + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "ImageCandidate[index=" + index + ", filename=" + filename + ", contentType=" + contentType
                + ", size=" + payload.length + "]";
    }
}
