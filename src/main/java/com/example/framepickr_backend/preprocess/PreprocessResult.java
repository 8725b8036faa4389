package com.example.framepickr_backend.preprocess;

import com.example.framepickr_backend.model.NormalizedImage;

/**
 * Either a normalized image or the reason it could not be produced. Never both.
 *
 * @param image   normalized image when decoding succeeded.
 * @param failure typed failure when it did not.
 */
public record PreprocessResult(NormalizedImage image, Failure failure) {

    /**
     * Ways preprocessing can fail for a single upload.
     */
    public enum Failure {
        EMPTY_PAYLOAD("empty_payload"),
        CANNOT_DECODE("cannot_decode_image"),
        CANNOT_ENCODE("cannot_encode_image");

        private final String reason;

        Failure(String reason) {
            this.reason = reason;
        }

        public String reason() {
            return reason;
        }
    }

    public static PreprocessResult ok(NormalizedImage image) {
        return new PreprocessResult(image, null);
    }

    public static PreprocessResult failed(Failure failure) {
        return new PreprocessResult(null, failure);
    }

    public boolean isOk() {
        return image != null;
    }

    public boolean transformed() {
        return image != null && image.transformed();
    }
}
