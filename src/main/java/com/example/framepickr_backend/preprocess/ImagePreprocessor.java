package com.example.framepickr_backend.preprocess;

import com.example.framepickr_backend.config.PreprocessProperties;
import com.example.framepickr_backend.model.ImageCandidate;
import com.example.framepickr_backend.model.NormalizedImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.spi.ImageReaderSpi;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;

/**
 * Decodes uploads, turns them upright according to their EXIF orientation and shrinks oversized
 * ones before scoring. This is the only place images are resized; whatever it returns is both
 * what gets scored and what gets persisted.
 */
@Component
public class ImagePreprocessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImagePreprocessor.class);
    private static final String JPEG_TYPE = "image/jpeg";
    private static final String JPEG_EXT = ".jpg";

    private final PreprocessProperties props;

    public ImagePreprocessor(PreprocessProperties props) {
        this.props = props;
    }

    public PreprocessResult normalize(ImageCandidate candidate) {
        byte[] raw = candidate.payload();
        if (raw.length == 0) {
            LOGGER.debug("Preprocess rejected empty payload index={} file={}", candidate.index(), candidate.filename());
            return PreprocessResult.failed(PreprocessResult.Failure.EMPTY_PAYLOAD);
        }

        Decoded decoded;
        try {
            decoded = decode(raw);
        } catch (IOException | RuntimeException e) {
            LOGGER.debug("Preprocess decode error index={} file={} cause={}", candidate.index(), candidate.filename(), e.toString());
            decoded = null;
        }
        if (decoded == null) {
            LOGGER.info("Preprocess cannot decode index={} file={} size={}", candidate.index(), candidate.filename(), raw.length);
            return PreprocessResult.failed(PreprocessResult.Failure.CANNOT_DECODE);
        }

        BufferedImage rgb = toRgb(decoded.image());
        int orientation = ExifOrientation.read(raw);
        if (orientation != ExifOrientation.NORMAL) {
            // rotated pixels are always re-encoded
            rgb = ExifOrientation.apply(rgb, orientation);
            LOGGER.debug("Preprocess applied EXIF orientation={} index={} file={} size={}x{}",
                    orientation, candidate.index(), candidate.filename(), rgb.getWidth(), rgb.getHeight());
        } else if (raw.length <= props.getSizeThresholdBytes()) {
            return PreprocessResult.ok(new NormalizedImage(rgb, raw, decoded.mimeType(), decoded.extension(), false));
        }

        try {
            return PreprocessResult.ok(shrink(candidate, rgb, raw.length));
        } catch (IOException e) {
            LOGGER.warn("Preprocess re-encode failed index={} file={}", candidate.index(), candidate.filename(), e);
            return PreprocessResult.failed(PreprocessResult.Failure.CANNOT_ENCODE);
        }
    }

    private NormalizedImage shrink(ImageCandidate candidate, BufferedImage rgb, int originalSize) throws IOException {
        BufferedImage scaled = fitWithin(rgb, props.getMaxDimension());
        float quality = props.getStartQuality();
        byte[] encoded = encodeJpeg(scaled, quality);

        while (encoded.length > props.getTargetBytes() && quality > props.getMinQuality() + 1e-4f) {
            quality = roundQuality(Math.max(props.getMinQuality(), quality - props.getQualityStep()));
            encoded = encodeJpeg(scaled, quality);
        }

        if (encoded.length > props.getTargetBytes()) {
            // best effort: one more geometric step, then accept the result
            scaled = scale(scaled, props.getFallbackScale());
            encoded = encodeJpeg(scaled, quality);
        }

        LOGGER.debug("Preprocess resized index={} file={} from={}B to={}B size={}x{} quality={}",
                candidate.index(), candidate.filename(), originalSize, encoded.length,
                scaled.getWidth(), scaled.getHeight(), String.format(Locale.ROOT, "%.2f", quality));
        return new NormalizedImage(scaled, encoded, JPEG_TYPE, JPEG_EXT, true);
    }

    private static Decoded decode(byte[] raw) throws IOException {
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(raw))) {
            if (in == null) {
                return null;
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                return null;
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                BufferedImage image = reader.read(0);
                if (image == null || image.getWidth() <= 0 || image.getHeight() <= 0) {
                    return null;
                }
                ImageReaderSpi spi = reader.getOriginatingProvider();
                String mime = firstOr(spi == null ? null : spi.getMIMETypes(), JPEG_TYPE);
                String suffix = firstOr(spi == null ? null : spi.getFileSuffixes(), "jpg");
                return new Decoded(image, mime, "." + suffix.toLowerCase(Locale.ROOT));
            } finally {
                reader.dispose();
            }
        }
    }

    static BufferedImage fitWithin(BufferedImage src, int maxDimension) {
        int longer = Math.max(src.getWidth(), src.getHeight());
        if (maxDimension <= 0 || longer <= maxDimension) {
            return src;
        }
        return scale(src, maxDimension / (double) longer);
    }

    static BufferedImage scale(BufferedImage src, double factor) {
        int w = Math.max(1, (int) Math.round(src.getWidth() * factor));
        int h = Math.max(1, (int) Math.round(src.getHeight() * factor));
        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(src, 0, 0, w, h, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    private static BufferedImage toRgb(BufferedImage src) {
        if (src.getType() == BufferedImage.TYPE_INT_RGB) {
            return src;
        }
        BufferedImage out = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.drawImage(src, 0, 0, Color.WHITE, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    static byte[] encodeJpeg(BufferedImage image, float quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ImageWriteParam param = writer.getDefaultWriteParam();
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        param.setCompressionQuality(Math.max(0f, Math.min(1f, quality)));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }

    private static float roundQuality(float q) {
        return Math.round(q * 100f) / 100f;
    }

    private static String firstOr(String[] values, String fallback) {
        return values == null || values.length == 0 || values[0] == null ? fallback : values[0];
    }

    private record Decoded(BufferedImage image, String mimeType, String extension) {
    }
}
