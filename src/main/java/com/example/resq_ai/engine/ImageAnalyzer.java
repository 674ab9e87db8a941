package com.example.resq_ai.engine;

import com.example.resq_ai.dto.DecodedImage;
import com.example.resq_ai.dto.Detection;
import com.example.resq_ai.dto.RawMedia;
import com.example.resq_ai.engine.Interfaces.Detector;
import com.example.resq_ai.engine.Interfaces.MediaAnalyzer;
import com.example.resq_ai.exception.DetectionException;
import com.example.resq_ai.util.MediaKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decodes still images with ImageIO and hands them to the configured {@link Detector}.
 */
public class ImageAnalyzer implements MediaAnalyzer<DecodedImage> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImageAnalyzer.class);
    static final String WIDTH_METADATA = "width";
    static final String HEIGHT_METADATA = "height";

    private final Detector detector;

    public ImageAnalyzer(Detector detector) {
        this.detector = detector;
    }

    @Override
    public boolean supports(String contentType) {
        return MediaKind.IMAGE.matches(contentType);
    }

    @Override
    public DecodedImage decode(RawMedia media) {
        byte[] bytes = media.bytes();
        if (bytes.length == 0) {
            throw DetectionException.invalidImage("Empty payload for " + media.source());
        }

        BufferedImage image;
        String format;
        try (ImageInputStream iis = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            Iterator<ImageReader> readers = iis == null ? null : ImageIO.getImageReaders(iis);
            if (readers == null || !readers.hasNext()) {
                throw DetectionException.invalidImage("Undecodable image data for " + media.source() + " contentType=" + media.contentType());
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(iis, true, true);
                format = reader.getFormatName().toUpperCase(Locale.ROOT);
                image = reader.read(0);
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            if (e instanceof DetectionException de) throw de;
            throw DetectionException.invalidImage("Undecodable image data for " + media.source() + ": " + e.getMessage(), e);
        }

        if (image == null || image.getWidth() < 1 || image.getHeight() < 1) {
            throw DetectionException.invalidImage("Image has no pixels: " + media.source());
        }

        verifyDeclaredDimensions(media, image);
        DecodedImage decoded = new DecodedImage(image, image.getWidth(), image.getHeight(), format, media.contentType(), bytes);
        LOGGER.debug("DECODE ok source={} image={}", media.source(), decoded);
        return decoded;
    }

    @Override
    public List<Detection> detect(DecodedImage decoded, double confidenceThreshold, Duration timeout) {
        return detector.detect(decoded, confidenceThreshold, timeout);
    }

    @Override
    public String detectorName() {
        return detector.name();
    }

    private void verifyDeclaredDimensions(RawMedia media, BufferedImage image) {
        Optional<Integer> width = media.intMetadata(WIDTH_METADATA);
        Optional<Integer> height = media.intMetadata(HEIGHT_METADATA);
        if (width.isEmpty() || height.isEmpty()) return;
        if (width.get() != image.getWidth() || height.get() != image.getHeight()) {
            throw DetectionException.invalidImage("Decoded size " + image.getWidth() + "x" + image.getHeight()
                    + " differs from stored size " + width.get() + "x" + height.get() + " for " + media.source());
        }
    }
}
