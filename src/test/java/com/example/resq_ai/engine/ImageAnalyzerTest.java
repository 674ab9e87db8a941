package com.example.resq_ai.engine;

import com.example.resq_ai.TestImages;
import com.example.resq_ai.dto.DecodedImage;
import com.example.resq_ai.dto.MediaReference;
import com.example.resq_ai.dto.RawMedia;
import com.example.resq_ai.engine.Interfaces.Detector;
import com.example.resq_ai.exception.DetectionException;
import com.example.resq_ai.util.ErrorKind;
import com.example.resq_ai.util.PipelineStage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@ExtendWith(MockitoExtension.class)
class ImageAnalyzerTest {

    private static final MediaReference REF = new MediaReference("resq-media", "reports/1.png");

    @Mock
    private Detector detector;

    @Test
    void decodesPngWithDimensionsAndFormat() {
        ImageAnalyzer analyzer = new ImageAnalyzer(detector);
        RawMedia raw = new RawMedia(REF, TestImages.png(32, 20), "image/png", Map.of());

        DecodedImage image = analyzer.decode(raw);

        assertEquals(32, image.width());
        assertEquals(20, image.height());
        assertEquals("PNG", image.format());
        assertThat(image.encodedSize()).isEqualTo(raw.size());
    }

    @Test
    void matchingStoredDimensionsAreAccepted() {
        ImageAnalyzer analyzer = new ImageAnalyzer(detector);
        RawMedia raw = new RawMedia(REF, TestImages.png(12, 8), "image/png", Map.of("width", "12", "height", "8"));

        assertThat(analyzer.decode(raw).width()).isEqualTo(12);
    }

    @Test
    void rejectsDimensionMismatchWithStoredMetadata() {
        ImageAnalyzer analyzer = new ImageAnalyzer(detector);
        RawMedia raw = new RawMedia(REF, TestImages.png(12, 8), "image/png", Map.of("width", "640", "height", "480"));

        DetectionException ex = assertThrows(DetectionException.class, () -> analyzer.decode(raw));
        assertEquals(ErrorKind.INVALID_INPUT, ex.getKind());
    }

    @Test
    void garbageBytesAreInvalidInputAtDecoding() {
        ImageAnalyzer analyzer = new ImageAnalyzer(detector);
        RawMedia raw = new RawMedia(REF, "definitely not an image".getBytes(StandardCharsets.UTF_8), "image/jpeg", Map.of());

        DetectionException ex = assertThrows(DetectionException.class, () -> analyzer.decode(raw));
        assertEquals(ErrorKind.INVALID_INPUT, ex.getKind());
        assertEquals(PipelineStage.DECODING, ex.getStage());
    }

    @Test
    void emptyPayloadIsInvalid() {
        ImageAnalyzer analyzer = new ImageAnalyzer(detector);

        assertThrows(DetectionException.class, () -> analyzer.decode(new RawMedia(REF, new byte[0], "image/png", Map.of())));
    }

    @Test
    void supportsImageTypesOnly() {
        ImageAnalyzer analyzer = new ImageAnalyzer(detector);

        assertThat(analyzer.supports("image/jpeg")).isTrue();
        assertThat(analyzer.supports("IMAGE/PNG; charset=binary")).isTrue();
        assertThat(analyzer.supports("video/mp4")).isFalse();
        assertThat(analyzer.supports("unknown")).isFalse();
    }
}
