package com.example.resq_ai.service;

import com.example.resq_ai.TestImages;
import com.example.resq_ai.config.DetectionProperties;
import com.example.resq_ai.config.PipelineProperties;
import com.example.resq_ai.config.SummarizerProperties;
import com.example.resq_ai.dto.BoundingBox;
import com.example.resq_ai.dto.DecodedImage;
import com.example.resq_ai.dto.Detection;
import com.example.resq_ai.dto.DetectionResult;
import com.example.resq_ai.dto.MediaReference;
import com.example.resq_ai.dto.RawMedia;
import com.example.resq_ai.dto.SummarizationRequest;
import com.example.resq_ai.dto.SummarizationResult;
import com.example.resq_ai.engine.ImageAnalyzer;
import com.example.resq_ai.engine.Interfaces.Detector;
import com.example.resq_ai.engine.Interfaces.Summarizer;
import com.example.resq_ai.exception.DetectionException;
import com.example.resq_ai.exception.ObjectFetchException;
import com.example.resq_ai.exception.PipelineException;
import com.example.resq_ai.exception.SummarizationException;
import com.example.resq_ai.service.Interfaces.ObjectStore;
import com.example.resq_ai.util.ContentTypes;
import com.example.resq_ai.util.ErrorKind;
import com.example.resq_ai.util.PipelineStage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineOrchestratorTest {

    private static final MediaReference REF = new MediaReference("resq-media", "reports/123.jpg");

    @Mock private ObjectStore store;
    @Mock private Detector detector;
    @Mock private Summarizer summarizer;

    private ThreadPoolTaskExecutor executor;
    private PipelineProperties pipeline;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(4);
        executor.setThreadNamePrefix("pipeline-test-");
        executor.initialize();

        pipeline = new PipelineProperties();
        pipeline.setTimeoutMs(5_000);
        pipeline.setRetryBackoffMs(10);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private PipelineOrchestrator orchestrator(InferenceGate gate) {
        return new PipelineOrchestrator(store, List.of(new ImageAnalyzer(detector)), summarizer, gate, executor,
                pipeline, new DetectionProperties(), new SummarizerProperties());
    }

    private PipelineOrchestrator orchestrator() {
        return orchestrator(new InferenceGate(4, 100));
    }

    private static RawMedia png(int width, int height) {
        return new RawMedia(REF, TestImages.png(width, height), "image/png", Map.of());
    }

    @Test
    void analyzesImageEndToEnd() {
        when(store.fetch(eq("resq-media"), eq("reports/123.jpg"), any(Duration.class))).thenReturn(png(64, 48));
        when(detector.detect(any(DecodedImage.class), eq(0.5), any(Duration.class))).thenReturn(List.of(
                new Detection("dog", 0.3, new BoundingBox(0, 0, 10, 10)),
                new Detection("person", 0.7, new BoundingBox(4, 4, 30, 40)),
                new Detection("person", 0.9, new BoundingBox(30, 4, 90, 40))));
        when(detector.name()).thenReturn("stub");

        DetectionResult result = orchestrator().analyzeMedia(REF, 0.5);

        assertThat(result.detections()).extracting(Detection::confidence).containsExactly(0.7, 0.9);
        assertThat(result.detections()).allMatch(d -> d.box().isWithin(64, 48));
        assertThat(result.labelCounts()).containsExactly(Map.entry("person", 2));
        assertEquals("Detected 2 persons in the image.", result.summaryText());
        assertEquals("64x48", result.metadata().dimensions());
        assertEquals("PNG", result.metadata().format());
        assertEquals("stub", result.detector());
        assertEquals(REF, result.source());
        assertEquals(0.5, result.confidenceThreshold());
    }

    @Test
    void usesDefaultThresholdWhenNoneGiven() {
        when(store.fetch(anyString(), anyString(), any(Duration.class))).thenReturn(png(8, 8));
        when(detector.detect(any(DecodedImage.class), eq(0.25), any(Duration.class))).thenReturn(List.of());
        when(detector.name()).thenReturn("stub");

        DetectionResult result = orchestrator().analyzeMedia(REF, null);

        assertEquals(0.25, result.confidenceThreshold());
        assertEquals("No objects detected in the image.", result.summaryText());
    }

    @Test
    void missingObjectFailsInRetrievalWithoutInference() {
        when(store.fetch(anyString(), anyString(), any(Duration.class)))
                .thenThrow(new ObjectFetchException(ErrorKind.NOT_FOUND, "Object not found: resq-media/reports/123.jpg"));

        PipelineException ex = assertThrows(PipelineException.class, () -> orchestrator().analyzeMedia(REF, null));

        assertEquals(ErrorKind.NOT_FOUND, ex.getKind());
        assertEquals("RETRIEVAL_NOT_FOUND", ex.reasonCode());
        verify(store, times(1)).fetch(anyString(), anyString(), any(Duration.class));
        verifyNoInteractions(detector);
    }

    @Test
    void transientFetchIsRetriedExactlyOnce() {
        when(store.fetch(anyString(), anyString(), any(Duration.class)))
                .thenThrow(new ObjectFetchException(ErrorKind.TRANSIENT, "store blip"))
                .thenThrow(new ObjectFetchException(ErrorKind.TRANSIENT, "store blip"))
                .thenReturn(png(8, 8));

        PipelineException ex = assertThrows(PipelineException.class, () -> orchestrator().analyzeMedia(REF, null));

        assertEquals(ErrorKind.TRANSIENT, ex.getKind());
        assertEquals(PipelineStage.FETCHING, ex.getStage());
        verify(store, times(2)).fetch(anyString(), anyString(), any(Duration.class));
        verifyNoInteractions(detector);
    }

    @Test
    void transientFetchRecoversOnRetry() {
        when(store.fetch(anyString(), anyString(), any(Duration.class)))
                .thenThrow(new ObjectFetchException(ErrorKind.TRANSIENT, "store blip"))
                .thenReturn(png(8, 8));
        when(detector.detect(any(DecodedImage.class), eq(0.25), any(Duration.class))).thenReturn(List.of());
        when(detector.name()).thenReturn("stub");

        DetectionResult result = orchestrator().analyzeMedia(REF, null);

        assertThat(result.detections()).isEmpty();
        verify(store, times(2)).fetch(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void undecodableImageIsNotRetried() {
        when(store.fetch(anyString(), anyString(), any(Duration.class)))
                .thenReturn(new RawMedia(REF, "nope".getBytes(StandardCharsets.UTF_8), "image/jpeg", Map.of()));

        PipelineException ex = assertThrows(PipelineException.class, () -> orchestrator().analyzeMedia(REF, null));

        assertEquals(ErrorKind.INVALID_INPUT, ex.getKind());
        assertEquals("PROCESSING_INVALID_INPUT", ex.reasonCode());
        verify(store, times(1)).fetch(anyString(), anyString(), any(Duration.class));
        verifyNoInteractions(detector);
    }

    @Test
    void unsupportedMediaTypeIsInvalidInput() {
        when(store.fetch(anyString(), anyString(), any(Duration.class)))
                .thenReturn(new RawMedia(REF, new byte[]{1, 2}, "video/mp4", Map.of()));

        PipelineException ex = assertThrows(PipelineException.class, () -> orchestrator().analyzeMedia(REF, null));

        assertEquals(ErrorKind.INVALID_INPUT, ex.getKind());
        assertEquals(PipelineStage.DECODING, ex.getStage());
    }

    @Test
    void extensionlessImageIsDecodedFromItsBytes() {
        MediaReference noExtension = new MediaReference("resq-media", "reports/123");
        when(store.fetch(eq("resq-media"), eq("reports/123"), any(Duration.class)))
                .thenReturn(new RawMedia(noExtension, TestImages.png(64, 48), ContentTypes.UNKNOWN, Map.of()));
        when(detector.detect(any(DecodedImage.class), eq(0.25), any(Duration.class))).thenReturn(List.of());
        when(detector.name()).thenReturn("stub");

        DetectionResult result = orchestrator().analyzeMedia(noExtension, null);

        assertEquals("64x48", result.metadata().dimensions());
        assertEquals("PNG", result.metadata().format());
        assertEquals("No objects detected in the image.", result.summaryText());
    }

    @Test
    void unknownBytesNoAnalyzerCanDecodeAreInvalidInput() {
        when(store.fetch(anyString(), anyString(), any(Duration.class)))
                .thenReturn(new RawMedia(REF, new byte[]{0, 1, 2, 3}, ContentTypes.UNKNOWN, Map.of()));

        PipelineException ex = assertThrows(PipelineException.class, () -> orchestrator().analyzeMedia(REF, null));

        assertEquals(ErrorKind.INVALID_INPUT, ex.getKind());
        assertEquals(PipelineStage.DECODING, ex.getStage());
        verifyNoInteractions(detector);
    }

    @Test
    void storedTextDocumentIsSummarized() {
        MediaReference note = new MediaReference("resq-media", "reports/123.txt");
        String text = "Water is rising on Main Street. Two cars are stuck. The school is open as a shelter.";
        when(store.fetch(anyString(), anyString(), any(Duration.class)))
                .thenReturn(new RawMedia(note, text.getBytes(StandardCharsets.UTF_8), "text/plain", Map.of()));
        SummarizationResult summary = new SummarizationResult("Water is rising on Main Street. The school is open as a shelter.",
                2, 2, List.of("Water is rising on Main Street.", "The school is open as a shelter."));
        when(summarizer.summarize(text, 2)).thenReturn(summary);
        when(summarizer.name()).thenReturn("textrank");

        DetectionResult result = orchestrator().analyzeMedia(note, null);

        assertEquals(summary, result.textSummary());
        assertEquals(summary.summary(), result.summaryText());
        assertEquals("text/plain", result.contentType());
        assertEquals("textrank", result.detector());
        assertNull(result.metadata());
        assertThat(result.detections()).isEmpty();
        verifyNoInteractions(detector);
    }

    @Test
    void malformedTextDocumentIsInvalidInput() {
        when(store.fetch(anyString(), anyString(), any(Duration.class)))
                .thenReturn(new RawMedia(REF, new byte[]{(byte) 0xC3, (byte) 0x28}, "text/markdown", Map.of()));

        PipelineException ex = assertThrows(PipelineException.class, () -> orchestrator().analyzeMedia(REF, null));

        assertEquals(ErrorKind.INVALID_INPUT, ex.getKind());
        assertEquals(PipelineStage.DECODING, ex.getStage());
        verifyNoInteractions(summarizer);
    }

    @Test
    void inferenceFailureIsNotRetriedByDefault() {
        when(store.fetch(anyString(), anyString(), any(Duration.class))).thenReturn(png(8, 8));
        when(detector.detect(any(DecodedImage.class), eq(0.25), any(Duration.class)))
                .thenThrow(new DetectionException(ErrorKind.INFERENCE_FAILURE, PipelineStage.INFERRING, "model crashed"));

        PipelineException ex = assertThrows(PipelineException.class, () -> orchestrator().analyzeMedia(REF, null));

        assertEquals(ErrorKind.INFERENCE_FAILURE, ex.getKind());
        assertEquals("PROCESSING_INFERENCE_FAILURE", ex.reasonCode());
        verify(detector, times(1)).detect(any(DecodedImage.class), eq(0.25), any(Duration.class));
    }

    @Test
    void inferenceFailureRetriedOnceWhenEnabled() {
        pipeline.setRetryInferenceFailures(true);
        when(store.fetch(anyString(), anyString(), any(Duration.class))).thenReturn(png(8, 8));
        when(detector.detect(any(DecodedImage.class), eq(0.25), any(Duration.class)))
                .thenThrow(new DetectionException(ErrorKind.INFERENCE_FAILURE, PipelineStage.INFERRING, "oom"))
                .thenReturn(List.of());
        when(detector.name()).thenReturn("stub");

        orchestrator().analyzeMedia(REF, null);

        verify(detector, times(2)).detect(any(DecodedImage.class), eq(0.25), any(Duration.class));
    }

    @Test
    void slowFetchTimesOutAndIsInterrupted() throws Exception {
        pipeline.setTimeoutMs(200);
        CountDownLatch interrupted = new CountDownLatch(1);
        when(store.fetch(anyString(), anyString(), any(Duration.class))).thenAnswer(inv -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw new ObjectFetchException(ErrorKind.TIMEOUT, "cancelled");
            }
            return png(8, 8);
        });

        PipelineException ex = assertThrows(PipelineException.class, () -> orchestrator().analyzeMedia(REF, null));

        assertEquals(ErrorKind.TIMEOUT, ex.getKind());
        assertEquals(PipelineStage.FETCHING, ex.getStage());
        assertTrue(interrupted.await(2, TimeUnit.SECONDS));
    }

    @Test
    void slowDetectionTimesOutInInferenceAndIsInterrupted() throws Exception {
        pipeline.setTimeoutMs(300);
        CountDownLatch interrupted = new CountDownLatch(1);
        when(store.fetch(anyString(), anyString(), any(Duration.class))).thenReturn(png(8, 8));
        when(detector.detect(any(DecodedImage.class), eq(0.25), any(Duration.class))).thenAnswer(inv -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw new DetectionException(ErrorKind.TIMEOUT, PipelineStage.INFERRING, "cancelled");
            }
            return List.of();
        });
        InferenceGate gate = new InferenceGate(1, 50);

        PipelineException ex = assertThrows(PipelineException.class, () -> orchestrator(gate).analyzeMedia(REF, null));

        assertEquals(ErrorKind.TIMEOUT, ex.getKind());
        assertEquals(PipelineStage.INFERRING, ex.getStage());
        assertEquals("PROCESSING_TIMEOUT", ex.reasonCode());
        assertTrue(interrupted.await(2, TimeUnit.SECONDS));
        verify(detector, times(1)).detect(any(DecodedImage.class), eq(0.25), any(Duration.class));
    }

    @Test
    void rejectsThresholdOutsideUnitInterval() {
        PipelineException ex = assertThrows(PipelineException.class, () -> orchestrator().analyzeMedia(REF, 1.5));

        assertEquals(ErrorKind.INVALID_INPUT, ex.getKind());
        verifyNoInteractions(store);
    }

    @Test
    void summarizesWithDefaultSentenceCount() {
        SummarizationResult expected = new SummarizationResult("A. B.", 2, 2, List.of("A.", "B."));
        when(summarizer.summarize("A. B. C.", 2)).thenReturn(expected);

        SummarizationResult result = orchestrator().summarize(new SummarizationRequest("A. B. C.", null));

        assertEquals(expected, result);
    }

    @Test
    void summarizerUnavailableIsRetriedOnce() {
        when(summarizer.summarize(anyString(), anyInt()))
                .thenThrow(new SummarizationException(ErrorKind.ENGINE_UNAVAILABLE, "tokenizer down"))
                .thenReturn(new SummarizationResult("A.", 1, 1, List.of("A.")));

        SummarizationResult result = orchestrator().summarize(new SummarizationRequest("A. B.", 1));

        assertEquals("A.", result.summary());
        verify(summarizer, times(2)).summarize(anyString(), anyInt());
    }

    @Test
    void blankTextIsRejectedWithoutSummarizing() {
        PipelineException ex = assertThrows(PipelineException.class,
                () -> orchestrator().summarize(new SummarizationRequest("  ", 2)));

        assertEquals(ErrorKind.INVALID_INPUT, ex.getKind());
        verifyNoInteractions(summarizer);
    }

    @Test
    void busyEnginesRejectWithCapacityExceeded() throws Exception {
        CountDownLatch inside = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(summarizer.summarize(anyString(), anyInt())).thenAnswer(inv -> {
            inside.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new SummarizationResult("A.", 1, 1, List.of("A."));
        });
        PipelineOrchestrator orchestrator = orchestrator(new InferenceGate(1, 50));

        CompletableFuture<SummarizationResult> first = CompletableFuture.supplyAsync(
                () -> orchestrator.summarize(new SummarizationRequest("A. B.", 1)));
        assertTrue(inside.await(2, TimeUnit.SECONDS));

        PipelineException ex = assertThrows(PipelineException.class,
                () -> orchestrator.summarize(new SummarizationRequest("C. D.", 1)));
        assertEquals(ErrorKind.CAPACITY_EXCEEDED, ex.getKind());

        release.countDown();
        assertEquals("A.", first.get(2, TimeUnit.SECONDS).summary());
    }
}
