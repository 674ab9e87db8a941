package com.example.resq_ai.service;

import com.example.resq_ai.config.DetectionProperties;
import com.example.resq_ai.config.PipelineProperties;
import com.example.resq_ai.config.SummarizerProperties;
import com.example.resq_ai.dto.DecodedMedia;
import com.example.resq_ai.dto.Detection;
import com.example.resq_ai.dto.DetectionResult;
import com.example.resq_ai.dto.ImageMetadata;
import com.example.resq_ai.dto.MediaReference;
import com.example.resq_ai.dto.RawMedia;
import com.example.resq_ai.dto.SummarizationRequest;
import com.example.resq_ai.dto.SummarizationResult;
import com.example.resq_ai.engine.Interfaces.MediaAnalyzer;
import com.example.resq_ai.engine.Interfaces.Summarizer;
import com.example.resq_ai.exception.PipelineException;
import com.example.resq_ai.service.Interfaces.ObjectStore;
import com.example.resq_ai.util.DetectionNormalizer;
import com.example.resq_ai.util.ErrorKind;
import com.example.resq_ai.util.MediaKind;
import com.example.resq_ai.util.PipelineStage;
import com.example.resq_ai.util.TextPayloads;
import com.example.resq_ai.util.TimeBudget;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs one request through its stages under a single end-to-end budget.
 * <p>
 * Media: {@code RECEIVED -> FETCHING -> DECODING -> INFERRING -> NORMALIZING -> COMPLETED}.
 * Stored text documents: {@code RECEIVED -> FETCHING -> DECODING -> SUMMARIZING -> COMPLETED}.
 * Text: {@code RECEIVED -> SUMMARIZING -> COMPLETED}. Any stage can fail with a
 * {@link PipelineException} that names the stage it failed in.
 * <p>
 * Work runs on the pipeline executor so the caller can stop waiting at the deadline and
 * interrupt the worker, which aborts the in-flight store or engine call.
 */
@Service
public class PipelineOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final ObjectStore store;
    private final List<MediaAnalyzer<?>> analyzers;
    private final Summarizer summarizer;
    private final InferenceGate gate;
    private final AsyncTaskExecutor executor;
    private final PipelineProperties pipeline;
    private final DetectionProperties detection;
    private final SummarizerProperties summarization;
    private final RetryConfig retryBase;

    public PipelineOrchestrator(ObjectStore store,
                                List<MediaAnalyzer<?>> analyzers,
                                Summarizer summarizer,
                                InferenceGate gate,
                                @Qualifier("pipelineTaskExecutor") AsyncTaskExecutor executor,
                                PipelineProperties pipeline,
                                DetectionProperties detection,
                                SummarizerProperties summarization) {
        this.store = store;
        this.analyzers = List.copyOf(analyzers);
        this.summarizer = summarizer;
        this.gate = gate;
        this.executor = executor;
        this.pipeline = pipeline;
        this.detection = detection;
        this.summarization = summarization;
        this.retryBase = RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(pipeline.getRetryBackoffMs()))
                .build();
    }

    public DetectionResult analyzeMedia(MediaReference ref, Double confidenceThreshold) {
        Run run = new Run("media", TimeBudget.of(pipeline.timeout()));
        if (ref == null || isBlank(ref.bucket()) || isBlank(ref.key())) {
            throw run.fail(new PipelineException(ErrorKind.INVALID_INPUT, PipelineStage.RECEIVED,
                    "bucket and key must not be empty"));
        }
        double threshold = resolveThreshold(run, confidenceThreshold);
        LOGGER.info("PIPELINE received requestId={} ref={} threshold={}", run.id, ref, threshold);

        return execute(run, () -> {
            run.enter(PipelineStage.FETCHING);
            RawMedia raw = withRetry(run, () -> store.fetch(ref.bucket(), ref.key(), run.budget.remaining()));

            run.enter(PipelineStage.DECODING);
            DetectionResult result = MediaKind.of(raw.contentType()) == MediaKind.TEXT
                    ? summarizeDocument(run, raw, threshold)
                    : analyzeWith(run, decode(run, raw), raw, threshold);

            run.enter(PipelineStage.COMPLETED);
            return result;
        });
    }

    public SummarizationResult summarize(SummarizationRequest request) {
        Run run = new Run("text", TimeBudget.of(pipeline.timeout()));
        if (request == null || isBlank(request.text())) {
            throw run.fail(new PipelineException(ErrorKind.INVALID_INPUT, PipelineStage.RECEIVED,
                    "Text must not be empty"));
        }
        int count = request.resolveSentenceCount(summarization.getDefaultSentenceCount());
        if (count < 1) {
            throw run.fail(new PipelineException(ErrorKind.INVALID_INPUT, PipelineStage.RECEIVED,
                    "sentenceCount must be positive, got " + count));
        }
        LOGGER.info("PIPELINE received requestId={} textLength={} sentenceCount={}", run.id, request.text().length(), count);

        return execute(run, () -> {
            run.enter(PipelineStage.SUMMARIZING);
            SummarizationResult result = withRetry(run, () ->
                    gate.call(PipelineStage.SUMMARIZING, run.budget, () -> summarizer.summarize(request.text(), count)));
            run.enter(PipelineStage.COMPLETED);
            return result;
        });
    }

    private <T extends DecodedMedia> DetectionResult analyzeWith(Run run, Decoded<T> media, RawMedia raw, double threshold) {
        MediaAnalyzer<T> analyzer = media.analyzer();
        T decoded = media.decoded();

        run.enter(PipelineStage.INFERRING);
        List<Detection> found = withRetry(run, () ->
                gate.call(PipelineStage.INFERRING, run.budget,
                        () -> analyzer.detect(decoded, threshold, run.budget.remaining())));

        run.enter(PipelineStage.NORMALIZING);
        List<Detection> kept = DetectionNormalizer.normalize(found, decoded.width(), decoded.height(), threshold);
        Map<String, Integer> counts = DetectionNormalizer.countByLabel(kept);
        return new DetectionResult(
                raw.source(),
                raw.contentType(),
                ImageMetadata.of(decoded),
                kept,
                counts,
                DetectionNormalizer.describe(counts),
                analyzer.detectorName(),
                threshold,
                run.budget.elapsedMs(),
                null);
    }

    private DetectionResult summarizeDocument(Run run, RawMedia raw, double threshold) {
        String text = TextPayloads.decodeUtf8(raw);
        int count = summarization.getDefaultSentenceCount();

        run.enter(PipelineStage.SUMMARIZING);
        SummarizationResult summary = withRetry(run, () ->
                gate.call(PipelineStage.SUMMARIZING, run.budget, () -> summarizer.summarize(text, count)));
        return new DetectionResult(
                raw.source(),
                raw.contentType(),
                null,
                List.of(),
                Map.of(),
                summary.summary(),
                summarizer.name(),
                threshold,
                run.budget.elapsedMs(),
                summary);
    }

    /**
     * A known type picks its analyzer. Without a usable type hint every analyzer gets a chance
     * to decode the bytes and the first that succeeds wins.
     */
    private Decoded<?> decode(Run run, RawMedia raw) {
        String contentType = raw.contentType();
        MediaKind kind = MediaKind.of(contentType);
        if (kind != MediaKind.UNKNOWN) {
            MediaAnalyzer<?> analyzer = analyzers.stream()
                    .filter(a -> a.supports(contentType))
                    .findFirst()
                    .orElseThrow(() -> new PipelineException(ErrorKind.INVALID_INPUT, PipelineStage.DECODING,
                            "Unsupported media type: " + contentType + " (" + kind.label() + ")"));
            return Decoded.of(analyzer, raw);
        }

        PipelineException last = null;
        for (MediaAnalyzer<?> analyzer : analyzers) {
            try {
                Decoded<?> decoded = Decoded.of(analyzer, raw);
                LOGGER.info("PIPELINE sniffed requestId={} contentType={} format={}",
                        run.id, contentType, decoded.decoded().format());
                return decoded;
            } catch (PipelineException e) {
                if (e.getKind() != ErrorKind.INVALID_INPUT) throw e;
                last = e;
            }
        }
        throw new PipelineException(ErrorKind.INVALID_INPUT, PipelineStage.DECODING,
                "Unsupported media type: " + contentType + ", no analyzer could decode " + raw.source(), last);
    }

    private double resolveThreshold(Run run, Double requested) {
        double threshold = requested != null ? requested : detection.getDefaultConfidenceThreshold();
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw run.fail(new PipelineException(ErrorKind.INVALID_INPUT, PipelineStage.RECEIVED,
                    "confidenceThreshold must be within [0,1], got " + threshold));
        }
        return threshold;
    }

    /** One extra attempt for retryable kinds, and only when the budget still covers the backoff. */
    private <T> T withRetry(Run run, Supplier<T> call) {
        long backoffMs = pipeline.getRetryBackoffMs();
        RetryConfig config = RetryConfig.from(retryBase)
                .retryOnException(t -> t instanceof PipelineException pe
                        && shouldRetry(pe)
                        && !Thread.currentThread().isInterrupted()
                        && run.budget.remainingMs() > backoffMs)
                .build();
        Retry retry = Retry.of("pipeline-" + run.stage.name().toLowerCase(Locale.ROOT), config);
        retry.getEventPublisher().onRetry(event -> LOGGER.warn(
                "PIPELINE retry requestId={} stage={} kind={} attempt={} backoffMs={}",
                run.id, run.stage, kindOf(event.getLastThrowable()), event.getNumberOfRetryAttempts(), backoffMs));
        return Retry.decorateSupplier(retry, call).get();
    }

    private boolean shouldRetry(PipelineException e) {
        return e.isRetryable()
                || (e.getKind() == ErrorKind.INFERENCE_FAILURE && pipeline.isRetryInferenceFailures());
    }

    private static ErrorKind kindOf(Throwable t) {
        return t instanceof PipelineException pe ? pe.getKind() : ErrorKind.INTERNAL;
    }

    private <T> T execute(Run run, Callable<T> work) {
        Future<T> future;
        try {
            future = executor.submit(() -> {
                try {
                    return work.call();
                } catch (PipelineException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw new PipelineException(ErrorKind.INTERNAL, run.stage,
                            "Unexpected failure: " + e.getClass().getSimpleName(), e);
                }
            });
        } catch (TaskRejectedException e) {
            throw run.fail(new PipelineException(ErrorKind.CAPACITY_EXCEEDED, run.stage, "Pipeline queue is full", e));
        }

        try {
            T result = future.get(run.budget.remainingMs(), TimeUnit.MILLISECONDS);
            LOGGER.info("PIPELINE done requestId={} kind={} elapsedMs={}", run.id, run.kind, run.budget.elapsedMs());
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw run.fail(new PipelineException(ErrorKind.TIMEOUT, run.stage,
                    "Budget of " + pipeline.getTimeoutMs() + "ms exceeded", e));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw run.fail(new PipelineException(ErrorKind.TIMEOUT, run.stage, "Caller interrupted", e));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PipelineException pe) {
                throw run.fail(pe);
            }
            throw run.fail(new PipelineException(ErrorKind.INTERNAL, run.stage,
                    "Unexpected failure: " + cause.getClass().getSimpleName(), cause));
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private record Decoded<T extends DecodedMedia>(MediaAnalyzer<T> analyzer, T decoded) {
        static <T extends DecodedMedia> Decoded<T> of(MediaAnalyzer<T> analyzer, RawMedia raw) {
            return new Decoded<>(analyzer, analyzer.decode(raw));
        }
    }

    /** Per-request state. The stage is read by the caller thread when the deadline hits. */
    private static final class Run {
        final String id = UUID.randomUUID().toString().substring(0, 8);
        final String kind;
        final TimeBudget budget;
        volatile PipelineStage stage = PipelineStage.RECEIVED;

        Run(String kind, TimeBudget budget) {
            this.kind = kind;
            this.budget = budget;
        }

        void enter(PipelineStage next) {
            stage = next;
            LOGGER.info("PIPELINE stage={} requestId={} elapsedMs={}", next, id, budget.elapsedMs());
        }

        PipelineException fail(PipelineException e) {
            if (e.getKind() == ErrorKind.INTERNAL) {
                LOGGER.error("PIPELINE failed requestId={} stage={} kind={} elapsedMs={}",
                        id, e.getStage(), e.getKind(), budget.elapsedMs(), e);
            } else {
                LOGGER.warn("PIPELINE failed requestId={} stage={} kind={} reason={} elapsedMs={} msg={}",
                        id, e.getStage(), e.getKind(), e.reasonCode(), budget.elapsedMs(), e.getMessage());
            }
            return e;
        }
    }
}
