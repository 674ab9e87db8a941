package com.example.resq_ai.engine;

import com.example.resq_ai.config.DetectionProperties;
import com.example.resq_ai.dto.BoundingBox;
import com.example.resq_ai.dto.DecodedImage;
import com.example.resq_ai.dto.Detection;
import com.example.resq_ai.engine.Interfaces.Detector;
import com.example.resq_ai.exception.DetectionException;
import com.example.resq_ai.util.DetectionNormalizer;
import com.example.resq_ai.util.ErrorKind;
import com.example.resq_ai.util.PipelineStage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Calls a YOLO inference sidecar over HTTP.
 * <p>
 * Request: multipart {@code POST /v1/detect} with parts {@code file}, {@code model} and {@code conf}.
 * Response: {@code {"model": "...", "detections": [{"class": "person", "confidence": 0.91, "bbox": [x1, y1, x2, y2]}]}}
 * with {@code bbox} in source pixels. No retries here; the orchestrator owns retry.
 */
public class YoloHttpDetector implements Detector {
    private static final Logger LOGGER = LoggerFactory.getLogger(YoloHttpDetector.class);
    private static final int ERROR_SNIPPET_MAX = 200;

    private final WebClient client;
    private final DetectionProperties props;
    private final ObjectMapper om = new ObjectMapper();

    public YoloHttpDetector(WebClient client, DetectionProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public List<Detection> detect(DecodedImage image, double confidenceThreshold, Duration timeout) {
        Duration callTimeout = timeout != null ? timeout : Duration.ofMillis(props.getDefaultTimeoutMs());
        if (callTimeout.isZero() || callTimeout.isNegative()) {
            throw new DetectionException(ErrorKind.TIMEOUT, PipelineStage.INFERRING, "No time left for inference");
        }

        MultipartBodyBuilder form = new MultipartBodyBuilder();
        form.part("file", namedResource(image)).contentType(mediaTypeOf(image));
        form.part("model", props.getModel());
        form.part("conf", String.valueOf(confidenceThreshold));

        Mono<JsonNode> mono = client.post()
                .uri("/v1/detect")
                .body(BodyInserters.fromMultipartData(form.build()))
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(body -> classifyStatus(resp.statusCode(), body)))
                .bodyToMono(String.class)
                .map(this::parseJson)
                .timeout(callTimeout);

        long t0 = System.nanoTime();
        JsonNode root;
        try {
            root = mono.block();
        } catch (DetectionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw classifyFailure(Exceptions.unwrap(e), callTimeout);
        }
        if (root == null) {
            throw new DetectionException(ErrorKind.INFERENCE_FAILURE, PipelineStage.INFERRING, "Empty response from detector");
        }

        List<Detection> raw = parseDetections(root);
        List<Detection> kept = DetectionNormalizer.normalize(raw, image.width(), image.height(), confidenceThreshold);
        LOGGER.info("DETECT model={} image={}x{} raw={} kept={} threshold={} in={}ms",
                props.getModel(), image.width(), image.height(), raw.size(), kept.size(), confidenceThreshold,
                (System.nanoTime() - t0) / 1_000_000);
        return kept;
    }

    @Override
    public String name() {
        return "yolo-http:" + props.getModel();
    }

    private List<Detection> parseDetections(JsonNode root) {
        JsonNode items = root.path("detections");
        if (!items.isArray()) {
            throw new DetectionException(ErrorKind.INFERENCE_FAILURE, PipelineStage.INFERRING,
                    "Detector response has no detections array");
        }
        List<Detection> out = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            Detection d = parseDetectionSafe(item);
            if (d != null) out.add(d);
        }
        return out;
    }

    private Detection parseDetectionSafe(JsonNode item) {
        String label = firstNonBlank(item, "class", "label", "name");
        JsonNode conf = item.path("confidence");
        JsonNode bbox = item.path("bbox");
        if (label == null || !conf.isNumber() || !bbox.isArray() || bbox.size() != 4) {
            LOGGER.warn("DETECT skipping malformed detection fields={}", fieldNames(item));
            return null;
        }
        for (JsonNode c : bbox) {
            if (!c.isNumber()) {
                LOGGER.warn("DETECT skipping detection with non-numeric bbox label={}", label);
                return null;
            }
        }
        BoundingBox box = new BoundingBox(bbox.get(0).asDouble(), bbox.get(1).asDouble(),
                bbox.get(2).asDouble(), bbox.get(3).asDouble());
        return new Detection(label, conf.asDouble(), box);
    }

    private JsonNode parseJson(String body) {
        try {
            return om.readTree(body);
        } catch (JsonProcessingException e) {
            int length = body == null ? 0 : body.length();
            throw new DetectionException(ErrorKind.INFERENCE_FAILURE, PipelineStage.INFERRING,
                    "Detector returned unparsable body length=" + length, e);
        }
    }

    static DetectionException classifyStatus(HttpStatusCode status, String body) {
        int code = status.value();
        String message = "Detector error " + code + ": " + truncate(body);
        if (code == 400 || code == 413 || code == 415 || code == 422) {
            return new DetectionException(ErrorKind.INVALID_INPUT, PipelineStage.INFERRING, message);
        }
        if (code == 429 || code == 502 || code == 503 || code == 504) {
            return new DetectionException(ErrorKind.ENGINE_UNAVAILABLE, PipelineStage.INFERRING, message);
        }
        return new DetectionException(ErrorKind.INFERENCE_FAILURE, PipelineStage.INFERRING, message);
    }

    private DetectionException classifyFailure(Throwable failure, Duration callTimeout) {
        if (failure instanceof DetectionException de) {
            return de;
        }
        if (failure instanceof TimeoutException) {
            return new DetectionException(ErrorKind.TIMEOUT, PipelineStage.INFERRING,
                    "Detector did not answer within " + callTimeout.toMillis() + "ms", failure);
        }
        if (failure instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new DetectionException(ErrorKind.TIMEOUT, PipelineStage.INFERRING, "Inference call cancelled", failure);
        }
        if (failure instanceof WebClientRequestException) {
            return new DetectionException(ErrorKind.ENGINE_UNAVAILABLE, PipelineStage.INFERRING,
                    "Detector unreachable: " + failure.getMessage(), failure);
        }
        return new DetectionException(ErrorKind.INFERENCE_FAILURE, PipelineStage.INFERRING,
                "Detector call failed: " + failure.getClass().getSimpleName(), failure);
    }

    private static ByteArrayResource namedResource(DecodedImage image) {
        String filename = "image." + (image.format() == null ? "bin" : image.format().toLowerCase(Locale.ROOT));
        return new ByteArrayResource(image.encoded()) {
            @Override
            public String getFilename() {
                return filename;
            }
        };
    }

    private static MediaType mediaTypeOf(DecodedImage image) {
        try {
            return MediaType.parseMediaType(image.contentType());
        } catch (RuntimeException e) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }

    private static String firstNonBlank(JsonNode node, String... fields) {
        for (String field : fields) {
            if (node.hasNonNull(field)) {
                String value = node.get(field).asText("").trim();
                if (!value.isBlank()) return value;
            }
        }
        return null;
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> fields = new ArrayList<>();
        node.fieldNames().forEachRemaining(fields::add);
        return fields;
    }

    private static String truncate(String body) {
        if (body == null) return "";
        if (body.length() <= ERROR_SNIPPET_MAX) return body;
        return body.substring(0, ERROR_SNIPPET_MAX) + "...";
    }
}
