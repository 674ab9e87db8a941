package com.example.resq_ai.config;

import com.example.resq_ai.engine.DummyDetector;
import com.example.resq_ai.engine.ImageAnalyzer;
import com.example.resq_ai.engine.Interfaces.Detector;
import com.example.resq_ai.engine.Interfaces.Summarizer;
import com.example.resq_ai.engine.TextRankSummarizer;
import com.example.resq_ai.engine.YoloHttpDetector;
import com.example.resq_ai.service.InferenceGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Engine variants are picked once at startup from {@code engine.detection.backend}.
 */
@Configuration
@EnableConfigurationProperties({DetectionProperties.class, SummarizerProperties.class, PipelineProperties.class})
public class EngineConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    @ConditionalOnProperty(name = "engine.detection.backend", havingValue = "yolo-http", matchIfMissing = true)
    public Detector yoloHttpDetector(@Qualifier("detectorWebClient") WebClient client, DetectionProperties props) {
        LOGGER.info("Detector wired: backend=yolo-http, baseUrl={}, model={}", props.getBaseUrl(), props.getModel());
        return new YoloHttpDetector(client, props);
    }

    @Bean
    @ConditionalOnProperty(name = "engine.detection.backend", havingValue = "dummy")
    public Detector dummyDetector() {
        LOGGER.info("Detector wired: backend=dummy");
        return new DummyDetector();
    }

    @Bean
    public ImageAnalyzer imageAnalyzer(Detector detector) {
        return new ImageAnalyzer(detector);
    }

    @Bean
    public Summarizer summarizer(SummarizerProperties props) {
        return new TextRankSummarizer(props);
    }

    @Bean
    public InferenceGate inferenceGate(PipelineProperties props) {
        return new InferenceGate(props.getInference().getMaxConcurrent(), props.getInference().getQueueWaitMs());
    }
}
