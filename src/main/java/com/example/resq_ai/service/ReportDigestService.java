package com.example.resq_ai.service;

import com.example.resq_ai.dto.ReportDigest;
import com.example.resq_ai.dto.SummarizationRequest;
import com.example.resq_ai.dto.SummarizationResult;
import com.example.resq_ai.exception.PipelineException;
import com.example.resq_ai.util.ErrorKind;
import com.example.resq_ai.util.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Turns the tags found on a report (plus optional free text) into a short title and description.
 */
@Service
public class ReportDigestService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReportDigestService.class);
    static final int TITLE_WORDS = 8;
    static final String UNTITLED = "Untitled";

    private final PipelineOrchestrator orchestrator;

    public ReportDigestService(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public ReportDigest digest(List<String> tags, List<String> extraDescription) {
        String flatTags = flatten(tags);
        if (flatTags.isEmpty()) {
            throw new PipelineException(ErrorKind.INVALID_INPUT, PipelineStage.RECEIVED, "At least one tag is required");
        }
        String context = contextText(flatTags, flatten(extraDescription));
        SummarizationResult summary = orchestrator.summarize(new SummarizationRequest(context, null));
        String description = summary.summary();
        String title = title(description.isBlank() ? context : description);
        LOGGER.info("DIGEST tags={} extra={} titleWords={}", tags.size(),
                extraDescription == null ? 0 : extraDescription.size(), title.split("\\s+").length);
        return new ReportDigest(title, description);
    }

    static String contextText(String flatTags, String flatExtra) {
        String extra = flatExtra.isEmpty()
                ? "- user did not provide any extra information."
                : "- report came with more information on " + flatExtra;
        return "user made a report and we found these items " + flatTags + " " + extra;
    }

    static String flatten(List<String> items) {
        if (items == null) return "";
        return items.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining("; "));
    }

    /** First eight words, sentence-cased, with an ellipsis when cut. */
    static String title(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) return UNTITLED;
        String[] words = trimmed.split("\\s+");
        String head = String.join(" ", Arrays.copyOf(words, Math.min(words.length, TITLE_WORDS)));
        String cased = head.substring(0, 1).toUpperCase(Locale.ROOT) + head.substring(1).toLowerCase(Locale.ROOT);
        return words.length > TITLE_WORDS ? cased + "..." : cased;
    }
}
