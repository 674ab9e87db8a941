package com.example.resq_ai.service;

import com.example.resq_ai.dto.ReportCategorization;
import com.example.resq_ai.exception.PipelineException;
import com.example.resq_ai.util.ErrorKind;
import com.example.resq_ai.util.PipelineStage;
import com.example.resq_ai.util.ReportCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Keyword categorization of a report, no engine involved. The first category in
 * {@link ReportCategory} order with a keyword among the words of the title, description or
 * metadata values wins.
 */
@Service
public class ReportCategoryService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReportCategoryService.class);
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    public ReportCategorization categorize(String title, String description, Map<String, String> metadata) {
        if (title == null || title.isBlank()) {
            throw new PipelineException(ErrorKind.INVALID_INPUT, PipelineStage.RECEIVED, "title must not be empty");
        }
        Set<String> words = words(title, description, metadata);
        for (ReportCategory category : ReportCategory.values()) {
            for (String keyword : category.keywords()) {
                if (words.contains(keyword)) {
                    LOGGER.info("CATEGORIZE category={} keyword={} words={}", category.label(), keyword, words.size());
                    return new ReportCategorization(category.label(), keyword);
                }
            }
        }
        LOGGER.info("CATEGORIZE category={} words={}", ReportCategory.OTHER.label(), words.size());
        return new ReportCategorization(ReportCategory.OTHER.label(), null);
    }

    // whole words only, so "rain" does not count as "ai"
    static Set<String> words(String title, String description, Map<String, String> metadata) {
        Stream<String> metadataValues = metadata == null ? Stream.empty() : metadata.values().stream();
        return Stream.concat(Stream.of(title, description), metadataValues)
                .filter(Objects::nonNull)
                .flatMap(text -> Arrays.stream(NON_WORD.split(text.toLowerCase(Locale.ROOT))))
                .filter(word -> !word.isEmpty())
                .collect(Collectors.toSet());
    }
}
