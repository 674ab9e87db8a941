package com.example.resq_ai.engine;

import com.example.resq_ai.config.SummarizerProperties;
import com.example.resq_ai.dto.SummarizationResult;
import com.example.resq_ai.engine.Interfaces.Summarizer;
import com.example.resq_ai.exception.SummarizationException;
import com.example.resq_ai.util.ErrorKind;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Extractive summarizer: sentences are nodes, lexical overlap of their stemmed terms is the edge
 * weight, and a weighted PageRank picks the most central ones. Output keeps source order.
 */
public class TextRankSummarizer implements Summarizer, AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(TextRankSummarizer.class);
    private static final String FIELD = "sentence";

    private final SummarizerProperties props;
    private final Locale locale;
    private final Analyzer analyzer;

    public TextRankSummarizer(SummarizerProperties props) {
        this.props = props;
        this.locale = props.resolvedLocale();
        this.analyzer = Locale.ENGLISH.getLanguage().equals(locale.getLanguage())
                ? new EnglishAnalyzer()
                : new StandardAnalyzer();
    }

    @Override
    public SummarizationResult summarize(String text, int sentenceCount) {
        if (text == null || text.isBlank()) {
            throw new SummarizationException(ErrorKind.INVALID_INPUT, "Text must not be empty");
        }
        if (sentenceCount < 1) {
            throw new SummarizationException(ErrorKind.INVALID_INPUT, "sentenceCount must be positive, got " + sentenceCount);
        }

        List<String> sentences = splitSentences(text);
        int n = sentences.size();
        if (n <= sentenceCount) {
            LOGGER.debug("SUMMARIZE sentences={} requested={} returning all", n, sentenceCount);
            return new SummarizationResult(String.join(" ", sentences), n, sentenceCount, sentences);
        }

        List<Set<String>> terms = new ArrayList<>(n);
        for (String s : sentences) {
            terms.add(terms(s));
        }
        double[] scores = rank(similarityMatrix(terms));

        List<String> picked = IntStream.range(0, n).boxed()
                .sorted(Comparator.<Integer>comparingDouble(i -> scores[i]).reversed()
                        .thenComparing(Comparator.naturalOrder()))
                .limit(sentenceCount)
                .sorted()
                .map(sentences::get)
                .collect(Collectors.toList());

        LOGGER.info("SUMMARIZE sentences={} requested={} produced={}", n, sentenceCount, picked.size());
        return new SummarizationResult(String.join(" ", picked), picked.size(), sentenceCount, picked);
    }

    List<String> splitSentences(String text) {
        BreakIterator it = BreakIterator.getSentenceInstance(locale);
        it.setText(text);
        List<String> out = new ArrayList<>();
        int start = it.first();
        for (int end = it.next(); end != BreakIterator.DONE; start = end, end = it.next()) {
            String sentence = text.substring(start, end).trim();
            if (!sentence.isEmpty()) out.add(sentence);
        }
        return out;
    }

    private Set<String> terms(String sentence) {
        Set<String> out = new HashSet<>();
        try (TokenStream ts = analyzer.tokenStream(FIELD, sentence)) {
            CharTermAttribute term = ts.addAttribute(CharTermAttribute.class);
            ts.reset();
            while (ts.incrementToken()) {
                out.add(term.toString());
            }
            ts.end();
        } catch (IOException e) {
            throw new SummarizationException(ErrorKind.ENGINE_UNAVAILABLE, "Tokenizer failed", e);
        }
        return out;
    }

    private double[][] similarityMatrix(List<Set<String>> terms) {
        int n = terms.size();
        double[][] w = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double sim = similarity(terms.get(i), terms.get(j));
                w[i][j] = sim;
                w[j][i] = sim;
            }
        }
        return w;
    }

    static double similarity(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        long overlap = smaller.stream().filter(larger::contains).count();
        if (overlap == 0) return 0.0;
        return overlap / (Math.log1p(a.size()) + Math.log1p(b.size()));
    }

    private double[] rank(double[][] w) {
        int n = w.length;
        double d = props.getDamping();
        double[] outWeight = new double[n];
        for (int j = 0; j < n; j++) {
            for (int k = 0; k < n; k++) outWeight[j] += w[j][k];
        }

        double[] scores = new double[n];
        Arrays.fill(scores, 1.0 / n);
        for (int iter = 0; iter < props.getMaxIterations(); iter++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new SummarizationException(ErrorKind.TIMEOUT, "Sentence ranking cancelled");
            }
            // dangling sentences share nothing with the rest; their mass is spread evenly
            double dangling = 0.0;
            for (int j = 0; j < n; j++) {
                if (outWeight[j] == 0.0) dangling += scores[j];
            }
            double[] next = new double[n];
            double delta = 0.0;
            for (int i = 0; i < n; i++) {
                double sum = dangling / n;
                for (int j = 0; j < n; j++) {
                    if (w[j][i] > 0.0) sum += w[j][i] / outWeight[j] * scores[j];
                }
                next[i] = (1 - d) / n + d * sum;
                delta = Math.max(delta, Math.abs(next[i] - scores[i]));
            }
            scores = next;
            if (delta < props.getTolerance()) {
                LOGGER.debug("SUMMARIZE converged iterations={}", iter + 1);
                break;
            }
        }
        return scores;
    }

    @Override
    public String name() {
        return "textrank";
    }

    @Override
    public void close() {
        analyzer.close();
    }
}
