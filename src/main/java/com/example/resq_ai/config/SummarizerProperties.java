package com.example.resq_ai.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Locale;

/**
 * Sentence ranking settings. Damping, iteration cap and tolerance drive the power iteration
 * over the sentence similarity graph.
 */
@ConfigurationProperties(prefix = "engine.summarizer")
public class SummarizerProperties {
    private int defaultSentenceCount = 2;
    private String locale = "en";
    private double damping = 0.85;
    private int maxIterations = 100;
    private double tolerance = 1e-4;

    public int getDefaultSentenceCount() { return defaultSentenceCount; }
    public void setDefaultSentenceCount(int defaultSentenceCount) {
        if (defaultSentenceCount < 1) {
            throw new IllegalArgumentException("engine.summarizer.default-sentence-count must be positive");
        }
        this.defaultSentenceCount = defaultSentenceCount;
    }

    public String getLocale() { return locale; }
    public void setLocale(String locale) { this.locale = locale; }

    public double getDamping() { return damping; }
    public void setDamping(double damping) { this.damping = damping; }

    public int getMaxIterations() { return maxIterations; }
    public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }

    public double getTolerance() { return tolerance; }
    public void setTolerance(double tolerance) { this.tolerance = tolerance; }

    public Locale resolvedLocale() {
        return locale == null || locale.isBlank() ? Locale.ENGLISH : Locale.forLanguageTag(locale);
    }
}
