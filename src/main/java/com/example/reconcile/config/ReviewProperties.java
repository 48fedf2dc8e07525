package com.example.reconcile.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the review engine.
 */
@ConfigurationProperties(prefix = "review")
public record ReviewProperties(
        Scoring scoring,
        Normalization normalization,
        Pipeline pipeline,
        Map<String, String> fieldTypes
) {

    public ReviewProperties {
        if (scoring == null) scoring = new Scoring(null, null, null);
        if (normalization == null) normalization = new Normalization(null, null, null);
        if (pipeline == null) pipeline = new Pipeline(null, null, null);
        fieldTypes = fieldTypes != null ? Map.copyOf(fieldTypes) : Map.of();
    }

    /** Built-in defaults, as used outside a Spring context. */
    public static ReviewProperties defaults() {
        return new ReviewProperties(null, null, null, null);
    }

    /**
     * Thresholds below which a scored field emits a {@code low_confidence} issue.
     *
     * @param identityThreshold identity and contact fields
     * @param valueThreshold    dates and amounts
     * @param freeTextThreshold free text
     */
    public record Scoring(Double identityThreshold, Double valueThreshold, Double freeTextThreshold) {
        public Scoring {
            if (identityThreshold == null) identityThreshold = 0.95;
            if (valueThreshold == null) valueThreshold = 0.85;
            if (freeTextThreshold == null) freeTextThreshold = 0.80;
        }
    }

    /**
     * @param defaultCountryCode calling code assumed for phone numbers without prefix
     * @param defaultCurrency    currency assumed for amounts without symbol
     * @param flaggedKeywords    keywords reported as signals when found in free text
     */
    public record Normalization(String defaultCountryCode, String defaultCurrency, List<String> flaggedKeywords) {
        public Normalization {
            if (defaultCountryCode == null || defaultCountryCode.isBlank()) defaultCountryCode = "39";
            if (defaultCurrency == null || defaultCurrency.isBlank()) defaultCurrency = "EUR";
            if (flaggedKeywords == null) {
                flaggedKeywords = List.of("reclamo", "urgente", "legale", "avvocato", "frode", "contestazione",
                        "complaint", "urgent", "lawyer", "fraud", "dispute");
            }
            flaggedKeywords = List.copyOf(flaggedKeywords);
        }
    }

    /**
     * @param workerThreads      size of the normalization/scoring worker pool
     * @param timeout            overall run timeout
     * @param autoApplyThreshold auto-apply fixes at or above this confidence; null disables auto-apply
     */
    public record Pipeline(Integer workerThreads, Duration timeout, Double autoApplyThreshold) {
        public Pipeline {
            if (workerThreads == null || workerThreads < 1) workerThreads = 4;
            if (timeout == null) timeout = Duration.ofSeconds(30);
        }
    }
}
