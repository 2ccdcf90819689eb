package com.phillippitts.ambient.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for command routing, confirmation and history.
 */
@Validated
@ConfigurationProperties(prefix = "ambient.command")
public class CommandProperties {

    /** Minimum edit-distance similarity for a fuzzy phrase match. */
    @DecimalMin("0.5")
    @DecimalMax("1.0")
    private final double fuzzyThreshold;

    /** Upper bound for one clarifier round-trip. */
    @Min(100)
    @Max(30_000)
    private final int clarifierTimeoutMs;

    /** Lifetime of a pending clarification. */
    @Min(1000)
    @Max(3_600_000)
    private final long confirmationTtlMs;

    /** Number of history entries kept; the oldest are evicted first. */
    @Min(1)
    @Max(1000)
    private final int historySize;

    /** Maximum number of suggestions returned. */
    @Min(1)
    @Max(50)
    private final int suggestionLimit;

    @ConstructorBinding
    public CommandProperties(@DefaultValue("0.7") double fuzzyThreshold,
                             @DefaultValue("2500") int clarifierTimeoutMs,
                             @DefaultValue("60000") long confirmationTtlMs,
                             @DefaultValue("50") int historySize,
                             @DefaultValue("5") int suggestionLimit) {
        this.fuzzyThreshold = fuzzyThreshold;
        this.clarifierTimeoutMs = clarifierTimeoutMs;
        this.confirmationTtlMs = confirmationTtlMs;
        this.historySize = historySize;
        this.suggestionLimit = suggestionLimit;
    }

    public double getFuzzyThreshold() { return fuzzyThreshold; }
    public int getClarifierTimeoutMs() { return clarifierTimeoutMs; }
    public long getConfirmationTtlMs() { return confirmationTtlMs; }
    public int getHistorySize() { return historySize; }
    public int getSuggestionLimit() { return suggestionLimit; }
}
