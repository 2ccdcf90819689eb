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
 * Typed properties for the screen sentinel.
 */
@Validated
@ConfigurationProperties(prefix = "ambient.screen")
public class ScreenProperties {

    /** Fixed delay between sampling ticks in milliseconds. */
    @Min(1000)
    @Max(600_000)
    private final int sampleIntervalMs;

    /**
     * Minimum share of changed words required to emit a snapshot when the content hash differs.
     * 0 disables the check so any hash change emits.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double minChangeRatio;

    @ConstructorBinding
    public ScreenProperties(@DefaultValue("60000") int sampleIntervalMs,
                            @DefaultValue("0.0") double minChangeRatio) {
        this.sampleIntervalMs = sampleIntervalMs;
        this.minChangeRatio = minChangeRatio;
    }

    public int getSampleIntervalMs() { return sampleIntervalMs; }
    public double getMinChangeRatio() { return minChangeRatio; }
}
