package com.phillippitts.ambient.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the audio sentinel.
 *
 * Capture format is fixed: 16 kHz, 16-bit PCM, mono, little-endian.
 */
@Validated
@ConfigurationProperties(prefix = "ambient.audio")
public class AudioProperties {

    /** Continuous silence after which an open session is sealed. */
    @Min(500)
    @Max(10_000)
    private final int silenceTimeoutMs;

    /** Sessions with less voiced audio than this are discarded. */
    @Min(0)
    @Max(10_000)
    private final int minUtteranceMs;

    /** Default normalised level in [0,1] above which a chunk counts as speech. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double volumeThreshold;

    /** Size of a read chunk from the capture line in milliseconds. */
    @Min(10)
    @Max(200)
    private final int chunkMillis;

    /** Amount of buffered audio sent to the transcriber at a time. */
    @Min(200)
    @Max(30_000)
    private final int transcribeWindowMs;

    /** Name reported for the default capture source, matched against audio filters. */
    @NotBlank
    private final String sourceName;

    /** Optional input device name hint; falls back to system default when null/blank. */
    private final String deviceName;

    @ConstructorBinding
    public AudioProperties(@DefaultValue("2000") int silenceTimeoutMs,
                           @DefaultValue("400") int minUtteranceMs,
                           @DefaultValue("0.1") double volumeThreshold,
                           @DefaultValue("40") int chunkMillis,
                           @DefaultValue("1000") int transcribeWindowMs,
                           @DefaultValue("microphone") String sourceName,
                           String deviceName) {
        this.silenceTimeoutMs = silenceTimeoutMs;
        this.minUtteranceMs = minUtteranceMs;
        this.volumeThreshold = volumeThreshold;
        this.chunkMillis = chunkMillis;
        this.transcribeWindowMs = transcribeWindowMs;
        this.sourceName = sourceName;
        this.deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
    }

    public int getSilenceTimeoutMs() { return silenceTimeoutMs; }
    public int getMinUtteranceMs() { return minUtteranceMs; }
    public double getVolumeThreshold() { return volumeThreshold; }
    public int getChunkMillis() { return chunkMillis; }
    public int getTranscribeWindowMs() { return transcribeWindowMs; }
    public String getSourceName() { return sourceName; }
    public String getDeviceName() { return deviceName; }
}
