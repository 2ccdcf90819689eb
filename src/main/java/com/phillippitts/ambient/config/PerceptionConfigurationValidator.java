package com.phillippitts.ambient.config;

import com.phillippitts.ambient.config.properties.AudioProperties;
import com.phillippitts.ambient.config.properties.CommandProperties;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

/**
 * Validates cross-field rules that Bean Validation annotations cannot express,
 * failing fast at startup with actionable messages.
 */
@Component
class PerceptionConfigurationValidator {

    private final AudioProperties audio;
    private final CommandProperties command;

    PerceptionConfigurationValidator(AudioProperties audio, CommandProperties command) {
        this.audio = audio;
        this.command = command;
    }

    @PostConstruct
    void validate() {
        if (audio.getChunkMillis() >= audio.getSilenceTimeoutMs()) {
            throw new IllegalArgumentException("ambient.audio.chunk-millis (" + audio.getChunkMillis()
                    + ") must be smaller than ambient.audio.silence-timeout-ms ("
                    + audio.getSilenceTimeoutMs() + ")");
        }
        if (audio.getTranscribeWindowMs() < audio.getChunkMillis()) {
            throw new IllegalArgumentException("ambient.audio.transcribe-window-ms ("
                    + audio.getTranscribeWindowMs() + ") must be at least one chunk ("
                    + audio.getChunkMillis() + " ms)");
        }
        if (command.getClarifierTimeoutMs() >= command.getConfirmationTtlMs()) {
            throw new IllegalArgumentException("ambient.command.clarifier-timeout-ms must be shorter than "
                    + "ambient.command.confirmation-ttl-ms, otherwise clarifications expire before they arrive");
        }
    }
}
