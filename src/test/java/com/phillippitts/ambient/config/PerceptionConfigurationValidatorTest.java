package com.phillippitts.ambient.config;

import com.phillippitts.ambient.config.properties.AudioProperties;
import com.phillippitts.ambient.config.properties.CommandProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PerceptionConfigurationValidatorTest {

    private static AudioProperties audio(int silenceMs, int chunkMs, int windowMs) {
        return new AudioProperties(silenceMs, 400, 0.1, chunkMs, windowMs, "microphone", null);
    }

    private static CommandProperties command(int clarifierTimeoutMs, long ttlMs) {
        return new CommandProperties(0.7, clarifierTimeoutMs, ttlMs, 50, 5);
    }

    @Test
    void defaultsAreValid() {
        var validator = new PerceptionConfigurationValidator(audio(2000, 40, 1000), command(2500, 60_000));

        assertThatCode(validator::validate).doesNotThrowAnyException();
    }

    @Test
    void chunkMustBeShorterThanSilenceTimeout() {
        var validator = new PerceptionConfigurationValidator(audio(500, 500, 1000), command(2500, 60_000));

        assertThatThrownBy(validator::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("chunk-millis");
    }

    @Test
    void transcribeWindowMustHoldOneChunk() {
        var validator = new PerceptionConfigurationValidator(audio(2000, 200, 100), command(2500, 60_000));

        assertThatThrownBy(validator::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("transcribe-window-ms");
    }

    @Test
    void clarifierTimeoutMustBeShorterThanConfirmationTtl() {
        var validator = new PerceptionConfigurationValidator(audio(2000, 40, 1000), command(5000, 5000));

        assertThatThrownBy(validator::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("confirmation-ttl-ms");
    }
}
