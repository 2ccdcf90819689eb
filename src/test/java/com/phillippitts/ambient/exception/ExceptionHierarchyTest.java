package com.phillippitts.ambient.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void ambientExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        AmbientException ex = new AmbientException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void transcriptionExceptionDefaultsEngineName() {
        TranscriptionException ex = new TranscriptionException("transcription failed");

        assertThat(ex.getMessage()).isEqualTo("transcription failed");
        assertThat(ex.getEngineName()).isEqualTo("unknown");
    }

    @Test
    void transcriptionExceptionShouldIncludeEngineName() {
        RuntimeException cause = new RuntimeException("process died");
        TranscriptionException ex = new TranscriptionException("timeout occurred", "remote", cause);

        assertThat(ex.getMessage()).contains("timeout occurred").contains("remote");
        assertThat(ex.getEngineName()).isEqualTo("remote");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void extractionAndLaunchExceptionsCarryTheirTarget() {
        ExtractionException extraction = new ExtractionException("no text", "window-title");
        LaunchException launch = new LaunchException("not found", "spotify");

        assertThat(extraction.getSource()).isEqualTo("window-title");
        assertThat(extraction.getMessage()).contains("window-title");
        assertThat(launch.getTarget()).isEqualTo("spotify");
        assertThat(launch.getMessage()).contains("spotify");
    }

    @Test
    void captureExceptionCarriesReason() {
        CaptureException ex = new CaptureException("MIC_UNAVAILABLE", "line not supported");

        assertThat(ex.getReason()).isEqualTo("MIC_UNAVAILABLE");
        assertThat(ex.getMessage()).isEqualTo("line not supported");
    }

    @Test
    void validationExceptionsExposeField() {
        InvalidFilterException filter = new InvalidFilterException("app", "app must not be blank");
        InvalidPatternException pattern = new InvalidPatternException("name", "already exists");

        assertThat(filter.getField()).isEqualTo("app");
        assertThat(pattern.getField()).isEqualTo("name");
    }

    @Test
    void allDomainExceptionsShouldExtendAmbientException() {
        assertThat(new TranscriptionException("test")).isInstanceOf(AmbientException.class);
        assertThat(new ExtractionException("test", "s")).isInstanceOf(AmbientException.class);
        assertThat(new LaunchException("test", "t")).isInstanceOf(AmbientException.class);
        assertThat(new ClarificationException("test")).isInstanceOf(AmbientException.class);
        assertThat(new CaptureException("R", "test")).isInstanceOf(AmbientException.class);
        assertThat(new InvalidFilterException("f", "test")).isInstanceOf(ConfigurationValidationException.class);
        assertThat(new InvalidPatternException("f", "test")).isInstanceOf(ConfigurationValidationException.class);
    }

    @Test
    void allExceptionsShouldBeUnchecked() {
        assertThat(new AmbientException("test")).isInstanceOf(RuntimeException.class);
    }
}
