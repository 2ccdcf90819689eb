package com.phillippitts.ambient.service.events;

import com.phillippitts.ambient.service.audio.event.CaptureErrorEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ErrorEventsListenerTest {

    @Test
    void throttlesRepeatedKeys() {
        ErrorEventsListener listener = new ErrorEventsListener();

        assertThat(listener.shouldLog("sensing-screen-PROBE_FAILED")).isTrue();
        assertThat(listener.shouldLog("sensing-screen-PROBE_FAILED")).isFalse();
        // distinct keys are throttled independently
        assertThat(listener.shouldLog("capture-MIC_UNAVAILABLE")).isTrue();
    }

    @Test
    void handlersDoNotThrow() {
        ErrorEventsListener listener = new ErrorEventsListener();

        assertThatCode(() -> {
            listener.onCaptureError(new CaptureErrorEvent("MIC_PERMISSION_DENIED", Instant.now()));
            listener.onSensingFailure(new SensingFailureEvent("screen", "EXTRACTION_FAILED", Instant.now()));
            listener.onSensingFailure(new SensingFailureEvent("audio", "TRANSCRIPTION_FAILED", Instant.now()));
        }).doesNotThrowAnyException();
    }
}
