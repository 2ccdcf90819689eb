package com.phillippitts.ambient.service.audio;

import com.phillippitts.ambient.config.properties.AmbientProperties;
import com.phillippitts.ambient.config.properties.AudioProperties;
import com.phillippitts.ambient.domain.AudioFilter;
import com.phillippitts.ambient.domain.AudioSession;
import com.phillippitts.ambient.service.audio.event.AudioSessionCompletedEvent;
import com.phillippitts.ambient.service.audio.event.CaptureErrorEvent;
import com.phillippitts.ambient.service.events.SensingFailureEvent;
import com.phillippitts.ambient.service.filter.FilterStore;
import com.phillippitts.ambient.service.metrics.AmbientMetrics;
import com.phillippitts.ambient.service.store.InMemoryRecordStore;
import com.phillippitts.ambient.testutil.EventCapturingPublisher;
import com.phillippitts.ambient.testutil.FakeAudioSource;
import com.phillippitts.ambient.testutil.FakeTranscriber;
import com.phillippitts.ambient.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class AudioSentinelTest {

    private static final Instant T0 = Instant.parse("2024-03-04T10:00:00Z");
    private static final int CHUNK_MS = 100;

    private FakeAudioSource source;
    private FakeTranscriber transcriber;
    private FilterStore filters;
    private AmbientProperties ambient;
    private EventCapturingPublisher publisher;
    private SimpleMeterRegistry registry;
    private AudioSentinel sentinel;
    private long offsetMs;

    @BeforeEach
    void setUp() {
        source = new FakeAudioSource();
        transcriber = new FakeTranscriber();
        filters = new FilterStore();
        ambient = new AmbientProperties();
        publisher = new EventCapturingPublisher();
        registry = new SimpleMeterRegistry();
        sentinel = newSentinel();
        offsetMs = 0;
    }

    @AfterEach
    void tearDown() {
        sentinel.shutdown();
    }

    private AudioSentinel newSentinel() {
        // silence 500ms, min utterance 400ms, threshold 0.1, transcribe window 1000ms
        AudioProperties props = new AudioProperties(500, 400, 0.1, CHUNK_MS, 1000, "microphone", null);
        return new AudioSentinel(source, transcriber, filters, props, ambient, new InMemoryRecordStore(20),
                publisher, new AmbientMetrics(registry), new MutableClock(T0));
    }

    @Test
    void shouldSealSessionAfterSilenceTimeout() {
        transcriber.then("remind me to call alice");

        feed(6, 0.4);
        assertThat(sentinel.state()).isEqualTo(AudioSentinel.State.CAPTURING);
        feed(5, 0.01);

        assertThat(sentinel.state()).isEqualTo(AudioSentinel.State.IDLE);
        List<AudioSessionCompletedEvent> events = publisher.eventsOf(AudioSessionCompletedEvent.class);
        assertThat(events).hasSize(1);
        AudioSession session = events.get(0).session();
        assertThat(events.get(0).partial()).isFalse();
        assertThat(session.finalized()).isTrue();
        assertThat(session.transcript()).isEqualTo("remind me to call alice");
        assertThat(session.startTime()).isEqualTo(T0);
        assertThat(session.endTime()).isEqualTo(T0.plusMillis(600));
        assertThat(sentinel.recentSessions(5)).containsExactly(session);
        assertThat(registry.counter("ambient.audio.sessions", "outcome", "emitted").count()).isEqualTo(1.0);
    }

    @Test
    void shouldIgnoreSilenceWhileIdle() {
        feed(20, 0.02);

        assertThat(sentinel.state()).isEqualTo(AudioSentinel.State.IDLE);
        assertThat(sentinel.currentSession()).isEmpty();
        assertThat(transcriber.calls()).isZero();
    }

    @Test
    void shouldDiscardUtteranceShorterThanMinimum() {
        transcriber.orElse("uh");

        feed(2, 0.5);
        feed(5, 0.0);

        assertThat(publisher.eventsOf(AudioSessionCompletedEvent.class)).isEmpty();
        assertThat(registry.counter("ambient.audio.sessions", "outcome", "too_short").count()).isEqualTo(1.0);
    }

    @Test
    void shouldDiscardEmptyTranscript() {
        feed(6, 0.5);
        feed(5, 0.0);

        assertThat(publisher.eventsOf(AudioSessionCompletedEvent.class)).isEmpty();
        assertThat(registry.counter("ambient.audio.sessions", "outcome", "empty").count()).isEqualTo(1.0);
    }

    @Test
    void shouldTranscribeFullWindowsWhileSpeechContinues() {
        transcriber.then("first part").then("second part");

        feed(10, 0.5);
        assertThat(transcriber.calls()).isEqualTo(1);
        assertThat(sentinel.currentSession())
                .hasValueSatisfying(s -> {
                    assertThat(s.transcript()).isEqualTo("first part");
                    assertThat(s.finalized()).isFalse();
                });

        feed(3, 0.5);
        feed(5, 0.0);

        AudioSession sealed = publisher.eventsOf(AudioSessionCompletedEvent.class).get(0).session();
        assertThat(sealed.transcript()).isEqualTo("first part second part");
    }

    @Test
    void shouldSealPartialSessionWhenTranscriberFails() {
        // Arrange
        transcriber.then("first part").failFromCall(1);

        // Act
        feed(13, 0.5);
        feed(5, 0.0);

        // Assert
        assertThat(publisher.eventsOf(SensingFailureEvent.class))
                .extracting(SensingFailureEvent::reason)
                .containsExactly("TRANSCRIPTION_FAILED");
        List<AudioSessionCompletedEvent> completed = publisher.eventsOf(AudioSessionCompletedEvent.class);
        assertThat(completed).hasSize(1);
        assertThat(completed.get(0).partial()).isTrue();
        assertThat(completed.get(0).session().transcript()).isEqualTo("first part");
        assertThat(registry.counter("ambient.audio.sessions", "outcome", "partial").count()).isEqualTo(1.0);
    }

    @Test
    void shouldHonourPerSourceThresholdAndBlacklist() {
        filters.addAudioFilter(new AudioFilter("microphone", false, false, 0.6, List.of()));
        feed(6, 0.5);
        assertThat(sentinel.state()).isEqualTo(AudioSentinel.State.IDLE);

        filters.removeAudioFilter("microphone");
        filters.addAudioFilter(new AudioFilter("microphone", false, true, null, List.of()));
        feed(6, 0.9);
        assertThat(sentinel.state()).isEqualTo(AudioSentinel.State.IDLE);
    }

    @Test
    void shouldDropSessionsMissingSourceKeywords() {
        filters.addAudioFilter(new AudioFilter("microphone", false, false, null, List.of("deadline")));
        transcriber.then("what's for lunch").then("the deadline is friday");

        // Short enough that each session is transcribed once, on seal
        feed(5, 0.5);
        feed(5, 0.0);
        feed(5, 0.5);
        feed(5, 0.0);

        assertThat(publisher.eventsOf(AudioSessionCompletedEvent.class))
                .extracting(e -> e.session().transcript())
                .containsExactly("the deadline is friday");
        assertThat(sentinel.searchTranscripts("DEADLINE", 5)).hasSize(1);
        assertThat(sentinel.searchTranscripts(" ", 5)).isEmpty();
    }

    @Test
    void stopShouldSealOpenSession() {
        transcriber.orElse("half a sentence");
        feed(6, 0.5);

        sentinel.stop();

        assertThat(sentinel.state()).isEqualTo(AudioSentinel.State.IDLE);
        assertThat(publisher.eventsOf(AudioSessionCompletedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.session().transcript()).isEqualTo("half a sentence"));
    }

    @Test
    void shouldCaptureFromSourceOnReaderThread() {
        transcriber.orElse("open chrome");

        sentinel.start();
        sentinel.start();
        assertThat(sentinel.isRunning()).isTrue();
        for (int i = 0; i < 6; i++) {
            source.offer(chunk(0.5));
        }
        for (int i = 0; i < 5; i++) {
            source.offer(chunk(0.0));
        }

        await().atMost(Duration.ofSeconds(5))
                .until(() -> !publisher.eventsOf(AudioSessionCompletedEvent.class).isEmpty());
        assertThat(source.openCount()).isEqualTo(1);

        sentinel.stop();
        assertThat(sentinel.isRunning()).isFalse();
        assertThat(source.isClosed()).isTrue();
    }

    @Test
    void shouldPublishCaptureErrorWhenMicrophoneUnavailable() {
        source.failOpenWith("MIC_UNAVAILABLE");

        sentinel.start();

        await().atMost(Duration.ofSeconds(5))
                .until(() -> !publisher.eventsOf(CaptureErrorEvent.class).isEmpty());
        assertThat(publisher.eventsOf(CaptureErrorEvent.class).get(0).reason()).isEqualTo("MIC_UNAVAILABLE");
        await().atMost(Duration.ofSeconds(5)).until(() -> !sentinel.isRunning());
    }

    @Test
    void startShouldBeNoOpInUltraLightweightMode() {
        ambient.setUltraLightweight(true);

        sentinel.start();

        assertThat(sentinel.isRunning()).isFalse();
        assertThat(source.openCount()).isZero();
    }

    private void feed(int chunks, double level) {
        for (int i = 0; i < chunks; i++) {
            sentinel.onChunk(chunk(level));
        }
    }

    private AudioChunk chunk(double level) {
        AudioChunk c = new AudioChunk("microphone", new byte[AudioFormat.millisToBytes(CHUNK_MS)], level,
                T0.plusMillis(offsetMs));
        offsetMs += CHUNK_MS;
        return c;
    }
}
