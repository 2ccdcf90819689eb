package com.phillippitts.ambient.service.audio;

import com.phillippitts.ambient.config.properties.AmbientProperties;
import com.phillippitts.ambient.config.properties.AudioProperties;
import com.phillippitts.ambient.domain.AudioSession;
import com.phillippitts.ambient.exception.CaptureException;
import com.phillippitts.ambient.exception.TranscriptionException;
import com.phillippitts.ambient.service.audio.event.AudioSessionCompletedEvent;
import com.phillippitts.ambient.service.audio.event.CaptureErrorEvent;
import com.phillippitts.ambient.service.events.SensingFailureEvent;
import com.phillippitts.ambient.service.filter.FilterStore;
import com.phillippitts.ambient.service.metrics.AmbientMetrics;
import com.phillippitts.ambient.service.store.RecordStore;
import com.phillippitts.ambient.util.LogSanitizer;
import com.phillippitts.ambient.util.ProcessTimeouts;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Continuous listener that groups voiced audio into utterances and transcribes them.
 *
 * <p>State machine over incoming chunks:
 * <ul>
 *   <li>IDLE + chunk above the volume threshold: open a session (CAPTURING)</li>
 *   <li>CAPTURING: buffer every chunk; each full transcription window is sent to the
 *       {@link Transcriber} and appended to the transcript</li>
 *   <li>CAPTURING + silence for {@code silence-timeout-ms}: seal the session (IDLE)</li>
 * </ul>
 *
 * <p>A sealed session is kept only if its voiced span reaches {@code min-utterance-ms}, its
 * transcript is non-empty and it passes the source's keyword filter. Kept sessions are stored
 * and published as {@link AudioSessionCompletedEvent}. A transcription failure seals the session
 * with whatever text was already recognised and marks it partial.
 *
 * <p>Events are published after the state lock is released.
 */
@Service
public class AudioSentinel {

    private static final Logger LOG = LogManager.getLogger(AudioSentinel.class);
    private static final String SENTINEL = "audio";

    /** Capture state. */
    public enum State { IDLE, CAPTURING }

    private final AudioSource source;
    private final Transcriber transcriber;
    private final FilterStore filters;
    private final AudioProperties props;
    private final AmbientProperties ambient;
    private final RecordStore store;
    private final ApplicationEventPublisher publisher;
    private final AmbientMetrics metrics;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private State state = State.IDLE;
    private Utterance open;
    private volatile Thread reader;

    public AudioSentinel(AudioSource source,
                         Transcriber transcriber,
                         FilterStore filters,
                         AudioProperties props,
                         AmbientProperties ambient,
                         RecordStore store,
                         ApplicationEventPublisher publisher,
                         AmbientMetrics metrics,
                         Clock clock) {
        this.source = Objects.requireNonNull(source);
        this.transcriber = Objects.requireNonNull(transcriber);
        this.filters = Objects.requireNonNull(filters);
        this.props = Objects.requireNonNull(props);
        this.ambient = Objects.requireNonNull(ambient);
        this.store = Objects.requireNonNull(store);
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = Objects.requireNonNull(metrics);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Opens the audio source on a daemon reader thread. Idempotent; a no-op in
     * ultra-lightweight mode.
     */
    public void start() {
        if (ambient.isUltraLightweight()) {
            LOG.info("Ultra-lightweight mode: audio listening disabled");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        Thread t = new Thread(this::readLoop, "audio-sentinel");
        t.setDaemon(true);
        reader = t;
        t.start();
        LOG.info("Audio sentinel started: source='{}', silenceTimeout={}ms, threshold={}",
                source.name(), props.getSilenceTimeoutMs(), props.getVolumeThreshold());
    }

    /**
     * Stops listening and seals any open session. Idempotent.
     */
    public void stop() {
        stop(ProcessTimeouts.AUDIO_THREAD_STOP_TIMEOUT);
    }

    @PreDestroy
    public void shutdown() {
        stop(ProcessTimeouts.AUDIO_THREAD_SHUTDOWN_TIMEOUT);
    }

    private void stop(Duration joinTimeout) {
        boolean wasRunning = running.getAndSet(false);
        Thread t = reader;
        reader = null;
        if (wasRunning) {
            source.close();
            // Join outside the state lock; the reader may be waiting for it
            joinThread(t, joinTimeout.toMillis());
            LOG.info("Audio sentinel stopped");
        }
        publishAll(sealOpenSession());
    }

    public boolean isRunning() {
        return running.get();
    }

    public State state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return view of the utterance being captured, with {@code finalized=false}
     */
    public Optional<AudioSession> currentSession() {
        lock.lock();
        try {
            if (open == null) {
                return Optional.empty();
            }
            return Optional.of(new AudioSession(open.id, open.transcript.toString().trim(), open.sourceName,
                    open.startedAt, null, false));
        } finally {
            lock.unlock();
        }
    }

    public List<AudioSession> recentSessions(int limit) {
        return store.latest(AudioSession.class, limit);
    }

    /**
     * Case-insensitive substring search over stored transcripts, newest first.
     */
    public List<AudioSession> searchTranscripts(String query, int limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        return store.query(AudioSession.class,
                s -> s.transcript().toLowerCase(Locale.ROOT).contains(needle), limit);
    }

    private void readLoop() {
        ThreadContext.put("sentinel", SENTINEL);
        try {
            source.open();
            while (running.get()) {
                AudioChunk chunk = source.read();
                if (chunk == null) {
                    break;
                }
                onChunk(chunk);
            }
        } catch (CaptureException e) {
            LOG.warn("Audio capture failed: reason={}, {}", e.getReason(), e.getMessage());
            publisher.publishEvent(new CaptureErrorEvent(e.getReason(), Instant.now(clock)));
        } catch (SecurityException e) {
            LOG.warn("Microphone access denied: {}", e.getMessage());
            publisher.publishEvent(new CaptureErrorEvent("MIC_PERMISSION_DENIED", Instant.now(clock)));
        } catch (RuntimeException e) {
            LOG.warn("Audio capture failed: {}", e.toString());
            publisher.publishEvent(new CaptureErrorEvent("CAPTURE_ERROR", Instant.now(clock)));
        } finally {
            boolean unexpected = running.getAndSet(false);
            if (unexpected) {
                source.close();
                publishAll(sealOpenSession());
            }
            ThreadContext.remove("sentinel");
        }
    }

    /**
     * Advances the state machine by one chunk. Called by the reader thread; package-private
     * so tests can feed chunks directly.
     */
    void onChunk(AudioChunk chunk) {
        List<Object> events = new ArrayList<>();
        lock.lock();
        try {
            handleChunk(chunk, events);
        } finally {
            lock.unlock();
        }
        publishAll(events);
    }

    private void handleChunk(AudioChunk chunk, List<Object> events) {
        String sourceName = chunk.sourceName();
        if (!filters.isAudioSourceAllowed(sourceName)) {
            return;
        }
        double threshold = filters.volumeThresholdFor(sourceName, props.getVolumeThreshold());
        boolean voiced = chunk.level() > threshold;

        if (state == State.IDLE) {
            if (!voiced) {
                return;
            }
            open = new Utterance(UUID.randomUUID(), sourceName, chunk.capturedAt(),
                    AudioFormat.millisToBytes(props.getTranscribeWindowMs() * 2));
            state = State.CAPTURING;
            LOG.debug("Utterance opened: id={}, source={}, level={}", open.id, sourceName, chunk.level());
        }

        Utterance u = open;
        u.window.write(chunk.pcm());
        if (voiced) {
            u.lastVoicedEnd = chunk.endsAt();
        } else if (Duration.between(u.lastVoicedEnd, chunk.endsAt()).toMillis() >= props.getSilenceTimeoutMs()) {
            detach();
            boolean ok = flush(u, events);
            finish(u, !ok, events);
            return;
        }

        if (u.window.durationMillis() >= props.getTranscribeWindowMs() && !flush(u, events)) {
            detach();
            finish(u, true, events);
        }
    }

    private List<Object> sealOpenSession() {
        List<Object> events = new ArrayList<>();
        lock.lock();
        try {
            Utterance u = open;
            if (u != null) {
                detach();
                boolean ok = flush(u, events);
                finish(u, !ok, events);
            }
        } finally {
            lock.unlock();
        }
        return events;
    }

    private void detach() {
        open = null;
        state = State.IDLE;
    }

    /**
     * Transcribes the buffered window and appends the text.
     *
     * @return false when the transcriber failed
     */
    private boolean flush(Utterance u, List<Object> events) {
        byte[] pcm = u.window.drain();
        if (pcm.length == 0) {
            return true;
        }
        try {
            String text = transcriber.transcribe(pcm);
            if (text != null && !text.isBlank()) {
                if (u.transcript.length() > 0) {
                    u.transcript.append(' ');
                }
                u.transcript.append(text.trim());
            }
            return true;
        } catch (TranscriptionException e) {
            LOG.warn("Transcription failed for utterance {}: {}", u.id, e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("Transcriber error for utterance {}: {}", u.id, e.toString());
        }
        events.add(new SensingFailureEvent(SENTINEL, "TRANSCRIPTION_FAILED", Instant.now(clock)));
        return false;
    }

    private void finish(Utterance u, boolean partial, List<Object> events) {
        long voicedMs = Duration.between(u.startedAt, u.lastVoicedEnd).toMillis();
        if (voicedMs < props.getMinUtteranceMs()) {
            metrics.recordAudioSession("too_short");
            LOG.debug("Utterance {} discarded: voiced {}ms < {}ms", u.id, voicedMs, props.getMinUtteranceMs());
            return;
        }
        String transcript = u.transcript.toString().trim();
        if (transcript.isEmpty()) {
            metrics.recordAudioSession("empty");
            LOG.debug("Utterance {} discarded: empty transcript", u.id);
            return;
        }
        if (!filters.matchesAudioKeywords(u.sourceName, transcript)) {
            metrics.recordAudioSession("keyword_miss");
            return;
        }
        AudioSession session = new AudioSession(u.id, transcript, u.sourceName, u.startedAt, u.lastVoicedEnd, true);
        store.save(session);
        metrics.recordAudioSession(partial ? "partial" : "emitted");
        LOG.info("Audio session sealed: id={}, duration={}ms, partial={}, text='{}'",
                session.id(), voicedMs, partial, LogSanitizer.preview(transcript));
        events.add(new AudioSessionCompletedEvent(session, partial));
    }

    private void publishAll(List<Object> events) {
        for (Object event : events) {
            publisher.publishEvent(event);
        }
    }

    private void joinThread(Thread thread, long timeoutMs) {
        if (thread == null || !thread.isAlive() || thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(timeoutMs);
            if (thread.isAlive()) {
                LOG.warn("Audio reader thread did not terminate within {}ms", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for audio reader thread to terminate");
        }
    }

    private static final class Utterance {
        final UUID id;
        final String sourceName;
        final Instant startedAt;
        final PcmRingBuffer window;
        final StringBuilder transcript = new StringBuilder();
        Instant lastVoicedEnd;

        Utterance(UUID id, String sourceName, Instant startedAt, int windowCapacityBytes) {
            this.id = id;
            this.sourceName = sourceName;
            this.startedAt = startedAt;
            this.lastVoicedEnd = startedAt;
            this.window = new PcmRingBuffer(windowCapacityBytes);
        }
    }
}
