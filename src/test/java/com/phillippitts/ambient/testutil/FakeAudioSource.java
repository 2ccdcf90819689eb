package com.phillippitts.ambient.testutil;

import com.phillippitts.ambient.exception.CaptureException;
import com.phillippitts.ambient.service.audio.AudioChunk;
import com.phillippitts.ambient.service.audio.AudioSource;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Audio source fed by the test. {@link #read()} blocks until a chunk is offered or the
 * source is closed.
 */
public class FakeAudioSource implements AudioSource {

    private final LinkedBlockingQueue<AudioChunk> chunks = new LinkedBlockingQueue<>();
    private volatile boolean closed = true;
    private volatile String openFailureReason;
    private volatile int openCount;

    public void offer(AudioChunk chunk) {
        chunks.add(chunk);
    }

    public void failOpenWith(String reason) {
        this.openFailureReason = reason;
    }

    public boolean isClosed() {
        return closed;
    }

    public int openCount() {
        return openCount;
    }

    @Override
    public String name() {
        return "microphone";
    }

    @Override
    public void open() {
        openCount++;
        if (openFailureReason != null) {
            throw new CaptureException(openFailureReason, "Simulated open failure");
        }
        closed = false;
    }

    @Override
    public AudioChunk read() {
        while (!closed) {
            try {
                AudioChunk c = chunks.poll(20, TimeUnit.MILLISECONDS);
                if (c != null) {
                    return c;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        }
        return null;
    }

    @Override
    public void close() {
        closed = true;
    }
}
