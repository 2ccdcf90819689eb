package com.phillippitts.ambient.testutil;

import com.phillippitts.ambient.exception.TranscriptionException;
import com.phillippitts.ambient.service.audio.Transcriber;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Transcriber returning scripted text per call. Once the script is exhausted it returns
 * the default text. Set {@code failFromCall} to make every call from that index on fail.
 */
public class FakeTranscriber implements Transcriber {

    private final Deque<String> script = new ArrayDeque<>();
    private final AtomicInteger calls = new AtomicInteger();
    private volatile String defaultText = "";
    private volatile int failFromCall = Integer.MAX_VALUE;

    public FakeTranscriber then(String text) {
        script.addLast(text);
        return this;
    }

    public FakeTranscriber orElse(String text) {
        this.defaultText = text;
        return this;
    }

    public FakeTranscriber failFromCall(int index) {
        this.failFromCall = index;
        return this;
    }

    @Override
    public synchronized String transcribe(byte[] pcm) {
        int call = calls.getAndIncrement();
        if (call >= failFromCall) {
            throw new TranscriptionException("Simulated engine failure", "fake");
        }
        String next = script.pollFirst();
        return next != null ? next : defaultText;
    }

    public int calls() {
        return calls.get();
    }
}
