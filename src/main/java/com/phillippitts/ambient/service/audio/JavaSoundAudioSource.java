package com.phillippitts.ambient.service.audio;

import com.phillippitts.ambient.config.properties.AudioProperties;
import com.phillippitts.ambient.exception.CaptureException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Java Sound microphone source producing PCM16LE mono 16 kHz chunks of
 * {@code ambient.audio.chunk-millis} each.
 *
 * <p>Default {@link AudioSource}; tests replace it with a {@code @Primary} fake or drive the
 * sentinel directly.
 */
@Component
public class JavaSoundAudioSource implements AudioSource {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioSource.class);

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final AudioProperties props;
    private final DataLineProvider provider;
    private final Clock clock;

    private volatile TargetDataLine line;
    private volatile boolean closed = true;

    @Autowired
    public JavaSoundAudioSource(AudioProperties props, Clock clock) {
        this(props, defaultProvider(), clock);
    }

    // Package-private for tests
    JavaSoundAudioSource(AudioProperties props, DataLineProvider provider, Clock clock) {
        this.props = Objects.requireNonNull(props);
        this.provider = Objects.requireNonNull(provider);
        this.clock = Objects.requireNonNull(clock);
    }

    private static DataLineProvider defaultProvider() {
        return (format, device) -> {
            TargetDataLine found = null;
            if (device.isPresent()) {
                for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        found = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
            }
            if (found == null) {
                found = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            found.open(format);
            return found;
        };
    }

    @Override
    public String name() {
        return props.getSourceName();
    }

    @Override
    public void open() {
        javax.sound.sampled.AudioFormat fmt = new javax.sound.sampled.AudioFormat(
                AudioFormat.SAMPLE_RATE,
                AudioFormat.BITS_PER_SAMPLE,
                AudioFormat.CHANNELS,
                AudioFormat.SIGNED,
                AudioFormat.BIG_ENDIAN
        );
        try {
            TargetDataLine opened = provider.open(fmt, Optional.ofNullable(props.getDeviceName()));
            opened.start();
            line = opened;
            closed = false;
            LOG.info("Audio source '{}' opened: device='{}', chunk={}ms", name(),
                    props.getDeviceName() != null ? props.getDeviceName() : "default", props.getChunkMillis());
        } catch (LineUnavailableException e) {
            throw new CaptureException("MIC_UNAVAILABLE", "Microphone unavailable: " + e.getMessage(), e);
        } catch (SecurityException e) {
            throw new CaptureException("MIC_PERMISSION_DENIED", "Microphone access denied", e);
        } catch (IllegalArgumentException e) {
            throw new CaptureException("MIC_UNAVAILABLE", "No line supports the capture format", e);
        }
    }

    @Override
    public AudioChunk read() {
        TargetDataLine current = line;
        if (closed || current == null) {
            return null;
        }
        byte[] buf = new byte[AudioFormat.millisToBytes(props.getChunkMillis())];
        Instant startedAt = Instant.now(clock);
        int n;
        try {
            n = current.read(buf, 0, buf.length);
        } catch (RuntimeException e) {
            if (closed) {
                return null;
            }
            throw new CaptureException("CAPTURE_ERROR", "Audio read failed: " + e.getMessage(), e);
        }
        if (closed) {
            return null;
        }
        byte[] pcm = n == buf.length ? buf : Arrays.copyOf(buf, Math.max(n, 0));
        return new AudioChunk(name(), pcm, AudioLevelMeter.level(pcm, pcm.length), startedAt);
    }

    @Override
    public void close() {
        closed = true;
        TargetDataLine current = line;
        line = null;
        if (current == null) {
            return;
        }
        try {
            current.stop();
            current.close();
        } catch (RuntimeException e) {
            LOG.debug("Error closing audio line: {}", e.toString());
        }
    }
}
