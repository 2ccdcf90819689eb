package com.phillippitts.ambient.util;

import java.time.Duration;

/**
 * Standard timeout values for helper processes and sentinel threads.
 *
 * <p>Used by {@link com.phillippitts.ambient.service.screen.CommandLineForegroundWindowProbe}
 * for osascript/xdotool/PowerShell calls, by
 * {@link com.phillippitts.ambient.service.audio.AudioSentinel} for its reader thread, and by
 * {@link com.phillippitts.ambient.service.launch.DesktopExternalLauncher} for launch commands.
 */
public final class ProcessTimeouts {

    /**
     * Upper bound for a single foreground-window probe. A probe that overruns is killed and
     * the sampling tick is reported as a transient failure.
     */
    public static final Duration PROBE_TIMEOUT = Duration.ofSeconds(3);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Time allowed for a launch command to report an immediate failure exit code.
     * Processes still running afterwards are considered launched.
     */
    public static final Duration LAUNCH_EXIT_CHECK_TIMEOUT = Duration.ofMillis(1500);

    /**
     * Timeout for the audio reader thread to terminate during a normal stop.
     *
     * <p>Longer than a chunk read because the line may be blocked on I/O.
     */
    public static final Duration AUDIO_THREAD_STOP_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Timeout for the audio reader thread during container shutdown (best-effort).
     */
    public static final Duration AUDIO_THREAD_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
