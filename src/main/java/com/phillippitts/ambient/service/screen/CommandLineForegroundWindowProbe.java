package com.phillippitts.ambient.service.screen;

import com.phillippitts.ambient.exception.ExtractionException;
import com.phillippitts.ambient.service.launch.Platform;
import com.phillippitts.ambient.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Queries the foreground window with the platform's scripting tools:
 * osascript on macOS, xdotool on Linux (X11) and PowerShell on Windows.
 *
 * <p>Each call is bounded by {@link ProcessTimeouts#PROBE_TIMEOUT}.
 */
@Component
public class CommandLineForegroundWindowProbe implements ForegroundWindowProbe {

    private static final Logger LOG = LogManager.getLogger(CommandLineForegroundWindowProbe.class);

    private static final List<String> MAC_COMMAND = List.of("osascript",
            "-e", "tell application \"System Events\"",
            "-e", "set frontApp to first application process whose frontmost is true",
            "-e", "set appName to name of frontApp",
            "-e", "try",
            "-e", "set winTitle to name of front window of frontApp",
            "-e", "on error",
            "-e", "set winTitle to \"\"",
            "-e", "end try",
            "-e", "end tell",
            "-e", "return appName & linefeed & winTitle");

    private static final List<String> WINDOWS_COMMAND = List.of("powershell", "-NoProfile", "-Command",
            "$sig='[DllImport(\"user32.dll\")] public static extern IntPtr GetForegroundWindow();';"
                    + "$w=Add-Type -MemberDefinition $sig -Name Fg -Namespace Ambient -PassThru;"
                    + "$h=$w::GetForegroundWindow();"
                    + "$p=Get-Process | Where-Object { $_.MainWindowHandle -eq $h } | Select-Object -First 1;"
                    + "if ($p) { $p.ProcessName; $p.MainWindowTitle }");

    private final Platform platform;

    public CommandLineForegroundWindowProbe(Platform platform) {
        this.platform = Objects.requireNonNull(platform);
    }

    @Override
    public ForegroundWindow probe() {
        return switch (platform) {
            case MAC -> twoLines(run(MAC_COMMAND));
            case WINDOWS -> twoLines(run(WINDOWS_COMMAND));
            case LINUX -> probeX11();
            case OTHER -> throw new ExtractionException("Foreground window probing not supported", platform.name());
        };
    }

    private ForegroundWindow probeX11() {
        String title = run(List.of("xdotool", "getactivewindow", "getwindowname")).trim();
        String pid = run(List.of("xdotool", "getactivewindow", "getwindowpid")).trim();
        String app = title;
        if (!pid.isEmpty()) {
            try {
                app = Files.readString(Path.of("/proc", pid, "comm"), StandardCharsets.UTF_8).trim();
            } catch (IOException e) {
                LOG.debug("Could not read process name for pid {}: {}", pid, e.toString());
            }
        }
        if (title.isEmpty() && app.isEmpty()) {
            return null;
        }
        return new ForegroundWindow(app, title);
    }

    private static ForegroundWindow twoLines(String output) {
        String[] lines = output.split("\\R", 2);
        String app = lines.length > 0 ? lines[0].trim() : "";
        if (app.isEmpty()) {
            return null;
        }
        String title = lines.length > 1 ? lines[1].trim() : "";
        return new ForegroundWindow(app, title);
    }

    private String run(List<String> command) {
        String tool = command.get(0);
        Process process;
        try {
            process = new ProcessBuilder(command).redirectErrorStream(false).start();
        } catch (IOException e) {
            throw new ExtractionException("Failed to start " + tool, platform.name(), e);
        }
        try {
            if (!process.waitFor(ProcessTimeouts.PROBE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ExtractionException(tool + " timed out after "
                        + ProcessTimeouts.PROBE_TIMEOUT.toMillis() + "ms", platform.name());
            }
            if (process.exitValue() != 0) {
                throw new ExtractionException(tool + " exited with code " + process.exitValue(), platform.name());
            }
            return new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ExtractionException("Interrupted while running " + tool, platform.name(), e);
        } catch (IOException e) {
            throw new ExtractionException("Failed to read output of " + tool, platform.name(), e);
        }
    }
}
