package com.phillippitts.ambient.service.launch;

import com.phillippitts.ambient.exception.LaunchException;
import com.phillippitts.ambient.util.LogSanitizer;
import com.phillippitts.ambient.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.awt.Desktop;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Default {@link ExternalLauncher}: uses {@link Desktop} when the JVM supports it and falls back
 * to the platform opener ({@code open}, {@code xdg-open}, {@code cmd /c start}) otherwise,
 * e.g. when running headless.
 */
@Component
public class DesktopExternalLauncher implements ExternalLauncher {

    private static final Logger LOG = LogManager.getLogger(DesktopExternalLauncher.class);

    private final Platform platform;

    public DesktopExternalLauncher(Platform platform) {
        this.platform = Objects.requireNonNull(platform);
    }

    @Override
    public void openUri(String uri) {
        URI parsed;
        try {
            parsed = new URI(uri);
        } catch (URISyntaxException e) {
            throw new LaunchException("Malformed URI", uri, e);
        }
        if (tryDesktop(parsed)) {
            LOG.info("Opened URI via Desktop: scheme={}", parsed.getScheme());
            return;
        }
        launch(openerCommand(uri));
    }

    @Override
    public void launch(List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new LaunchException("Empty launch command", "<none>");
        }
        String target = String.join(" ", command);
        Process process;
        try {
            process = new ProcessBuilder(command).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new LaunchException("Failed to start process", LogSanitizer.truncate(target, 120), e);
        }
        try {
            if (process.waitFor(ProcessTimeouts.LAUNCH_EXIT_CHECK_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)
                    && process.exitValue() != 0) {
                throw new LaunchException("Launcher exited with code " + process.exitValue(),
                        LogSanitizer.truncate(target, 120));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LaunchException("Interrupted while launching", LogSanitizer.truncate(target, 120), e);
        }
        LOG.info("Launched: {}", LogSanitizer.truncate(target, 120));
    }

    private boolean tryDesktop(URI uri) {
        if (!Desktop.isDesktopSupported()) {
            return false;
        }
        Desktop desktop = Desktop.getDesktop();
        try {
            if ("mailto".equalsIgnoreCase(uri.getScheme()) && desktop.isSupported(Desktop.Action.MAIL)) {
                desktop.mail(uri);
                return true;
            }
            if (desktop.isSupported(Desktop.Action.BROWSE)) {
                desktop.browse(uri);
                return true;
            }
        } catch (IOException e) {
            LOG.debug("Desktop could not open {}: {}", uri.getScheme(), e.toString());
        } catch (UnsupportedOperationException e) {
            LOG.debug("Desktop action unsupported for scheme {}", uri.getScheme());
        }
        return false;
    }

    private List<String> openerCommand(String uri) {
        return switch (platform) {
            case MAC -> List.of("open", uri);
            case WINDOWS -> List.of("cmd", "/c", "start", "\"\"", uri);
            case LINUX, OTHER -> List.of("xdg-open", uri);
        };
    }
}
