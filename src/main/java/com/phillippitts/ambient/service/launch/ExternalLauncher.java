package com.phillippitts.ambient.service.launch;

import com.phillippitts.ambient.exception.LaunchException;

import java.util.List;

/**
 * Side-effect boundary for opening URIs and starting desktop applications.
 *
 * <p>Implementations throw {@link LaunchException} when the target cannot be opened and let
 * {@link SecurityException} propagate when the OS denies the operation.
 */
public interface ExternalLauncher {

    /**
     * Opens a URI with the system handler ({@code https:}, {@code mailto:}, store schemes).
     */
    void openUri(String uri);

    /**
     * Starts an application command, e.g. {@code [open, -a, /Applications/Spotify.app]}.
     */
    void launch(List<String> command);
}
