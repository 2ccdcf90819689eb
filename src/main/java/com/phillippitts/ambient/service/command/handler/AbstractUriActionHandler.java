package com.phillippitts.ambient.service.command.handler;

import com.phillippitts.ambient.domain.ActionResult;
import com.phillippitts.ambient.domain.FallbackDetails;
import com.phillippitts.ambient.domain.FallbackReason;
import com.phillippitts.ambient.domain.FallbackRequest;
import com.phillippitts.ambient.exception.LaunchException;
import com.phillippitts.ambient.service.launch.ExternalLauncher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base for handlers whose action is opening a URI.
 *
 * <p>A {@link SecurityException} from the launcher becomes a {@code missing_permission} fallback;
 * a {@link LaunchException} becomes whatever {@link #onLaunchFailure} returns, by default a
 * {@code missing_script} fallback for the action.
 */
public abstract class AbstractUriActionHandler implements ActionHandler {

    private static final Logger LOG = LogManager.getLogger(AbstractUriActionHandler.class);

    protected final ExternalLauncher launcher;

    protected AbstractUriActionHandler(ExternalLauncher launcher) {
        this.launcher = Objects.requireNonNull(launcher);
    }

    protected ActionResult openUri(String uri, String message, List<String> nextSteps, String actionName) {
        try {
            launcher.openUri(uri);
            return ActionResult.ok(message, nextSteps, Map.of("uri", uri));
        } catch (SecurityException e) {
            LOG.warn("Opening {} denied: {}", actionName, e.getMessage());
            return permissionDenied(actionName);
        } catch (LaunchException e) {
            LOG.warn("Opening {} failed: {}", actionName, e.getMessage());
            return onLaunchFailure(actionName, e);
        }
    }

    protected ActionResult onLaunchFailure(String actionName, LaunchException e) {
        return ActionResult.needsFallback("Could not complete " + actionName,
                new FallbackRequest(FallbackReason.MISSING_SCRIPT, actionName, FallbackDetails.forAction(actionName)));
    }

    protected static ActionResult permissionDenied(String actionName) {
        return ActionResult.needsFallback("Permission denied for " + actionName,
                new FallbackRequest(FallbackReason.MISSING_PERMISSION, actionName,
                        FallbackDetails.forPermission("automation")));
    }

    protected static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
