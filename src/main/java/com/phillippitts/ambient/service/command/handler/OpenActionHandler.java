package com.phillippitts.ambient.service.command.handler;

import com.phillippitts.ambient.domain.ActionResult;
import com.phillippitts.ambient.domain.FallbackDetails;
import com.phillippitts.ambient.domain.FallbackReason;
import com.phillippitts.ambient.domain.FallbackRequest;
import com.phillippitts.ambient.domain.Intent;
import com.phillippitts.ambient.domain.IntentCategory;
import com.phillippitts.ambient.exception.LaunchException;
import com.phillippitts.ambient.service.command.AppCatalog;
import com.phillippitts.ambient.service.command.AppDefinition;
import com.phillippitts.ambient.service.launch.ExternalLauncher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Opens URLs and applications.
 *
 * <p>Web-only apps open their URL. Desktop apps launch from their platform location when
 * installed; otherwise, and for names the catalog does not know, the result carries a
 * {@code missing_app} fallback request.
 */
@Component
public class OpenActionHandler extends AbstractUriActionHandler {

    private static final Logger LOG = LogManager.getLogger(OpenActionHandler.class);

    private final AppCatalog catalog;

    public OpenActionHandler(ExternalLauncher launcher, AppCatalog catalog) {
        super(launcher);
        this.catalog = Objects.requireNonNull(catalog);
    }

    @Override
    public IntentCategory category() {
        return IntentCategory.OPEN;
    }

    @Override
    public ActionResult run(Intent intent) {
        String url = intent.arg("url");
        if (url != null) {
            return openUri(url, "Opening " + url, List.of("Open " + url), "open url");
        }
        String app = intent.arg("app");
        if (app == null || app.isBlank()) {
            return ActionResult.failed("Which app should I open?", List.of("Say \"open\" followed by an app name"));
        }
        Optional<AppCatalog.AppMatch> match = catalog.resolve(app);
        if (match.isEmpty()) {
            return missingApp(app, null);
        }
        AppDefinition def = match.get().app();
        if (def.isWebOnly()) {
            return openUri(def.webUrl(), "Opening " + def.displayName() + " in the browser",
                    List.of("Open " + def.webUrl()), "open " + def.key());
        }
        if (!catalog.isInstalled(def)) {
            return missingApp(def.displayName(), def.downloadUrl());
        }
        List<String> command = catalog.launchCommand(def);
        try {
            launcher.launch(command);
            return ActionResult.ok("Opening " + def.displayName(), List.of("Switch to " + def.displayName()),
                    Map.of("app", def.key()));
        } catch (SecurityException e) {
            LOG.warn("Launching {} denied: {}", def.key(), e.getMessage());
            return permissionDenied("open " + def.key());
        } catch (LaunchException e) {
            LOG.warn("Launching {} failed: {}", def.key(), e.getMessage());
            return onLaunchFailure("open " + def.key(), e);
        }
    }

    private static ActionResult missingApp(String appName, String downloadUrl) {
        return ActionResult.needsFallback(appName + " is not installed",
                new FallbackRequest(FallbackReason.MISSING_APP, "open " + appName,
                        FallbackDetails.forApp(appName, downloadUrl)));
    }
}
