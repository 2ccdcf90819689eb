package com.phillippitts.ambient.service.command;

import com.phillippitts.ambient.service.launch.Platform;

import java.util.List;
import java.util.Map;

/**
 * A known application.
 *
 * @param key canonical lower-case name, e.g. {@code chrome}
 * @param displayName name shown to the user
 * @param aliases other spoken names
 * @param locations install location per platform: an absolute path, or a bare command name
 *                  resolved on {@code PATH}
 * @param webUrl URL of the web version; a catalog entry with no locations is web-only
 * @param downloadUrl official download page used by install guidance
 */
public record AppDefinition(String key,
                            String displayName,
                            List<String> aliases,
                            Map<Platform, String> locations,
                            String webUrl,
                            String downloadUrl) {

    public AppDefinition {
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        locations = locations == null ? Map.of() : Map.copyOf(locations);
    }

    public boolean isWebOnly() {
        return locations.isEmpty() && webUrl != null;
    }
}
