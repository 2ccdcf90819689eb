package com.phillippitts.ambient.service.command;

import com.phillippitts.ambient.service.launch.Platform;

import java.util.function.Predicate;

/**
 * Builds {@link AppCatalog} instances with a controllable install check for tests outside this package.
 */
public final class TestCatalogs {

    private TestCatalogs() {
    }

    public static AppCatalog catalog(Platform platform, Predicate<String> locationExists) {
        return new AppCatalog(platform, 0.7, locationExists);
    }
}
