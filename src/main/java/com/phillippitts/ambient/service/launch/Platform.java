package com.phillippitts.ambient.service.launch;

import java.util.Locale;

/** Desktop operating system family. */
public enum Platform {
    MAC,
    WINDOWS,
    LINUX,
    OTHER;

    public static Platform current() {
        return fromOsName(System.getProperty("os.name", ""));
    }

    static Platform fromOsName(String osName) {
        String os = osName == null ? "" : osName.toLowerCase(Locale.ROOT);
        if (os.contains("mac") || os.contains("darwin")) {
            return MAC;
        }
        if (os.contains("win")) {
            return WINDOWS;
        }
        if (os.contains("linux") || os.contains("nux") || os.contains("bsd")) {
            return LINUX;
        }
        return OTHER;
    }
}
