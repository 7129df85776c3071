package de.entwicklertraining.chat.fetcher;

import java.util.Locale;

/**
 * Operating system family of the running process.
 */
public enum Platform {
    MAC,
    LINUX,
    WINDOWS,
    OTHER;

    public static Platform current() {
        return fromOsName(System.getProperty("os.name", ""));
    }

    static Platform fromOsName(String osName) {
        String name = osName.toLowerCase(Locale.ROOT);
        if (name.contains("mac") || name.contains("darwin")) {
            return MAC;
        }
        if (name.contains("linux")) {
            return LINUX;
        }
        if (name.contains("windows")) {
            return WINDOWS;
        }
        return OTHER;
    }

    /**
     * Whether transient "network changed" faults are observed on this platform and worth one retry
     * through an alternate transport.
     */
    public boolean retriesOnNetworkChange() {
        return this == MAC || this == LINUX;
    }
}
