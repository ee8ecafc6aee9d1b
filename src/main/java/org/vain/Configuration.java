package org.vain;

/**
 * Build-time constants of the compiler.
 */
public final class Configuration {

    public static final String vainVersion = "0.1.0";
    public static final String defaultConfigFileName = ".vain.yaml";

    // Prevent instantiation
    private Configuration() {
    }

    public static String versionBanner() {
        return "vain " + vainVersion + " (Java " + System.getProperty("java.version") + ")";
    }
}
