package com.trackforge.util;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Unified path management for TrackForge application data.
 * All application data is stored in a single location:
 * - Windows: AppData/Local/TrackForge/
 * - Unix/Linux: ~/.local/share/TrackForge/
 * - macOS: ~/Library/Application Support/TrackForge/
 * The {@code trackforge.home} system property overrides the location.
 */
public class PathManager {

    public static final String HOME_PROPERTY = "trackforge.home";
    private static final String APP_NAME = "TrackForge";

    /**
     * Get the base application data directory
     * @return Path to the base application directory
     */
    public static Path getBaseDir() {
        Path baseDir = determineBaseDir();
        try {
            Files.createDirectories(baseDir);
        } catch (Exception e) {
            throw new RuntimeException("Failed to create base application directory: " + baseDir, e);
        }
        return baseDir;
    }

    /**
     * Get the settings directory
     * @return Path to the settings directory
     */
    public static Path getSettingsDir() {
        return getSubDir("settings");
    }

    /**
     * Get the logs directory
     * @return Path to the logs directory
     */
    public static Path getLogsDir() {
        return getSubDir("logs");
    }

    /**
     * Get the settings file path
     * @return Path to settings.json
     */
    public static Path getSettingsFile() {
        return getSettingsDir().resolve("settings.json");
    }

    private static Path getSubDir(String subDirName) {
        Path subDir = getBaseDir().resolve(subDirName);
        try {
            Files.createDirectories(subDir);
        } catch (Exception e) {
            throw new RuntimeException("Failed to create subdirectory: " + subDir, e);
        }
        return subDir;
    }

    /**
     * Determine the base directory based on the override property or the operating system
     */
    private static Path determineBaseDir() {
        String override = System.getProperty(HOME_PROPERTY);
        if (override != null && !override.isEmpty()) {
            return Paths.get(override);
        }

        String osName = System.getProperty("os.name").toLowerCase(Locale.ROOT);

        if (osName.contains("win")) {
            String localAppData = System.getenv("LOCALAPPDATA");
            if (localAppData != null && !localAppData.isEmpty()) {
                return Paths.get(localAppData, APP_NAME);
            } else {
                return Paths.get(System.getProperty("user.home"), "AppData", "Local", APP_NAME);
            }
        } else if (osName.contains("mac")) {
            return Paths.get(System.getProperty("user.home"), "Library", "Application Support", APP_NAME);
        } else {
            return Paths.get(System.getProperty("user.home"), ".local", "share", APP_NAME);
        }
    }

    public static boolean isWindows() {
        return System.getProperty("os.name").toLowerCase(Locale.ROOT).contains("win");
    }
}
