package com.largomodo.retrohub.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves the per-user configuration directory the way desktop platforms expect it.
 * <ul>
 *   <li>Windows: {@code %APPDATA%}</li>
 *   <li>macOS: {@code ~/Library/Application Support}</li>
 *   <li>Linux/Unix: {@code $XDG_CONFIG_HOME}, else {@code ~/.config}</li>
 * </ul>
 * Falls back to the working directory when neither the environment nor a home directory
 * gives an answer.
 */
public class ConfigDirectories {

    public static final String APP_DIR_NAME = "retro-gaming-hub";
    public static final String LIBRARY_FILE_NAME = "library.json";

    private ConfigDirectories() {
        // Static utility class - prevent instantiation
    }

    /**
     * Default snapshot location: {@code <user config dir>/retro-gaming-hub/library.json}.
     */
    public static Path defaultLibraryFile() {
        return userConfigDir(System.getProperty("os.name", ""), System.getenv(), System.getProperty("user.home"))
                .resolve(APP_DIR_NAME)
                .resolve(LIBRARY_FILE_NAME);
    }

    /**
     * Resolve the user configuration directory from explicit inputs (testable without touching
     * the real environment).
     *
     * @param osName   Value of the {@code os.name} system property
     * @param env      Environment variables
     * @param userHome Home directory, may be null or blank
     * @return Configuration directory, or "." when nothing is known
     */
    static Path userConfigDir(String osName, Map<String, String> env, String userHome) {
        String os = osName.toLowerCase(Locale.ROOT);
        boolean hasHome = userHome != null && !userHome.isBlank();

        if (os.contains("win")) {
            String appData = env.get("APPDATA");
            if (appData != null && !appData.isBlank()) {
                return Paths.get(appData);
            }
        } else if (os.contains("mac")) {
            if (hasHome) {
                return Paths.get(userHome, "Library", "Application Support");
            }
        } else {
            String xdg = env.get("XDG_CONFIG_HOME");
            // XDG Base Directory rules: a relative value is invalid and ignored
            if (xdg != null && !xdg.isBlank() && Paths.get(xdg).isAbsolute()) {
                return Paths.get(xdg);
            }
            if (hasHome) {
                return Paths.get(userHome, ".config");
            }
        }
        return Paths.get(".");
    }
}
