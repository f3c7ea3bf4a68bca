package de.bsommerfeld.marketscope.core.util;

import de.bsommerfeld.marketscope.core.config.ApplicationMode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves where MarketScope keeps its database file and {@code config.toml}.
 *
 * <p>
 * In {@link ApplicationMode#PROD} this is the platform's native application
 * data directory:
 * <ul>
 * <li><strong>macOS</strong>:
 * {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}} (fallback:
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/{appName}} (fallback:
 * {@code ~/.local/share})</li>
 * </ul>
 * In {@link ApplicationMode#TEST} every call hands out a fresh temporary
 * directory so that no run ever touches the user's real store.
 */
public final class StorageUtils {

    public static final String APP_NAME = "marketscope";

    private StorageUtils() {
    }

    /**
     * Returns the platform-specific application data directory. The directory
     * is not created.
     *
     * @param appName application identifier used as the directory name
     */
    public static Path getAppDataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(System.getProperty("user.home"), "Library", "Application Support", appName);
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            return appData != null
                    ? Paths.get(appData, appName)
                    : Paths.get(System.getProperty("user.home"), "AppData", "Roaming", appName);
        }
        String xdgData = System.getenv("XDG_DATA_HOME");
        if (xdgData != null && !xdgData.isEmpty()) {
            return Paths.get(xdgData, appName);
        }
        return Paths.get(System.getProperty("user.home"), ".local", "share", appName);
    }

    /**
     * Returns an existing data directory for the given mode, creating it if
     * needed.
     *
     * @throws UncheckedIOException if the directory cannot be created
     */
    public static Path resolveDataDir(ApplicationMode mode) {
        try {
            if (mode.isTest()) {
                return Files.createTempDirectory(APP_NAME + "-test-");
            }
            return ensureDirectory(getAppDataDir(APP_NAME));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot prepare data directory for mode " + mode, e);
        }
    }

    /** Creates {@code dir} and its parents if missing, then returns it. */
    public static Path ensureDirectory(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            Files.createDirectories(dir);
        }
        return dir;
    }
}
