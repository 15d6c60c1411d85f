package io.gearledger.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class SyncConfig {
    public static final String DEFAULT_ROOT = ".gearledger/data";
    public static final String DB_FILE_NAME = "gearledger.db";
    public static final String SETTINGS_FILE_NAME = "gearledger-settings.json";

    private final Path rootDir;

    public SyncConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static SyncConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(System.getProperty("user.home")).resolve(DEFAULT_ROOT)
                : Paths.get(root);
        return new SyncConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve(DB_FILE_NAME);
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }
}
