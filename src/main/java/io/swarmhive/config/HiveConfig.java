package io.swarmhive.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class HiveConfig {
    public static final String HIVE_DIR = ".hive";
    public static final String DB_FILE_NAME = "swarmhive.db";
    public static final String EXPORT_FILE_NAME = "issues.jsonl";
    public static final String SETTINGS_FILE_NAME = "hive-settings.json";

    private final Path rootDir;
    private final String projectKey;

    public HiveConfig(Path rootDir, String projectKey) {
        this.rootDir = rootDir;
        this.projectKey = projectKey;
    }

    public static HiveConfig fromRoot(String root) {
        return fromRoot(root, null);
    }

    /**
     * Resolves the project root. When no project key is given the absolute root path is used,
     * so every working copy of a repository gets its own event stream.
     */
    public static HiveConfig fromRoot(String root, String projectKey) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(".")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        String key = projectKey == null || projectKey.isBlank()
                ? base.toString()
                : projectKey.trim();
        return new HiveConfig(base, key);
    }

    public Path rootDir() {
        return rootDir;
    }

    public String projectKey() {
        return projectKey;
    }

    public Path hiveDir() {
        return rootDir.resolve(HIVE_DIR);
    }

    public Path dbFile() {
        return hiveDir().resolve(DB_FILE_NAME);
    }

    public Path exportFile() {
        return hiveDir().resolve(EXPORT_FILE_NAME);
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    /**
     * Short slug used as the cell id prefix: the last path segment of the project key.
     */
    public String idPrefix() {
        String key = projectKey.replace('\\', '/');
        while (key.endsWith("/")) {
            key = key.substring(0, key.length() - 1);
        }
        int slash = key.lastIndexOf('/');
        String segment = slash >= 0 ? key.substring(slash + 1) : key;
        StringBuilder sb = new StringBuilder(segment.length());
        for (int i = 0; i < segment.length(); i++) {
            char ch = Character.toLowerCase(segment.charAt(i));
            boolean ok = (ch >= 'a' && ch <= 'z') || (ch >= '0' && ch <= '9');
            if (ok) {
                sb.append(ch);
            } else if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '-') {
                sb.append('-');
            }
        }
        String value = sb.toString();
        while (value.endsWith("-")) {
            value = value.substring(0, value.length() - 1);
        }
        return value.isBlank() ? "cell" : value;
    }
}
