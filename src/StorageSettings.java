import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Engine tunables: classpath {@code dialog-storage.properties} overlaid by JVM system properties.
 */
public final class StorageSettings {
    private static final Logger log = LoggerFactory.getLogger(StorageSettings.class);
    private static final String RESOURCE = "dialog-storage.properties";

    public static final String DIR_NAME = "storage.dirName";
    public static final String CONTENT_DIR_NAME = "storage.contentDirName";
    public static final String ASSET_DIR_NAME = "storage.assetDirName";
    public static final String WORKSPACE_FILE_NAME = "storage.workspaceFileName";
    public static final String CONFIG_FILE_NAME = "storage.configFileName";
    public static final String RECORD_EXTENSION = "storage.recordExtension";
    public static final String QUIET_PERIOD_MILLIS = "workspace.quietPeriodMillis";
    public static final String RECENT_LIMIT = "workspace.recentLimit";

    private static final String[] KEYS = {
            DIR_NAME, CONTENT_DIR_NAME, ASSET_DIR_NAME, WORKSPACE_FILE_NAME,
            CONFIG_FILE_NAME, RECORD_EXTENSION, QUIET_PERIOD_MILLIS, RECENT_LIMIT
    };

    private final Properties properties;

    public StorageSettings(Properties properties) {
        this.properties = properties;
    }

    public static StorageSettings defaults() {
        return new StorageSettings(new Properties());
    }

    public static StorageSettings load() {
        Properties p = new Properties();
        try (InputStream in = StorageSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) p.load(in);
        } catch (IOException e) {
            log.warn("Could not read {}, using built-in defaults", RESOURCE, e);
        }
        for (String key : KEYS) {
            String override = System.getProperty(key);
            if (override != null) p.setProperty(key, override);
        }
        return new StorageSettings(p);
    }

    public StorageSettings with(String key, String value) {
        Properties copy = new Properties();
        copy.putAll(properties);
        copy.setProperty(key, value);
        return new StorageSettings(copy);
    }

    public String dirName() {
        return getString(DIR_NAME, ".dialog");
    }

    public String contentDirName() {
        return getString(CONTENT_DIR_NAME, "content");
    }

    public String assetDirName() {
        return getString(ASSET_DIR_NAME, "assets");
    }

    public String workspaceFileName() {
        return getString(WORKSPACE_FILE_NAME, "workspace.json");
    }

    public String configFileName() {
        return getString(CONFIG_FILE_NAME, "app.json");
    }

    public String recordExtension() {
        return getString(RECORD_EXTENSION, "json");
    }

    public long quietPeriodMillis() {
        return getInt(QUIET_PERIOD_MILLIS, 1000);
    }

    public int recentLimit() {
        return getInt(RECENT_LIMIT, 10);
    }

    public int getInt(String key, int fallback) {
        String v = properties.getProperty(key);
        if (v == null) return fallback;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric {}={}", key, v);
            return fallback;
        }
    }

    public String getString(String key, String fallback) {
        String v = properties.getProperty(key);
        if (v == null || v.trim().length() == 0) return fallback;
        return v.trim();
    }
}
