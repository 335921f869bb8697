import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Cached app settings with whole-object read/patch/write. Every change is written
 * straight away; settings change too rarely to need a quiet period.
 */
public final class ConfigStore {
    private static final Logger log = LoggerFactory.getLogger(ConfigStore.class);
    // Top-level keys that are absent from the serialized defaults because they start null.
    private static final Set<String> OPTIONAL_KEYS = Collections.singleton("accentColor");

    private final HostRuntime host;
    private final AppPaths paths;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    private AppSettings cache;

    public ConfigStore(HostRuntime host, AppPaths paths) {
        this.host = host;
        this.paths = paths;
    }

    /** Current settings; a missing or unreadable file is replaced by defaults on disk. */
    public synchronized AppSettings load() {
        if (cache == null) cache = readFromDisk();
        return copy(cache);
    }

    public synchronized void save(AppSettings settings) {
        cache = copy(settings);
        write(cache);
    }

    /** Top-level value as JSON, or null when the key is unknown or unset. */
    public synchronized JsonElement get(String key) {
        return gson.toJsonTree(load()).getAsJsonObject().get(key);
    }

    public synchronized <T> T get(String key, Class<T> type) {
        JsonElement v = get(key);
        return v == null ? null : gson.fromJson(v, type);
    }

    public synchronized String getString(String key, String fallback) {
        JsonElement v = get(key);
        if (v == null || v.isJsonNull() || !v.isJsonPrimitive()) return fallback;
        return v.getAsString();
    }

    /**
     * Patches one top-level key and writes the whole object.
     *
     * @throws IllegalArgumentException for an unknown key, or a value the settings
     *         model cannot hold (wrong shape, unknown enum name)
     */
    public synchronized void set(String key, Object value) {
        JsonObject tree = gson.toJsonTree(load()).getAsJsonObject();
        if (!tree.has(key) && !OPTIONAL_KEYS.contains(key)) {
            throw new IllegalArgumentException("Unknown setting " + key);
        }
        JsonElement given = gson.toJsonTree(value);
        tree.add(key, given);
        AppSettings patched;
        try {
            patched = gson.fromJson(tree, AppSettings.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid value for setting " + key + ": " + value, e);
        }
        // Gson reads unknown enum names as null; catch that before normalize() masks it.
        JsonElement kept = gson.toJsonTree(patched).getAsJsonObject().get(key);
        if (!retains(given, kept)) {
            throw new IllegalArgumentException("Invalid value for setting " + key + ": " + value);
        }
        save(patched.normalize());
    }

    public synchronized void clearCache() {
        cache = null;
    }

    private AppSettings readFromDisk() {
        String path = paths.configPath();
        String json = null;
        try {
            json = host.readFile(path);
        } catch (IOException e) {
            log.info("Config not found at {}, creating defaults", path);
        }
        if (json != null) {
            try {
                AppSettings s = gson.fromJson(json, AppSettings.class);
                if (s != null) return s.normalize();
                log.warn("Config file {} is empty, replacing with defaults", path);
            } catch (JsonParseException e) {
                log.warn("Config file {} is malformed ({}), replacing with defaults", path, e.getMessage());
            }
        }
        AppSettings defaults = new AppSettings();
        write(defaults);
        return defaults;
    }

    private void write(AppSettings settings) {
        String path = paths.configPath();
        try {
            host.writeFile(path, gson.toJson(settings));
        } catch (IOException e) {
            log.error("Failed to write config {}", path, e);
        }
    }

    /** True when every non-null leaf of {@code given} survived the round trip into {@code kept}. */
    private static boolean retains(JsonElement given, JsonElement kept) {
        if (given == null || given.isJsonNull()) return true;
        if (kept == null || kept.isJsonNull()) return false;
        if (given.isJsonObject()) {
            if (!kept.isJsonObject()) return false;
            JsonObject k = kept.getAsJsonObject();
            for (Map.Entry<String, JsonElement> e : given.getAsJsonObject().entrySet()) {
                if (!retains(e.getValue(), k.get(e.getKey()))) return false;
            }
            return true;
        }
        if (given.isJsonArray()) {
            if (!kept.isJsonArray() || kept.getAsJsonArray().size() != given.getAsJsonArray().size()) return false;
            for (int i = 0; i < given.getAsJsonArray().size(); i++) {
                if (!retains(given.getAsJsonArray().get(i), kept.getAsJsonArray().get(i))) return false;
            }
            return true;
        }
        return given.equals(kept);
    }

    private AppSettings copy(AppSettings s) {
        return gson.fromJson(gson.toJson(s), AppSettings.class).normalize();
    }
}
