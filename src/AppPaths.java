import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the storage layout once per process from the host's working directory.
 * Later calls never go back to the host until {@link #reset()}.
 */
public final class AppPaths {
    private static final Logger log = LoggerFactory.getLogger(AppPaths.class);

    private final HostRuntime host;
    private final StorageSettings settings;
    private volatile PathSet cached;

    public AppPaths(HostRuntime host, StorageSettings settings) {
        this.host = host;
        this.settings = settings;
    }

    public PathSet resolve() {
        PathSet ps = cached;
        if (ps != null) return ps;
        synchronized (this) {
            if (cached == null) cached = compute();
            return cached;
        }
    }

    private PathSet compute() {
        String cwd = host.currentDirectory();
        String separator = cwd.indexOf('\\') >= 0 ? "\\" : "/";
        String base = cwd;
        if (base.length() > separator.length() && base.endsWith(separator)) {
            base = base.substring(0, base.length() - separator.length());
        }
        PathSet ps = new PathSet(base, separator, settings);
        log.debug("Storage resolved under {}", ps.storageDir);
        return ps;
    }

    public String contentPath(String noteId) {
        return resolve().contentFile(noteId);
    }

    public String workspacePath() {
        return resolve().workspaceFile;
    }

    public String configPath() {
        return resolve().configFile;
    }

    public String assetPath(String fileName) {
        return resolve().assetFile(fileName);
    }

    public String storageDir() {
        return resolve().storageDir;
    }

    public synchronized void reset() {
        cached = null;
    }
}
