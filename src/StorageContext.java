import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Owns every cache of the storage engine and the single I/O thread behind it.
 * Independent contexts share nothing.
 */
public final class StorageContext implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StorageContext.class);

    public final AppPaths paths;
    public final ConfigStore config;
    public final WorkspaceStore workspace;
    public final NoteFiles noteFiles;
    public final NoteStore notes;
    public final WorkspaceReconciler reconciler;
    public final AssetStore assets;

    private final ScheduledExecutorService io;

    public StorageContext(HostRuntime host, StorageSettings settings) {
        this(host, settings, Executors.newSingleThreadScheduledExecutor(new ThreadFactory() {
            @Override public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "dialog-storage-io");
                t.setDaemon(true);
                return t;
            }
        }));
    }

    public StorageContext(HostRuntime host, StorageSettings settings, ScheduledExecutorService io) {
        this.io = io;
        paths = new AppPaths(host, settings);
        config = new ConfigStore(host, paths);
        workspace = new WorkspaceStore(host, paths, settings, io);
        noteFiles = new NoteFiles(host, paths, io);
        notes = new NoteStore(host, noteFiles, workspace);
        reconciler = new WorkspaceReconciler(notes, workspace, host);
        assets = new AssetStore(host, paths);
    }

    /** Warm the note cache from disk and repair the workspace lists. */
    public Workspace open() {
        log.info("Opening storage at {}", paths.storageDir());
        notes.warmUp();
        return reconciler.reconcile();
    }

    /** Drops every cached value, as if the process had just started. */
    public void reset() {
        workspace.clearCache();
        notes.clearCache();
        config.clearCache();
        paths.reset();
    }

    /** Flushes a pending workspace write, then waits for queued file writes. */
    @Override
    public void close() {
        workspace.flush();
        io.shutdown();
        try {
            if (!io.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Storage I/O did not finish within 5s");
                io.shutdownNow();
            }
        } catch (InterruptedException e) {
            io.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
