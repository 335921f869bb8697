import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Owner of workspace.json. Mutations apply to the in-memory snapshot at once and
 * schedule a debounced write; the write is skipped when the serialized snapshot
 * equals what was last persisted.
 */
public final class WorkspaceStore {
    private static final Logger log = LoggerFactory.getLogger(WorkspaceStore.class);

    private final HostRuntime host;
    private final AppPaths paths;
    private final int recentLimit;
    private final DebouncedWriter writer;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private Workspace cache;
    private String lastPersisted;

    public WorkspaceStore(HostRuntime host, AppPaths paths, StorageSettings settings, ScheduledExecutorService scheduler) {
        this.host = host;
        this.paths = paths;
        this.recentLimit = settings.recentLimit();
        this.writer = new DebouncedWriter(scheduler, settings.quietPeriodMillis(), new Runnable() {
            @Override public void run() {
                persistIfChanged();
            }
        });
    }

    /** Detached copy of the current snapshot, loading it on first use. */
    public synchronized Workspace load() {
        return copy(current());
    }

    /** Replaces the whole snapshot and schedules a write. */
    public synchronized void save(Workspace snapshot) {
        cache = copy(snapshot).normalize();
        writer.schedule();
    }

    /** Replaces the whole snapshot and writes it immediately, bypassing the quiet period. */
    public synchronized void writeNow(Workspace snapshot) {
        cache = copy(snapshot).normalize();
        writer.cancel();
        persistIfChanged();
    }

    // --- notes

    public synchronized void putNote(String id, String title, long updatedAt) {
        Workspace ws = current();
        Workspace.NoteEntry e = ws.findNote(id);
        if (e == null) {
            ws.notes.add(new Workspace.NoteEntry(id, title, updatedAt));
        } else {
            e.title = title;
            e.updatedAt = updatedAt;
        }
        ws.sortNotes();
        writer.schedule();
    }

    /** Updates an existing entry only; unknown ids are left for reconciliation. */
    public synchronized void updateNote(String id, String title, long updatedAt) {
        Workspace ws = current();
        Workspace.NoteEntry e = ws.findNote(id);
        if (e == null) return;
        if (title != null) e.title = title;
        e.updatedAt = updatedAt;
        ws.sortNotes();
        writer.schedule();
    }

    public synchronized void removeNote(String id) {
        Workspace ws = current();
        ws.notes.removeIf(n -> n.id.equals(id));
        writer.schedule();
    }

    // --- favorites

    public synchronized void setFavorite(String id, boolean favorite) {
        Workspace ws = current();
        ws.favorites.remove(id);
        if (favorite) ws.favorites.add(0, id);
        writer.schedule();
    }

    public synchronized void toggleFavorite(String id) {
        setFavorite(id, !current().favorites.contains(id));
    }

    // --- trash

    /** Trash membership excludes notes and favorites membership. */
    public synchronized void addTrash(String id, String title, long deletedAt) {
        Workspace ws = current();
        ws.notes.removeIf(n -> n.id.equals(id));
        ws.favorites.remove(id);
        ws.trash.removeIf(t -> t.id.equals(id));
        ws.trash.add(0, new Workspace.TrashEntry(id, title, deletedAt));
        ws.sortTrash();
        writer.schedule();
    }

    public synchronized void removeTrash(String id) {
        Workspace ws = current();
        ws.trash.removeIf(t -> t.id.equals(id));
        writer.schedule();
    }

    // --- view state

    public synchronized void setActiveNote(String id) {
        current().activeRecordId = id;
        if (id != null) addRecentId(id);
        else writer.schedule();
    }

    public synchronized void addRecentId(String id) {
        Workspace ws = current();
        ws.recentIds.remove(id);
        ws.recentIds.add(0, id);
        while (ws.recentIds.size() > recentLimit) ws.recentIds.remove(ws.recentIds.size() - 1);
        writer.schedule();
    }

    /** Null arguments keep the current value. */
    public synchronized void updateSidebar(Boolean collapsed, Integer width) {
        Workspace.Sidebar sb = current().sidebar;
        if (collapsed != null) sb.collapsed = collapsed.booleanValue();
        if (width != null) sb.width = width.intValue();
        writer.schedule();
    }

    public synchronized void updateWindow(Workspace.WindowState window) {
        current().window = window == null ? null : gson.fromJson(gson.toJson(window), Workspace.WindowState.class);
        writer.schedule();
    }

    // --- persistence

    /** Writes a pending change now instead of waiting for the quiet period. */
    public void flush() {
        writer.flush();
    }

    public boolean hasPendingWrite() {
        return writer.isPending();
    }

    /** Forgets the snapshot and the persisted baseline, dropping any pending write. */
    public synchronized void clearCache() {
        writer.cancel();
        cache = null;
        lastPersisted = null;
    }

    synchronized void persistIfChanged() {
        if (cache == null) return;
        String json = gson.toJson(cache);
        if (json.equals(lastPersisted)) {
            log.debug("Workspace unchanged, write skipped");
            return;
        }
        String path = paths.workspacePath();
        try {
            host.writeFile(path, json);
            lastPersisted = json;
            log.debug("Workspace written to {}", path);
        } catch (IOException e) {
            log.error("Failed to write workspace {}", path, e);
        }
    }

    private Workspace current() {
        if (cache == null) cache = readFromDisk();
        return cache;
    }

    private Workspace readFromDisk() {
        String path = paths.workspacePath();
        String json;
        try {
            json = host.readFile(path);
        } catch (IOException e) {
            log.info("Workspace not found at {}, using defaults", path);
            return new Workspace();
        }
        try {
            Workspace ws = gson.fromJson(json, Workspace.class);
            if (ws == null) throw new JsonParseException("empty document");
            ws.normalize();
            lastPersisted = gson.toJson(ws);
            return ws;
        } catch (JsonParseException e) {
            log.warn("Workspace file {} is malformed ({}), replacing with defaults", path, e.getMessage());
            cache = new Workspace();
            persistIfChanged();
            return cache;
        }
    }

    private Workspace copy(Workspace ws) {
        return gson.fromJson(gson.toJson(ws), Workspace.class).normalize();
    }
}
