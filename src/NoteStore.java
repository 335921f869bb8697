import com.google.gson.JsonElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Authoritative in-process note cache. Every mutation updates the cache and the
 * covering indices first, then hands a durable write to {@link NoteFiles} and
 * keeps the workspace lists in step.
 */
public final class NoteStore {
    private static final Logger log = LoggerFactory.getLogger(NoteStore.class);

    private final HostRuntime host;
    private final NoteFiles files;
    private final WorkspaceStore workspace;

    private final Map<String, Note> notes = new HashMap<String, Note>();
    private final NoteIndex active = new NoteIndex(NoteIndex.BY_UPDATED_DESC);
    private final NoteIndex favorites = new NoteIndex(NoteIndex.BY_UPDATED_DESC);
    private final NoteIndex trash = new NoteIndex(NoteIndex.BY_DELETED_DESC);

    public NoteStore(HostRuntime host, NoteFiles files, WorkspaceStore workspace) {
        this.host = host;
        this.files = files;
        this.workspace = workspace;
    }

    /** Fills the cache from the note files on disk. Returns the number of notes loaded. */
    public int warmUp() {
        List<Note> loaded = files.readAll();
        long now = host.now();
        for (int i = 0; i < loaded.size(); i++) {
            Note n = loaded.get(i);
            n.normalize(now);
            put(n);
        }
        log.info("Loaded {} notes from disk", loaded.size());
        return loaded.size();
    }

    public String create() {
        return create(Note.DEFAULT_TITLE);
    }

    public String create(String title) {
        Note n = Note.createEmpty(host.newUniqueId(), title, host.now());
        put(n);
        files.write(n);
        workspace.putNote(n.id, n.title, n.updatedAt);
        return n.id;
    }

    public void save(String id, JsonElement content, String title) {
        save(id, content, title, null, false);
    }

    /**
     * Upserts a note. {@code isDeleted} null keeps the current state. Workspace lists
     * are only touched while the note is, and was, outside the trash.
     */
    public void save(String id, JsonElement content, String title, Boolean isDeleted, boolean skipMetadataSync) {
        Objects.requireNonNull(id, "id");
        Note existing = notes.get(id);
        long now = host.now();

        Note n = new Note();
        n.id = id;
        n.title = title != null ? title : existing != null ? existing.title : Note.DEFAULT_TITLE;
        n.content = content;
        n.updatedAt = now;
        n.favorite = existing != null && existing.favorite;
        n.deleted = isDeleted != null ? isDeleted.booleanValue() : existing != null && existing.deleted;
        if (n.deleted) {
            n.deletedAt = existing != null && existing.deletedAt != null ? existing.deletedAt : Long.valueOf(now);
        } else {
            n.deletedAt = null;
        }

        put(n);
        files.write(n);

        boolean wasDeleted = existing != null && existing.deleted;
        if (!n.deleted && !wasDeleted && !skipMetadataSync) {
            workspace.putNote(n.id, n.title, n.updatedAt);
        }
    }

    /** Cache lookup only. */
    public Note load(String id) {
        Note n = id == null ? null : notes.get(id);
        return n == null ? null : n.copy();
    }

    /**
     * Cache, then the note's own file, then a fresh unsaved note with that id.
     * A note recovered from disk is cached as-is.
     */
    public Note loadOrRecover(String id) {
        Note cached = load(id);
        if (cached != null) return cached;

        Note fromDisk = files.read(id);
        if (fromDisk != null) {
            fromDisk.id = id;
            fromDisk.normalize(host.now());
            put(fromDisk);
            log.info("Recovered note {} from its file", id);
            return fromDisk.copy();
        }
        log.debug("Note {} not found anywhere, starting empty", id);
        return Note.createEmpty(id, Note.DEFAULT_TITLE, host.now());
    }

    public List<Note> listActive() {
        return active.list();
    }

    public List<Note> listFavorites() {
        return favorites.list();
    }

    public List<Note> listTrash() {
        return trash.list();
    }

    /** Case-insensitive title match over non-deleted notes, newest first, with content. */
    public List<Note> search(String query) {
        List<Note> result = new ArrayList<Note>();
        for (Note n : notes.values()) {
            if (!n.deleted && n.titleContains(query)) result.add(n.copy());
        }
        Collections.sort(result, (a, b) -> Long.compare(b.updatedAt, a.updatedAt));
        return result;
    }

    public void toggleFavorite(String id) {
        Note n = id == null ? null : notes.get(id);
        if (n == null) return;
        n.favorite = !n.favorite;
        put(n);
        files.write(n);
        // Trashed notes keep the flag for restore but stay out of metadata favorites.
        if (!n.deleted) workspace.setFavorite(id, n.favorite);
    }

    public void moveToTrash(String id) {
        Note n = id == null ? null : notes.get(id);
        if (n == null) return;
        long now = host.now();
        n.deleted = true;
        n.deletedAt = now;
        put(n);
        files.write(n);
        workspace.addTrash(n.id, n.title, now);
    }

    public void restoreFromTrash(String id) {
        Note n = id == null ? null : notes.get(id);
        if (n == null) return;
        n.deleted = false;
        n.deletedAt = null;
        n.updatedAt = host.now();
        put(n);
        files.write(n);
        workspace.removeTrash(n.id);
        workspace.putNote(n.id, n.title, n.updatedAt);
        if (n.favorite) workspace.setFavorite(n.id, true);
    }

    public void permanentlyDelete(String id) {
        Objects.requireNonNull(id, "id");
        Note removed = notes.remove(id);
        active.remove(id);
        favorites.remove(id);
        trash.remove(id);
        files.delete(id);
        workspace.removeTrash(id);
        workspace.removeNote(id);
        workspace.setFavorite(id, false);
        if (removed == null) log.debug("Permanent delete of uncached note {}", id);
    }

    public int emptyTrash() {
        List<Note> trashed = trash.list();
        for (int i = 0; i < trashed.size(); i++) {
            permanentlyDelete(trashed.get(i).id);
        }
        return trashed.size();
    }

    public int size() {
        return notes.size();
    }

    public void clearCache() {
        notes.clear();
        active.clear();
        favorites.clear();
        trash.clear();
    }

    private void put(Note n) {
        notes.put(n.id, n);
        active.remove(n.id);
        favorites.remove(n.id);
        trash.remove(n.id);
        if (n.deleted) {
            trash.put(n);
        } else {
            active.put(n);
            if (n.favorite) favorites.put(n);
        }
    }
}
