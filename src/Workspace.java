import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * UI-facing derived state persisted as workspace.json. Everything here can be
 * rebuilt from the note store.
 */
public final class Workspace {
    public static final int DEFAULT_SIDEBAR_WIDTH = 240;

    public String activeRecordId;
    public Sidebar sidebar = new Sidebar();
    public List<String> recentIds = new ArrayList<String>();
    public List<NoteEntry> notes = new ArrayList<NoteEntry>();
    public List<String> favorites = new ArrayList<String>();
    public List<TrashEntry> trash = new ArrayList<TrashEntry>();
    public WindowState window;

    public static final class Sidebar {
        public boolean collapsed = false;
        public int width = DEFAULT_SIDEBAR_WIDTH;
    }

    public static final class NoteEntry {
        public String id;
        public String title;
        public long updatedAt;

        public NoteEntry() {}

        public NoteEntry(String id, String title, long updatedAt) {
            this.id = id;
            this.title = title;
            this.updatedAt = updatedAt;
        }
    }

    public static final class TrashEntry {
        public String id;
        public String title;
        public long deletedAt;

        public TrashEntry() {}

        public TrashEntry(String id, String title, long deletedAt) {
            this.id = id;
            this.title = title;
            this.deletedAt = deletedAt;
        }
    }

    public static final class WindowState {
        public int width;
        public int height;
        public Integer x;
        public Integer y;
        public boolean maximized;
    }

    static final Comparator<NoteEntry> NOTES_ORDER = new Comparator<NoteEntry>() {
        @Override public int compare(NoteEntry a, NoteEntry b) {
            return Long.compare(b.updatedAt, a.updatedAt);
        }
    };

    static final Comparator<TrashEntry> TRASH_ORDER = new Comparator<TrashEntry>() {
        @Override public int compare(TrashEntry a, TrashEntry b) {
            return Long.compare(b.deletedAt, a.deletedAt);
        }
    };

    public NoteEntry findNote(String id) {
        for (int i = 0; i < notes.size(); i++) {
            if (notes.get(i).id.equals(id)) return notes.get(i);
        }
        return null;
    }

    public TrashEntry findTrash(String id) {
        for (int i = 0; i < trash.size(); i++) {
            if (trash.get(i).id.equals(id)) return trash.get(i);
        }
        return null;
    }

    void sortNotes() {
        Collections.sort(notes, NOTES_ORDER);
    }

    void sortTrash() {
        Collections.sort(trash, TRASH_ORDER);
    }

    /** Fills gaps left by hand-edited or older files; Gson leaves explicit nulls as null. */
    Workspace normalize() {
        if (sidebar == null) sidebar = new Sidebar();
        if (recentIds == null) recentIds = new ArrayList<String>();
        if (notes == null) notes = new ArrayList<NoteEntry>();
        if (favorites == null) favorites = new ArrayList<String>();
        if (trash == null) trash = new ArrayList<TrashEntry>();
        recentIds.removeIf(id -> id == null);
        favorites.removeIf(id -> id == null);
        notes.removeIf(n -> n == null || n.id == null);
        trash.removeIf(t -> t == null || t.id == null);
        return this;
    }
}
