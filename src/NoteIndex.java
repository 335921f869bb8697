import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Ordered index over note metadata. Entries carry every listed field so a
 * listing never touches the content payload.
 */
final class NoteIndex {

    static final Comparator<Entry> BY_UPDATED_DESC = new Comparator<Entry>() {
        @Override public int compare(Entry a, Entry b) {
            int c = Long.compare(b.updatedAt, a.updatedAt);
            return c != 0 ? c : b.id.compareTo(a.id);
        }
    };

    static final Comparator<Entry> BY_DELETED_DESC = new Comparator<Entry>() {
        @Override public int compare(Entry a, Entry b) {
            int c = Long.compare(b.deletedAtOrZero(), a.deletedAtOrZero());
            return c != 0 ? c : b.id.compareTo(a.id);
        }
    };

    private final TreeSet<Entry> ordered;
    private final Map<String, Entry> byId = new HashMap<String, Entry>();

    NoteIndex(Comparator<Entry> order) {
        this.ordered = new TreeSet<Entry>(order);
    }

    void put(Note n) {
        remove(n.id);
        Entry e = new Entry(n);
        byId.put(e.id, e);
        ordered.add(e);
    }

    void remove(String id) {
        Entry old = byId.remove(id);
        if (old != null) ordered.remove(old);
    }

    boolean contains(String id) {
        return byId.containsKey(id);
    }

    int size() {
        return byId.size();
    }

    void clear() {
        byId.clear();
        ordered.clear();
    }

    /** Notes rebuilt from index entries; {@code content} is always null. */
    List<Note> list() {
        List<Note> result = new ArrayList<Note>(ordered.size());
        for (Entry e : ordered) result.add(e.toNote());
        return result;
    }

    static final class Entry {
        final String id;
        final String title;
        final long updatedAt;
        final boolean favorite;
        final boolean deleted;
        final Long deletedAt;

        Entry(Note n) {
            id = n.id;
            title = n.title;
            updatedAt = n.updatedAt;
            favorite = n.favorite;
            deleted = n.deleted;
            deletedAt = n.deletedAt;
        }

        long deletedAtOrZero() {
            return deletedAt == null ? 0L : deletedAt.longValue();
        }

        Note toNote() {
            Note n = new Note();
            n.id = id;
            n.title = title;
            n.updatedAt = updatedAt;
            n.favorite = favorite;
            n.deleted = deleted;
            n.deletedAt = deletedAt;
            return n;
        }
    }
}
