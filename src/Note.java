import com.google.gson.JsonElement;
import com.google.gson.annotations.SerializedName;

import java.util.Locale;

public final class Note {
    public static final String DEFAULT_TITLE = "Untitled";

    public String id;
    public String title;
    public JsonElement content;
    public long updatedAt;
    @SerializedName("isFavorite")
    public boolean favorite;
    @SerializedName("isDeleted")
    public boolean deleted;
    public Long deletedAt;

    public Note() {}

    public static Note createEmpty(String id, String title, long now) {
        Note n = new Note();
        n.id = id;
        n.title = title == null ? DEFAULT_TITLE : title;
        n.content = null;
        n.updatedAt = now;
        n.favorite = false;
        n.deleted = false;
        n.deletedAt = null;
        return n;
    }

    public Note copy() {
        Note n = new Note();
        n.id = id;
        n.title = title;
        n.content = content == null ? null : content.deepCopy();
        n.updatedAt = updatedAt;
        n.favorite = favorite;
        n.deleted = deleted;
        n.deletedAt = deletedAt;
        return n;
    }

    public boolean titleContains(String q) {
        if (q == null) return true;
        q = q.trim();
        if (q.length() == 0) return true;
        String hay = title == null ? "" : title.toLowerCase(Locale.ROOT);
        return hay.contains(q.toLowerCase(Locale.ROOT));
    }

    /** Repairs files written before the deleted/deletedAt pairing was enforced. */
    void normalize(long now) {
        if (title == null) title = DEFAULT_TITLE;
        if (deleted && deletedAt == null) deletedAt = now;
        if (!deleted) deletedAt = null;
    }

    @Override
    public String toString() {
        return title + " (" + id + ")";
    }
}
