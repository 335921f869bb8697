import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * One pretty-printed JSON file per note. Writes and deletes run detached on the
 * I/O executor; their failures are logged and never reach the caller.
 */
public final class NoteFiles {
    private static final Logger log = LoggerFactory.getLogger(NoteFiles.class);

    private final HostRuntime host;
    private final AppPaths paths;
    private final Executor io;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public NoteFiles(HostRuntime host, AppPaths paths, Executor io) {
        this.host = host;
        this.paths = paths;
        this.io = io;
    }

    /** Serializes now, writes later. The returned future always completes normally. */
    public CompletableFuture<Void> write(Note note) {
        final String path = paths.contentPath(note.id);
        final String json = gson.toJson(note);
        return detach("write", path, new IoTask() {
            @Override public void run() throws IOException {
                host.writeFile(path, json);
            }
        });
    }

    public CompletableFuture<Void> delete(String noteId) {
        final String path = paths.contentPath(noteId);
        return detach("delete", path, new IoTask() {
            @Override public void run() throws IOException {
                host.deleteFile(path);
            }
        });
    }

    /** Synchronous read used on a cache miss; null when the file is absent or unreadable. */
    public Note read(String noteId) {
        String path = paths.contentPath(noteId);
        String json;
        try {
            json = host.readFile(path);
        } catch (IOException e) {
            log.debug("No durable copy of note {} at {}", noteId, path);
            return null;
        }
        return parse(json, noteId, path);
    }

    /** Every readable note file in the content directory. */
    public List<Note> readAll() {
        PathSet ps = paths.resolve();
        List<Note> result = new ArrayList<Note>();
        List<String> names;
        try {
            names = host.listFiles(ps.contentDir);
        } catch (IOException e) {
            log.warn("Cannot list note files in {}", ps.contentDir, e);
            return result;
        }
        for (int i = 0; i < names.size(); i++) {
            String id = ps.noteIdOf(names.get(i));
            if (id == null) continue;
            Note n = read(id);
            if (n != null) result.add(n);
        }
        return result;
    }

    private Note parse(String json, String noteId, String path) {
        if (json == null || json.trim().length() == 0) return null;
        try {
            Note n = gson.fromJson(json, Note.class);
            if (n == null) return null;
            if (n.id == null) n.id = noteId;
            return n;
        } catch (JsonParseException e) {
            log.warn("Skipping malformed note file {}: {}", path, e.getMessage());
            return null;
        }
    }

    private CompletableFuture<Void> detach(final String action, final String path, final IoTask task) {
        try {
            return CompletableFuture.runAsync(new Runnable() {
                @Override public void run() {
                    try {
                        task.run();
                        log.debug("Note file {} ok: {}", action, path);
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                }
            }, io).exceptionally(t -> {
                log.error("Failed to {} note file {}", action, path, unwrap(t));
                return null;
            });
        } catch (RejectedExecutionException e) {
            log.error("I/O executor closed, note file {} skipped: {}", action, path);
            return CompletableFuture.completedFuture(null);
        }
    }

    private static Throwable unwrap(Throwable t) {
        if (t instanceof CompletionException && t.getCause() != null) t = t.getCause();
        if (t instanceof UncheckedIOException && t.getCause() != null) t = t.getCause();
        return t;
    }

    private interface IoTask {
        void run() throws IOException;
    }
}
