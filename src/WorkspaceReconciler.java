import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Startup pass that adds to the workspace lists whatever the note store knows
 * and the workspace is missing. Entries present only in the workspace are kept.
 */
public final class WorkspaceReconciler {
    private static final Logger log = LoggerFactory.getLogger(WorkspaceReconciler.class);

    private final NoteStore notes;
    private final WorkspaceStore workspace;
    private final HostRuntime host;

    public WorkspaceReconciler(NoteStore notes, WorkspaceStore workspace, HostRuntime host) {
        this.notes = notes;
        this.workspace = workspace;
        this.host = host;
    }

    /** Returns the reconciled snapshot; writes it once if anything was added. */
    public Workspace reconcile() {
        Workspace ws = workspace.load();

        List<Note> active;
        List<Note> favorites;
        List<Note> trashed;
        try {
            active = notes.listActive();
            favorites = notes.listFavorites();
            trashed = notes.listTrash();
        } catch (RuntimeException e) {
            log.warn("Note store unavailable, keeping workspace as loaded", e);
            return ws;
        }

        int added = 0;

        Set<String> known = new HashSet<String>();
        for (Workspace.NoteEntry e : ws.notes) known.add(e.id);
        for (Note n : active) {
            if (known.add(n.id)) {
                ws.notes.add(new Workspace.NoteEntry(n.id, n.title, n.updatedAt));
                added++;
            }
        }
        ws.sortNotes();

        known = new HashSet<String>(ws.favorites);
        for (Note n : favorites) {
            if (known.add(n.id)) {
                ws.favorites.add(n.id);
                added++;
            }
        }

        known = new HashSet<String>();
        for (Workspace.TrashEntry e : ws.trash) known.add(e.id);
        for (Note n : trashed) {
            if (known.add(n.id)) {
                long deletedAt = n.deletedAt != null ? n.deletedAt.longValue() : host.now();
                ws.trash.add(new Workspace.TrashEntry(n.id, n.title, deletedAt));
                added++;
            }
        }
        ws.sortTrash();

        if (added > 0) {
            log.info("Reconciliation added {} missing workspace entries", added);
            workspace.writeNow(ws);
        }
        return ws;
    }
}
