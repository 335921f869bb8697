import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WorkspaceReconcilerTest {

    private InMemoryHost host;
    private AppPaths paths;
    private NoteFiles files;
    private WorkspaceStore workspace;
    private NoteStore notes;
    private WorkspaceReconciler reconciler;

    @BeforeEach
    void setUp() {
        host = spy(new InMemoryHost());
        paths = new AppPaths(host, StorageSettings.defaults());
        files = new NoteFiles(host, paths, Runnable::run);
        workspace = new WorkspaceStore(host, paths, StorageSettings.defaults(), mock(ScheduledExecutorService.class));
        notes = new NoteStore(host, files, workspace);
        reconciler = new WorkspaceReconciler(notes, workspace, host);
    }

    /** Notes that exist on disk but never reached workspace.json. */
    private void seedDriftedNotes() {
        files.write(note("a", "Alpha", 100L, false, false)).join();
        files.write(note("b", "Beta", 300L, true, false)).join();
        files.write(note("c", "Gamma", 200L, false, true)).join();
        notes.warmUp();
    }

    private static Note note(String id, String title, long updatedAt, boolean favorite, boolean deleted) {
        Note n = Note.createEmpty(id, title, updatedAt);
        n.favorite = favorite;
        n.deleted = deleted;
        n.deletedAt = deleted ? Long.valueOf(updatedAt + 1) : null;
        return n;
    }

    @Test
    void addsMissingEntriesAndWritesOnce() throws Exception {
        seedDriftedNotes();

        Workspace ws = reconciler.reconcile();

        assertThat(ws.notes).extracting(e -> e.id).containsExactly("b", "a");
        assertThat(ws.favorites).containsExactly("b");
        assertThat(ws.trash).extracting(t -> t.id).containsExactly("c");
        assertThat(ws.trash.get(0).deletedAt).isEqualTo(201L);
        verify(host, times(1)).writeFile(eq(paths.workspacePath()), anyString());
        assertThat(host.text(paths.workspacePath())).contains("\"Gamma\"");
    }

    @Test
    void secondRunIsIdenticalAndWritesNothing() throws Exception {
        seedDriftedNotes();
        Workspace first = reconciler.reconcile();
        String persisted = host.text(paths.workspacePath());
        clearInvocations(host);

        Workspace second = reconciler.reconcile();

        verify(host, never()).writeFile(eq(paths.workspacePath()), anyString());
        assertThat(second).usingRecursiveComparison().isEqualTo(first);
        assertThat(host.text(paths.workspacePath())).isEqualTo(persisted);
    }

    @Test
    void keepsEntriesOnlyPresentInWorkspace() throws Exception {
        workspace.putNote("stale", "Vanished", 999L);
        workspace.setFavorite("stale", true);
        seedDriftedNotes();

        Workspace ws = reconciler.reconcile();

        assertThat(ws.notes).extracting(e -> e.id).containsExactly("stale", "b", "a");
        assertThat(ws.favorites).containsExactly("stale", "b");
    }

    @Test
    void nothingToAddMeansNoWrite() throws Exception {
        Workspace ws = reconciler.reconcile();

        assertThat(ws.notes).isEmpty();
        verify(host, never()).writeFile(anyString(), anyString());
    }

    @Test
    void existingEntriesAreNotDuplicated() throws Exception {
        seedDriftedNotes();
        workspace.putNote("a", "Alpha", 100L);

        Workspace ws = reconciler.reconcile();

        assertThat(ws.notes).extracting(e -> e.id).containsExactly("b", "a");
    }

    @Test
    void unreadableStoreLeavesWorkspaceAsLoaded() throws Exception {
        workspace.putNote("kept", "Kept", 1L);
        NoteStore broken = mock(NoteStore.class);
        when(broken.listActive()).thenThrow(new IllegalStateException("index corrupt"));

        Workspace ws = new WorkspaceReconciler(broken, workspace, host).reconcile();

        assertThat(ws.notes).extracting(e -> e.id).containsExactly("kept");
        verify(host, never()).writeFile(anyString(), anyString());
    }
}
