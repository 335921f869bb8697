import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class DialogAppTest {

    private StorageContext ctx;
    private ByteArrayOutputStream buffer;
    private DialogApp app;

    @BeforeEach
    void setUp() {
        ctx = new StorageContext(new InMemoryHost(), StorageSettings.defaults());
        ctx.open();
        buffer = new ByteArrayOutputStream();
        app = new DialogApp(ctx, new PrintStream(buffer, true));
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    private String output() {
        String s = new String(buffer.toByteArray(), StandardCharsets.UTF_8);
        buffer.reset();
        return s;
    }

    @Test
    void newThenListShowsNote() {
        assertThat(app.run(new String[] {"new", "Shopping", "list"})).isZero();
        String id = output().trim();

        app.run(new String[] {"list"});

        assertThat(output()).contains(id).contains("Shopping list");
        assertThat(ctx.workspace.load().activeRecordId).isEqualTo(id);
    }

    @Test
    void trashRestoreAndPurge() {
        app.run(new String[] {"new", "Temp"});
        String id = output().trim();

        app.run(new String[] {"delete", id});
        app.run(new String[] {"trash"});
        assertThat(output()).contains("Temp");

        app.run(new String[] {"restore", id});
        assertThat(ctx.notes.listTrash()).isEmpty();

        app.run(new String[] {"delete", id});
        app.run(new String[] {"purge", id});
        assertThat(ctx.notes.load(id)).isNull();
    }

    @Test
    void configReadAndWrite() {
        app.run(new String[] {"config", "theme", "dark"});
        app.run(new String[] {"config", "theme"});

        assertThat(output()).contains("dark");
        assertThat(ctx.config.load().theme).isEqualTo(AppSettings.Theme.DARK);
    }

    @Test
    void invalidConfigValueReportsErrorWithoutChangingSettings() {
        app.run(new String[] {"config", "theme", "dark"});
        output();

        assertThat(app.run(new String[] {"config", "editor", "foo"})).isEqualTo(2);
        assertThat(output()).startsWith("config:").contains("editor");

        assertThat(app.run(new String[] {"config", "theme", "purple"})).isEqualTo(2);
        assertThat(ctx.config.load().theme).isEqualTo(AppSettings.Theme.DARK);
        assertThat(ctx.config.load().editor.fontSize).isEqualTo(16);
    }

    @Test
    void unknownCommandPrintsUsage() {
        assertThat(app.run(new String[] {"frobnicate"})).isEqualTo(2);
        assertThat(output()).startsWith("usage:");
    }
}
