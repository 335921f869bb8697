import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class AppPathsTest {

    private InMemoryHost host;
    private AppPaths paths;

    @BeforeEach
    void setUp() {
        host = new InMemoryHost();
        paths = new AppPaths(host, StorageSettings.defaults());
    }

    @Test
    void derivesLayoutFromWorkingDirectory() {
        PathSet ps = paths.resolve();

        assertThat(ps.separator).isEqualTo("/");
        assertThat(ps.storageDir).isEqualTo("/home/user/notes/.dialog");
        assertThat(ps.contentDir).isEqualTo("/home/user/notes/.dialog/content");
        assertThat(ps.assetDir).isEqualTo("/home/user/notes/.dialog/assets");
        assertThat(ps.workspaceFile).isEqualTo("/home/user/notes/.dialog/workspace.json");
        assertThat(ps.configFile).isEqualTo("/home/user/notes/.dialog/app.json");
        assertThat(paths.contentPath("abc")).isEqualTo("/home/user/notes/.dialog/content/abc.json");
        assertThat(paths.assetPath("rec.webm")).isEqualTo("/home/user/notes/.dialog/assets/rec.webm");
    }

    @Test
    void asksHostOnlyOnce() {
        paths.contentPath("a");
        paths.contentPath("b");
        paths.workspacePath();
        paths.configPath();

        assertThat(host.cwdCalls).isEqualTo(1);
    }

    @Test
    void detectsBackslashSeparatorAndTrailingSeparator() {
        host.cwd = "C:\\Users\\me\\";

        PathSet ps = paths.resolve();

        assertThat(ps.separator).isEqualTo("\\");
        assertThat(ps.baseDir).isEqualTo("C:\\Users\\me");
        assertThat(ps.contentFile("n1")).isEqualTo("C:\\Users\\me\\.dialog\\content\\n1.json");
    }

    @Test
    void concurrentResolutionAsksHostOnce() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        InMemoryHost slow = new InMemoryHost() {
            @Override
            public String currentDirectory() {
                calls.incrementAndGet();
                try {
                    Thread.sleep(50);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "/srv/shared";
            }
        };
        AppPaths shared = new AppPaths(slow, StorageSettings.defaults());
        shared.resolve();
        shared.reset();
        calls.set(0);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<String>> results = new ArrayList<Future<String>>();
        for (int i = 0; i < 4; i++) {
            results.add(pool.submit(() -> {
                start.await();
                return shared.storageDir();
            }));
        }
        start.countDown();
        try {
            for (Future<String> f : results) {
                assertThat(f.get(5, TimeUnit.SECONDS)).isEqualTo("/srv/shared/.dialog");
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void resetForcesFreshResolution() {
        paths.resolve();
        host.cwd = "/srv/other";
        assertThat(paths.storageDir()).isEqualTo("/home/user/notes/.dialog");

        paths.reset();

        assertThat(paths.storageDir()).isEqualTo("/srv/other/.dialog");
        assertThat(host.cwdCalls).isEqualTo(2);
    }

    @Test
    void mapsFileNamesBackToIds() {
        PathSet ps = paths.resolve();

        assertThat(ps.noteIdOf("n-42.json")).isEqualTo("n-42");
        assertThat(ps.noteIdOf("notes.txt")).isNull();
        assertThat(ps.noteIdOf(".json")).isNull();
    }

    @Test
    void honoursConfiguredNames() {
        StorageSettings settings = StorageSettings.defaults()
                .with(StorageSettings.DIR_NAME, ".notes")
                .with(StorageSettings.RECORD_EXTENSION, "note");
        AppPaths custom = new AppPaths(host, settings);

        assertThat(custom.contentPath("x")).isEqualTo("/home/user/notes/.notes/content/x.note");
    }
}
