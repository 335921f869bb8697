import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class AssetStoreTest {

    @Test
    void savesUnderAssetDirectory() {
        InMemoryHost host = new InMemoryHost();
        AssetStore assets = new AssetStore(host, new AppPaths(host, StorageSettings.defaults()));

        String path = assets.save("recording", "webm", new byte[] {7, 8});

        assertThat(path).startsWith("/home/user/notes/.dialog/assets/recording-").endsWith(".webm");
        assertThat(host.bytes(path)).containsExactly(7, 8);
    }

    @Test
    void failedWriteReturnsNull() throws Exception {
        InMemoryHost host = spy(new InMemoryHost());
        doThrow(new IOException("no space")).when(host).writeBinaryFile(anyString(), any(byte[].class));
        AssetStore assets = new AssetStore(host, new AppPaths(host, StorageSettings.defaults()));

        assertThat(assets.save("recording", "webm", new byte[] {1})).isNull();
    }
}
