import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/** Binary attachments (recordings, images) under the asset directory. */
public final class AssetStore {
    private static final Logger log = LoggerFactory.getLogger(AssetStore.class);

    private final HostRuntime host;
    private final AppPaths paths;

    public AssetStore(HostRuntime host, AppPaths paths) {
        this.host = host;
        this.paths = paths;
    }

    /**
     * Writes {@code <prefix>-<now>.<extension>} and returns its path, or null when
     * the write failed.
     */
    public String save(String prefix, String extension, byte[] data) {
        String fileName = prefix + "-" + host.now() + "." + extension;
        String path = paths.assetPath(fileName);
        try {
            host.writeBinaryFile(path, data);
            log.debug("Asset saved to {} ({} bytes)", path, data.length);
            return path;
        } catch (IOException e) {
            log.error("Failed to save asset {}", path, e);
            return null;
        }
    }
}
