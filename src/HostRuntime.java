import java.io.IOException;
import java.util.List;

/**
 * File and clock primitives supplied by the process hosting the storage engine.
 * Paths are plain strings in the host's own separator convention.
 */
public interface HostRuntime {
    String readFile(String path) throws IOException;

    /** Creates missing parent directories before writing. */
    void writeFile(String path, String text) throws IOException;

    void writeBinaryFile(String path, byte[] data) throws IOException;

    void deleteFile(String path) throws IOException;

    /** File names (not paths) of the regular files directly inside {@code dir}. */
    List<String> listFiles(String dir) throws IOException;

    String currentDirectory();

    String newUniqueId();

    long now();
}
