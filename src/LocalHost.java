import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

public final class LocalHost implements HostRuntime {

    @Override
    public String readFile(String path) throws IOException {
        byte[] bytes = Files.readAllBytes(Paths.get(path));
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public void writeFile(String path, String text) throws IOException {
        writeBinaryFile(path, text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public void writeBinaryFile(String path, byte[] data) throws IOException {
        Path p = Paths.get(path);
        Path parent = p.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.write(p, data, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
    }

    @Override
    public void deleteFile(String path) throws IOException {
        Files.delete(Paths.get(path));
    }

    @Override
    public List<String> listFiles(String dir) throws IOException {
        Path d = Paths.get(dir);
        if (!Files.isDirectory(d)) return Collections.emptyList();
        List<String> result = new ArrayList<String>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(d)) {
            for (Path p : ds) {
                if (Files.isRegularFile(p)) result.add(p.getFileName().toString());
            }
        }
        Collections.sort(result);
        return result;
    }

    @Override
    public String currentDirectory() {
        return Paths.get("").toAbsolutePath().toString();
    }

    @Override
    public String newUniqueId() {
        return UUID.randomUUID().toString();
    }

    @Override
    public long now() {
        return System.currentTimeMillis();
    }
}
