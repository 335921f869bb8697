public final class PathSet {
    public final String separator;
    public final String baseDir;
    public final String storageDir;
    public final String contentDir;
    public final String assetDir;
    public final String workspaceFile;
    public final String configFile;
    private final String recordExtension;

    PathSet(String baseDir, String separator, StorageSettings settings) {
        this.separator = separator;
        this.baseDir = baseDir;
        storageDir = join(baseDir, settings.dirName());
        contentDir = join(storageDir, settings.contentDirName());
        assetDir = join(storageDir, settings.assetDirName());
        workspaceFile = join(storageDir, settings.workspaceFileName());
        configFile = join(storageDir, settings.configFileName());
        recordExtension = settings.recordExtension();
    }

    public String contentFile(String noteId) {
        return join(contentDir, noteId + "." + recordExtension);
    }

    public String assetFile(String fileName) {
        return join(assetDir, fileName);
    }

    /** Inverse of {@link #contentFile}; null when the name is not a record file. */
    public String noteIdOf(String fileName) {
        String suffix = "." + recordExtension;
        if (fileName == null || !fileName.endsWith(suffix) || fileName.length() == suffix.length()) return null;
        return fileName.substring(0, fileName.length() - suffix.length());
    }

    private String join(String dir, String name) {
        return dir + separator + name;
    }
}
