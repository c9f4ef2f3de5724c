package io.github.eutro.phpir.symbols;

import com.google.common.base.Preconditions;

/**
 * A compiled source file, by its path relative to the project root.
 */
public final class SourceFile {
    private final String path;

    public SourceFile(String path) {
        this.path = Preconditions.checkNotNull(path, "path").replace('\\', '/');
    }

    public String getPath() {
        return path;
    }

    /**
     * Get the name of the file, without its directory.
     *
     * @return The file name.
     */
    public String fileName() {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    /**
     * Get the directory of the file, {@code ""} for files at the root.
     *
     * @return The directory.
     */
    public String directory() {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    @Override
    public String toString() {
        return path;
    }
}
