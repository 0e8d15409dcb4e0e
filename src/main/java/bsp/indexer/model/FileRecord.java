package bsp.indexer.model;

import java.util.Objects;

/**
 * Row for the {@code files} table.
 */
public record FileRecord(
        String path,        // project-relative, '/' separated
        String name,
        FileFormat format,
        long size,
        long mtime          // epoch seconds
) {
    public FileRecord {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(format, "format");
    }
}
