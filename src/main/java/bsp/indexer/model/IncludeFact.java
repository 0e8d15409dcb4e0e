package bsp.indexer.model;

import java.util.Objects;

/**
 * A reference from the current file to another path, as written in source.
 */
public record IncludeFact(
        String toPath,
        IncludeKind kind,
        int line
) {
    public IncludeFact {
        Objects.requireNonNull(toPath, "toPath");
        Objects.requireNonNull(kind, "kind");
    }
}
