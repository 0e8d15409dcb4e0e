package bsp.indexer.model;

import java.util.Objects;

/**
 * A named fact found on one source line.
 */
public record SymbolFact(
        String name,
        String value,   // may be null, already truncated
        SymbolKind kind,
        int line        // 1-based
) {
    public SymbolFact {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
    }
}
